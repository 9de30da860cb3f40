package com.calmtable.restaurant.controller;

import com.calmtable.restaurant.dto.NotificationDto;
import com.calmtable.restaurant.exception.AuthenticationRequiredException;
import com.calmtable.restaurant.notification.NotificationService;
import com.calmtable.restaurant.util.AuthenticationUtils;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/notifications")
public class NotificationController {

    private final NotificationService notificationService;

    public NotificationController(NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @GetMapping
    public ResponseEntity<List<NotificationDto>> list(Authentication authentication) {
        Long recipientId = requireCaller(authentication);
        return ResponseEntity.ok(notificationService.listFor(recipientId).stream().map(NotificationDto::from).toList());
    }

    @GetMapping("/unread-count")
    public ResponseEntity<Map<String, Long>> unreadCount(Authentication authentication) {
        return ResponseEntity.ok(Map.of("unread", notificationService.unreadCount(requireCaller(authentication))));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<NotificationDto> markRead(@PathVariable Long id,
                                                    @RequestBody(required = false) Map<String, Boolean> body,
                                                    Authentication authentication) {
        boolean read = body == null || body.getOrDefault("is_read", Boolean.TRUE);
        return ResponseEntity.ok(NotificationDto.from(
                notificationService.markRead(requireCaller(authentication), id, read)));
    }

    @PostMapping("/mark-all-read")
    public ResponseEntity<Map<String, Integer>> markAllRead(Authentication authentication) {
        return ResponseEntity.ok(Map.of("updated", notificationService.markAllRead(requireCaller(authentication))));
    }

    private static Long requireCaller(Authentication authentication) {
        Long callerId = AuthenticationUtils.callerId(authentication);
        if (callerId == null) {
            throw new AuthenticationRequiredException();
        }
        return callerId;
    }
}
