package com.calmtable.restaurant.dto;

import com.calmtable.restaurant.model.AdminNotification;
import com.calmtable.restaurant.model.NotificationType;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

@Data
@NoArgsConstructor
public class NotificationDto {
    private Long id;

    @JsonProperty("order_id")
    private Long orderId;

    private String title;
    private String message;

    @JsonProperty("notification_type")
    private NotificationType type;

    private Map<String, Object> payload;

    @JsonProperty("is_read")
    private boolean read;

    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    public static NotificationDto from(AdminNotification notification) {
        NotificationDto dto = new NotificationDto();
        dto.setId(notification.getId());
        dto.setOrderId(notification.getOrderId());
        dto.setTitle(notification.getTitle());
        dto.setMessage(notification.getMessage());
        dto.setType(notification.getType());
        dto.setPayload(notification.getPayload());
        dto.setRead(Boolean.TRUE.equals(notification.getRead()));
        dto.setCreatedAt(notification.getCreatedAt());
        return dto;
    }
}
