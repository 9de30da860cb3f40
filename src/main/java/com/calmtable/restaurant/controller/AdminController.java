package com.calmtable.restaurant.controller;

import com.calmtable.restaurant.dto.AnalyticsResponse;
import com.calmtable.restaurant.dto.MenuItemDto;
import com.calmtable.restaurant.dto.MenuItemRequest;
import com.calmtable.restaurant.dto.OrderResponse;
import com.calmtable.restaurant.dto.ReservationResponse;
import com.calmtable.restaurant.dto.RevenueResponse;
import com.calmtable.restaurant.dto.StatusUpdateRequest;
import com.calmtable.restaurant.model.OrderStatus;
import com.calmtable.restaurant.model.ReservationStatus;
import com.calmtable.restaurant.service.AnalyticsService;
import com.calmtable.restaurant.service.MenuService;
import com.calmtable.restaurant.service.OrderService;
import com.calmtable.restaurant.service.ReservationService;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/admin")
@PreAuthorize("hasAnyRole('ADMIN', 'EMPLOYEE')")
public class AdminController {

    private final ReservationService reservationService;
    private final OrderService orderService;
    private final MenuService menuService;
    private final AnalyticsService analyticsService;

    public AdminController(ReservationService reservationService,
                           OrderService orderService,
                           MenuService menuService,
                           AnalyticsService analyticsService) {
        this.reservationService = reservationService;
        this.orderService = orderService;
        this.menuService = menuService;
        this.analyticsService = analyticsService;
    }

    @GetMapping("/reservations")
    public ResponseEntity<List<ReservationResponse>> reservations(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(required = false) String status) {
        return ResponseEntity.ok(reservationService.listForStaff(date, ReservationStatus.fromJson(status))
                .stream().map(ReservationResponse::from).toList());
    }

    @PatchMapping("/reservations/{id}/status")
    public ResponseEntity<ReservationResponse> updateReservationStatus(@PathVariable Long id,
                                                                       @Valid @RequestBody StatusUpdateRequest request) {
        return ResponseEntity.ok(ReservationResponse.from(
                reservationService.updateReservationStatus(id, ReservationStatus.fromJson(request.getStatus()))));
    }

    @GetMapping("/orders")
    public ResponseEntity<List<OrderResponse>> orders(@RequestParam(required = false) String status) {
        return ResponseEntity.ok(orderService.listForStaff(OrderStatus.fromJson(status)));
    }

    @PatchMapping("/orders/{id}/status")
    public ResponseEntity<OrderResponse> updateOrderStatus(@PathVariable Long id,
                                                           @Valid @RequestBody StatusUpdateRequest request) {
        return ResponseEntity.ok(orderService.updateOrderStatus(id, OrderStatus.fromJson(request.getStatus())));
    }

    @GetMapping("/menu")
    public ResponseEntity<List<MenuItemDto>> menu() {
        return ResponseEntity.ok(menuService.listAllForStaff());
    }

    @PostMapping("/menu")
    public ResponseEntity<MenuItemDto> createMenuItem(@Valid @RequestBody MenuItemRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(menuService.createItem(request));
    }

    @PutMapping("/menu/{id}")
    public ResponseEntity<MenuItemDto> updateMenuItem(@PathVariable Long id, @Valid @RequestBody MenuItemRequest request) {
        return ResponseEntity.ok(menuService.updateItem(id, request));
    }

    @PatchMapping("/menu/{id}/availability")
    public ResponseEntity<MenuItemDto> setAvailability(@PathVariable Long id, @RequestBody Map<String, Boolean> body) {
        boolean available = Boolean.TRUE.equals(body.get("is_available"));
        return ResponseEntity.ok(menuService.setAvailability(id, available));
    }

    @GetMapping("/analytics")
    public ResponseEntity<AnalyticsResponse> analytics() {
        return ResponseEntity.ok(analyticsService.summary());
    }

    @GetMapping("/analytics/orders-per-day")
    public ResponseEntity<List<AnalyticsResponse.DailyCount>> ordersPerDay(
            @RequestParam(defaultValue = "14") int days) {
        return ResponseEntity.ok(analyticsService.ordersPerDay(days));
    }

    @GetMapping("/analytics/revenue")
    public ResponseEntity<RevenueResponse> revenue(@RequestParam(defaultValue = "14") int days) {
        return ResponseEntity.ok(analyticsService.revenue(days));
    }
}
