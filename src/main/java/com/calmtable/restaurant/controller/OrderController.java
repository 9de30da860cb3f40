package com.calmtable.restaurant.controller;

import com.calmtable.restaurant.dto.CheckoutRequest;
import com.calmtable.restaurant.dto.OrderResponse;
import com.calmtable.restaurant.service.OrderService;
import com.calmtable.restaurant.util.AuthenticationUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/orders")
public class OrderController {

    private final OrderService orderService;

    public OrderController(OrderService orderService) {
        this.orderService = orderService;
    }

    @PostMapping
    public ResponseEntity<OrderResponse> checkout(@RequestBody CheckoutRequest request, Authentication authentication) {
        Long callerId = AuthenticationUtils.callerId(authentication);
        return ResponseEntity.status(HttpStatus.CREATED).body(orderService.placeOrder(callerId, request));
    }

    @GetMapping
    public ResponseEntity<List<OrderResponse>> mine(Authentication authentication) {
        return ResponseEntity.ok(orderService.findOrdersForCustomer(AuthenticationUtils.callerId(authentication)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<OrderResponse> get(@PathVariable Long id, Authentication authentication) {
        return ResponseEntity.ok(orderService.getOrderForCaller(AuthenticationUtils.callerId(authentication), id));
    }
}
