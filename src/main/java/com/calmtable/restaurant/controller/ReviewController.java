package com.calmtable.restaurant.controller;

import com.calmtable.restaurant.dto.ReviewRequest;
import com.calmtable.restaurant.dto.ReviewResponse;
import com.calmtable.restaurant.service.ReviewService;
import com.calmtable.restaurant.util.AuthenticationUtils;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/reviews")
public class ReviewController {

    private final ReviewService reviewService;

    public ReviewController(ReviewService reviewService) {
        this.reviewService = reviewService;
    }

    @PostMapping
    public ResponseEntity<ReviewResponse> create(@Valid @RequestBody ReviewRequest request, Authentication authentication) {
        Long callerId = AuthenticationUtils.callerId(authentication);
        return ResponseEntity.status(HttpStatus.CREATED).body(ReviewResponse.from(
                reviewService.createReview(callerId, request.getMenuItemId(), request.getRating(), request.getComment())));
    }

    @GetMapping
    public ResponseEntity<List<ReviewResponse>> list(@RequestParam(name = "menu_item", required = false) Long menuItemId) {
        return ResponseEntity.ok(reviewService.listReviews(menuItemId).stream().map(ReviewResponse::from).toList());
    }

    @GetMapping("/eligibility")
    public ResponseEntity<Map<String, Boolean>> eligibility(Authentication authentication) {
        return ResponseEntity.ok(Map.of("can_review", reviewService.canReview(AuthenticationUtils.callerId(authentication))));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id, Authentication authentication) {
        reviewService.deleteReview(AuthenticationUtils.callerId(authentication), id);
        return ResponseEntity.noContent().build();
    }
}
