package com.calmtable.restaurant.dto;

import com.calmtable.restaurant.model.Review;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReviewResponse {
    private Long id;

    @JsonProperty("menu_item_id")
    private Long menuItemId;

    @JsonProperty("user_id")
    private Long userId;

    private Integer rating;
    private String comment;

    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    public static ReviewResponse from(Review review) {
        return new ReviewResponse(review.getId(), review.getMenuItemId(), review.getUserId(), review.getRating(),
                review.getComment(), review.getCreatedAt());
    }
}
