package com.calmtable.restaurant.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReviewRequest {
    @NotNull
    @JsonProperty("menu_item_id")
    private Long menuItemId;

    @NotNull
    private Integer rating;

    private String comment;
}
