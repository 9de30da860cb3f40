package com.calmtable.restaurant.dto;

import com.calmtable.restaurant.model.MenuCategory;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;
import java.util.Set;

@Data
public class MenuItemRequest {
    @NotBlank
    @Size(max = 200)
    private String name;

    private String description;

    @NotNull
    @DecimalMin("0.00")
    @Digits(integer = 8, fraction = 2)
    private BigDecimal price;

    @NotNull
    private MenuCategory category;

    @JsonProperty("is_available")
    private Boolean available;

    @JsonProperty("is_featured")
    private Boolean featured;

    @JsonProperty("dietary_tags")
    private Set<String> dietaryTags;

    @JsonProperty("image_url")
    private String imageUrl;
}
