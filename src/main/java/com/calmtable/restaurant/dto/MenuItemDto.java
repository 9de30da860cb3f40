package com.calmtable.restaurant.dto;

import com.calmtable.restaurant.model.MenuCategory;
import com.calmtable.restaurant.model.MenuItem;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.Set;

@Data
@NoArgsConstructor
public class MenuItemDto {
    private Long id;
    private String name;
    private String description;
    private BigDecimal price;
    private MenuCategory category;

    @JsonProperty("is_available")
    private boolean available;

    @JsonProperty("is_featured")
    private boolean featured;

    @JsonProperty("dietary_tags")
    private Set<String> dietaryTags;

    @JsonProperty("image_url")
    private String imageUrl;

    @JsonProperty("average_rating")
    private Double averageRating;

    public static MenuItemDto from(MenuItem item) {
        MenuItemDto dto = new MenuItemDto();
        dto.setId(item.getId());
        dto.setName(item.getName());
        dto.setDescription(item.getDescription());
        dto.setPrice(item.getPrice());
        dto.setCategory(item.getCategory());
        dto.setAvailable(Boolean.TRUE.equals(item.getAvailable()));
        dto.setFeatured(Boolean.TRUE.equals(item.getFeatured()));
        dto.setDietaryTags(item.getDietaryTags() == null ? new LinkedHashSet<>() : new LinkedHashSet<>(item.getDietaryTags()));
        dto.setImageUrl(item.getImageUrl());
        return dto;
    }
}
