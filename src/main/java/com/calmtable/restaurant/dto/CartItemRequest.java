package com.calmtable.restaurant.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Either {@code menu_item_id} or an ad-hoc {@code name} with {@code price}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CartItemRequest {
    @JsonProperty("menu_item_id")
    private Long menuItemId;

    private String name;

    private BigDecimal price;

    private Integer quantity;

    public static CartItemRequest ofMenuItem(Long menuItemId, int quantity) {
        return new CartItemRequest(menuItemId, null, null, quantity);
    }

    public static CartItemRequest adHoc(String name, BigDecimal price, int quantity) {
        return new CartItemRequest(null, name, price, quantity);
    }
}
