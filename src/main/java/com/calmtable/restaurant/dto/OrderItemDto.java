package com.calmtable.restaurant.dto;

import com.calmtable.restaurant.model.OrderItem;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OrderItemDto {
    private Long id;

    @JsonProperty("menu_item_id")
    private Long menuItemId;

    @JsonProperty("item_name")
    private String itemName;

    @JsonProperty("unit_price")
    private BigDecimal unitPrice;

    private Integer quantity;

    @JsonProperty("line_total")
    private BigDecimal lineTotal;

    public static OrderItemDto from(OrderItem item) {
        return new OrderItemDto(item.getId(), item.getMenuItemId(), item.getItemName(), item.getUnitPrice(),
                item.getQuantity(), item.getLineTotal());
    }
}
