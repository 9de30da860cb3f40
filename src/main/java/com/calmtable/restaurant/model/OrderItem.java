package com.calmtable.restaurant.model;

import com.calmtable.restaurant.util.MoneyConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * One cart line appended to an order. Name and unit price are copied from the menu at checkout
 * time, so later menu edits never change an existing order.
 */
@Entity
@Table(name = "order_items")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OrderItem {

    public static final int MIN_QUANTITY = 1;
    public static final int MAX_QUANTITY = 50;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "order_id", nullable = false)
    private Long orderId;

    @Column(name = "menu_item_id")
    private Long menuItemId;

    @Column(name = "item_name", nullable = false, length = 200)
    private String itemName;

    @Convert(converter = MoneyConverter.class)
    @Column(name = "unit_price", nullable = false)
    private BigDecimal unitPrice;

    @Column(nullable = false)
    private Integer quantity;

    @Convert(converter = MoneyConverter.class)
    @Column(name = "line_total", nullable = false)
    private BigDecimal lineTotal;

    public static OrderItem snapshot(Long orderId, Long menuItemId, String itemName, BigDecimal unitPrice, int quantity) {
        OrderItem item = new OrderItem();
        item.setOrderId(orderId);
        item.setMenuItemId(menuItemId);
        item.setItemName(itemName);
        BigDecimal price = unitPrice.setScale(MoneyConverter.SCALE, RoundingMode.HALF_UP);
        item.setUnitPrice(price);
        item.setQuantity(quantity);
        item.setLineTotal(price.multiply(BigDecimal.valueOf(quantity)));
        return item;
    }
}
