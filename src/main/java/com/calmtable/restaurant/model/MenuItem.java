package com.calmtable.restaurant.model;

import com.calmtable.restaurant.util.MoneyConverter;
import com.calmtable.restaurant.util.StringSetConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Set;

@Entity
@Table(name = "menu_items")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MenuItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Convert(converter = MoneyConverter.class)
    @Column(nullable = false)
    private BigDecimal price;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private MenuCategory category;

    @Column(name = "is_available", nullable = false)
    private Boolean available = Boolean.TRUE;

    @Column(name = "is_featured", nullable = false)
    private Boolean featured = Boolean.FALSE;

    @Convert(converter = StringSetConverter.class)
    @Column(name = "dietary_tags", columnDefinition = "TEXT")
    private Set<String> dietaryTags = new LinkedHashSet<>();

    @Column(name = "image_url")
    private String imageUrl;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public boolean isOrderable() {
        return Boolean.TRUE.equals(available);
    }
}
