package com.calmtable.restaurant.service;

import com.calmtable.restaurant.dto.MenuItemDto;
import com.calmtable.restaurant.dto.MenuItemRequest;
import com.calmtable.restaurant.exception.NotFoundException;
import com.calmtable.restaurant.model.MenuCategory;
import com.calmtable.restaurant.model.MenuItem;
import com.calmtable.restaurant.model.Order;
import com.calmtable.restaurant.model.OrderItem;
import com.calmtable.restaurant.model.OrderStatus;
import com.calmtable.restaurant.repository.MenuItemRepository;
import com.calmtable.restaurant.repository.OrderItemRepository;
import com.calmtable.restaurant.repository.OrderRepository;
import com.calmtable.restaurant.repository.ReviewRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

@Service
public class MenuService {

    private static final Logger logger = LoggerFactory.getLogger(MenuService.class);
    static final int BEST_ORDERED_LIMIT = 10;

    private final MenuItemRepository menuItemRepository;
    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;
    private final ReviewRepository reviewRepository;
    private final Clock clock;

    public MenuService(MenuItemRepository menuItemRepository,
                       OrderRepository orderRepository,
                       OrderItemRepository orderItemRepository,
                       ReviewRepository reviewRepository,
                       Clock clock) {
        this.menuItemRepository = menuItemRepository;
        this.orderRepository = orderRepository;
        this.orderItemRepository = orderItemRepository;
        this.reviewRepository = reviewRepository;
        this.clock = clock;
    }

    /** Available items, optionally narrowed by category and a dietary tag. */
    public List<MenuItemDto> listMenu(MenuCategory category, String dietaryTag) {
        List<MenuItem> items = category == null
                ? menuItemRepository.findByAvailableTrueOrderByCategoryAscNameAsc()
                : menuItemRepository.findByCategoryAndAvailableTrueOrderByNameAsc(category);
        if (dietaryTag != null && !dietaryTag.isBlank()) {
            String wanted = dietaryTag.trim().toLowerCase(Locale.ROOT);
            items = items.stream()
                    .filter(item -> item.getDietaryTags() != null && item.getDietaryTags().stream()
                            .anyMatch(tag -> tag.equalsIgnoreCase(wanted)))
                    .toList();
        }
        return toDtos(items);
    }

    public List<MenuItemDto> listAllForStaff() {
        return toDtos(menuItemRepository.findAllByOrderByCategoryAscNameAsc());
    }

    public List<MenuItemDto> featured() {
        return toDtos(menuItemRepository.findByFeaturedTrueAndAvailableTrueOrderByNameAsc());
    }

    /**
     * Available items ranked by quantity sold on settled orders. Falls back to the featured list
     * while nothing has been sold yet.
     */
    public List<MenuItemDto> bestOrdered() {
        List<Long> settledOrderIds = orderRepository.findByStatusIn(OrderStatus.SETTLED).stream()
                .map(Order::getId)
                .toList();
        Map<Long, Integer> soldByMenuItem = new HashMap<>();
        if (!settledOrderIds.isEmpty()) {
            for (OrderItem line : orderItemRepository.findByOrderIdIn(settledOrderIds)) {
                if (line.getMenuItemId() != null) {
                    soldByMenuItem.merge(line.getMenuItemId(), line.getQuantity(), Integer::sum);
                }
            }
        }

        List<MenuItem> ranked = menuItemRepository.findByAvailableTrueOrderByCategoryAscNameAsc().stream()
                .filter(item -> soldByMenuItem.getOrDefault(item.getId(), 0) > 0)
                .sorted(Comparator.<MenuItem>comparingInt(item -> soldByMenuItem.get(item.getId())).reversed()
                        .thenComparing(MenuItem::getName))
                .limit(BEST_ORDERED_LIMIT)
                .toList();
        if (ranked.isEmpty()) {
            return featured().stream().limit(BEST_ORDERED_LIMIT).toList();
        }
        return toDtos(ranked);
    }

    public MenuItemDto getItem(Long id) {
        MenuItem item = menuItemRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Menu item not found"));
        return toDtos(List.of(item)).get(0);
    }

    @Transactional
    public MenuItemDto createItem(MenuItemRequest request) {
        MenuItem item = new MenuItem();
        apply(item, request);
        item.setCreatedAt(LocalDateTime.now(clock));
        MenuItem saved = menuItemRepository.save(item);
        logger.info("[MenuService] Created menu item {} ({})", saved.getId(), saved.getName());
        return MenuItemDto.from(saved);
    }

    @Transactional
    public MenuItemDto updateItem(Long id, MenuItemRequest request) {
        MenuItem item = menuItemRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Menu item not found"));
        apply(item, request);
        return MenuItemDto.from(menuItemRepository.save(item));
    }

    @Transactional
    public MenuItemDto setAvailability(Long id, boolean available) {
        MenuItem item = menuItemRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Menu item not found"));
        item.setAvailable(available);
        logger.info("[MenuService] Menu item {} availability set to {}", id, available);
        return MenuItemDto.from(menuItemRepository.save(item));
    }

    private static void apply(MenuItem item, MenuItemRequest request) {
        item.setName(request.getName().trim());
        item.setDescription(request.getDescription());
        item.setPrice(request.getPrice());
        item.setCategory(request.getCategory());
        if (request.getAvailable() != null) {
            item.setAvailable(request.getAvailable());
        }
        if (request.getFeatured() != null) {
            item.setFeatured(request.getFeatured());
        }
        if (request.getDietaryTags() != null) {
            item.setDietaryTags(request.getDietaryTags().stream()
                    .filter(tag -> tag != null && !tag.isBlank())
                    .map(tag -> tag.trim().toLowerCase(Locale.ROOT))
                    .collect(Collectors.toCollection(LinkedHashSet::new)));
        }
        item.setImageUrl(request.getImageUrl());
    }

    private List<MenuItemDto> toDtos(List<MenuItem> items) {
        Map<Long, Double> ratings = new HashMap<>();
        for (Object[] row : reviewRepository.averageRatingByMenuItem()) {
            ratings.put(((Number) row[0]).longValue(), ((Number) row[1]).doubleValue());
        }
        return items.stream()
                .map(item -> {
                    MenuItemDto dto = MenuItemDto.from(item);
                    dto.setAverageRating(ratings.get(item.getId()));
                    return dto;
                })
                .toList();
    }
}
