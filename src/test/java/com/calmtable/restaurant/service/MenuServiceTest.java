package com.calmtable.restaurant.service;

import com.calmtable.restaurant.dto.MenuItemDto;
import com.calmtable.restaurant.model.MenuCategory;
import com.calmtable.restaurant.model.MenuItem;
import com.calmtable.restaurant.model.Order;
import com.calmtable.restaurant.model.OrderItem;
import com.calmtable.restaurant.model.OrderStatus;
import com.calmtable.restaurant.repository.MenuItemRepository;
import com.calmtable.restaurant.repository.OrderItemRepository;
import com.calmtable.restaurant.repository.OrderRepository;
import com.calmtable.restaurant.repository.ReviewRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class MenuServiceTest {

    @Mock
    private MenuItemRepository menuItemRepository;
    @Mock
    private OrderRepository orderRepository;
    @Mock
    private OrderItemRepository orderItemRepository;
    @Mock
    private ReviewRepository reviewRepository;

    private MenuService service;
    private MenuItem risotto;
    private MenuItem salad;
    private MenuItem tart;

    @BeforeEach
    void setUp() {
        service = new MenuService(menuItemRepository, orderRepository, orderItemRepository, reviewRepository,
                Clock.systemUTC());
        risotto = item(1L, "Risotto", MenuCategory.MAINS, Set.of("vegetarian"), false);
        salad = item(2L, "Garden Salad", MenuCategory.STARTERS, Set.of("vegan", "gluten-free"), true);
        tart = item(3L, "Lemon Tart", MenuCategory.DESSERTS, Set.of(), false);
        when(menuItemRepository.findByAvailableTrueOrderByCategoryAscNameAsc()).thenReturn(List.of(risotto, salad, tart));
        when(menuItemRepository.findByFeaturedTrueAndAvailableTrueOrderByNameAsc()).thenReturn(List.of(salad));

        List<Object[]> ratings = new ArrayList<>();
        ratings.add(new Object[]{1L, 4.5});
        when(reviewRepository.averageRatingByMenuItem()).thenReturn(ratings);
    }

    private static MenuItem item(Long id, String name, MenuCategory category, Set<String> tags, boolean featured) {
        MenuItem item = new MenuItem();
        item.setId(id);
        item.setName(name);
        item.setCategory(category);
        item.setPrice(new BigDecimal("12.00"));
        item.setDietaryTags(tags);
        item.setFeatured(featured);
        return item;
    }

    private static Order settled(Long id) {
        Order order = new Order();
        order.setId(id);
        order.setStatus(OrderStatus.COMPLETED);
        return order;
    }

    @Test
    void dietaryTagFilterIgnoresCase() {
        List<MenuItemDto> vegan = service.listMenu(null, "Vegan");

        assertThat(vegan).extracting(MenuItemDto::getName).containsExactly("Garden Salad");
    }

    @Test
    void averageRatingIsAttached() {
        List<MenuItemDto> menu = service.listMenu(null, null);

        assertThat(menu.get(0).getAverageRating()).isEqualTo(4.5);
        assertThat(menu.get(1).getAverageRating()).isNull();
    }

    @Test
    void bestOrderedRanksBySettledQuantity() {
        when(orderRepository.findByStatusIn(any())).thenReturn(List.of(settled(10L), settled(11L)));
        when(orderItemRepository.findByOrderIdIn(List.of(10L, 11L))).thenReturn(List.of(
                OrderItem.snapshot(10L, 3L, "Lemon Tart", new BigDecimal("8.00"), 2),
                OrderItem.snapshot(10L, 1L, "Risotto", new BigDecimal("12.00"), 1),
                OrderItem.snapshot(11L, 3L, "Lemon Tart", new BigDecimal("8.00"), 1),
                OrderItem.snapshot(11L, null, "Bread basket", new BigDecimal("3.00"), 9)));

        assertThat(service.bestOrdered()).extracting(MenuItemDto::getName).containsExactly("Lemon Tart", "Risotto");
    }

    @Test
    void bestOrderedFallsBackToFeaturedWithoutSales() {
        when(orderRepository.findByStatusIn(any())).thenReturn(List.of());

        assertThat(service.bestOrdered()).extracting(MenuItemDto::getName).containsExactly("Garden Salad");
        verify(orderItemRepository, never()).findByOrderIdIn(any());
    }
}
