package com.calmtable.restaurant.service;

import com.calmtable.restaurant.dto.CartItemRequest;
import com.calmtable.restaurant.dto.CheckoutRequest;
import com.calmtable.restaurant.dto.OrderResponse;
import com.calmtable.restaurant.event.OrderPlacedEvent;
import com.calmtable.restaurant.event.OrderStatusChangedEvent;
import com.calmtable.restaurant.exception.ForbiddenRoleException;
import com.calmtable.restaurant.exception.InvalidCartItemException;
import com.calmtable.restaurant.exception.MissingContactInfoException;
import com.calmtable.restaurant.exception.ValidationException;
import com.calmtable.restaurant.model.MenuCategory;
import com.calmtable.restaurant.model.MenuItem;
import com.calmtable.restaurant.model.Order;
import com.calmtable.restaurant.model.OrderItem;
import com.calmtable.restaurant.model.OrderStatus;
import com.calmtable.restaurant.model.User;
import com.calmtable.restaurant.payment.PaymentException;
import com.calmtable.restaurant.payment.PaymentGateway;
import com.calmtable.restaurant.payment.PaymentIntent;
import com.calmtable.restaurant.repository.MenuItemRepository;
import com.calmtable.restaurant.repository.OrderItemRepository;
import com.calmtable.restaurant.repository.OrderRepository;
import com.calmtable.restaurant.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.transaction.PlatformTransactionManager;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class OrderServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-10T12:00:00Z"), ZoneOffset.UTC);

    @Mock
    private OrderRepository orderRepository;
    @Mock
    private OrderItemRepository orderItemRepository;
    @Mock
    private MenuItemRepository menuItemRepository;
    @Mock
    private UserRepository userRepository;
    @Mock
    private PaymentGateway paymentGateway;
    @Mock
    private ApplicationEventPublisher eventPublisher;
    @Mock
    private PlatformTransactionManager transactionManager;

    private OrderService service;
    private User customer;
    private final List<OrderItem> storedItems = new ArrayList<>();
    private final AtomicLong ids = new AtomicLong(100);

    @BeforeEach
    void setUp() {
        LockedTransactionRunner runner = new LockedTransactionRunner(new KeyedLockRegistry(), transactionManager, 3, 1);
        service = new OrderService(orderRepository, orderItemRepository, menuItemRepository, new OrderNumberGenerator(),
                runner, new CallerResolver(userRepository), paymentGateway, eventPublisher, CLOCK);

        customer = new User();
        customer.setId(1L);
        customer.setEmail("diner@calmtable.test");
        customer.setFirstName("Jo");
        customer.setLastName("Lee");
        customer.setRole(User.ROLE_CUSTOMER);
        when(userRepository.findById(1L)).thenReturn(Optional.of(customer));

        when(menuItemRepository.findById(10L)).thenReturn(Optional.of(menuItem(10L, "Dish A", "7000.00", true)));
        when(menuItemRepository.findById(11L)).thenReturn(Optional.of(menuItem(11L, "Dish B", "3500.00", true)));
        when(menuItemRepository.findById(12L)).thenReturn(Optional.of(menuItem(12L, "Seasonal Tart", "9.00", false)));

        when(orderRepository.existsByOrderNumber(anyString())).thenReturn(false);
        when(orderRepository.save(any(Order.class))).thenAnswer(invocation -> {
            Order order = invocation.getArgument(0);
            if (order.getId() == null) {
                order.setId(ids.incrementAndGet());
            }
            return order;
        });
        when(orderItemRepository.save(any(OrderItem.class))).thenAnswer(invocation -> {
            OrderItem item = invocation.getArgument(0);
            item.setId(ids.incrementAndGet());
            storedItems.add(item);
            return item;
        });
        when(orderItemRepository.findByOrderIdOrderByIdAsc(anyLong())).thenAnswer(invocation -> {
            Long orderId = invocation.getArgument(0);
            return storedItems.stream().filter(i -> orderId.equals(i.getOrderId())).toList();
        });
        when(paymentGateway.createIntent(anyLong(), anyString(), any()))
                .thenReturn(new PaymentIntent(null, "test_client_secret_order_1"));
    }

    private static MenuItem menuItem(Long id, String name, String price, boolean available) {
        MenuItem item = new MenuItem();
        item.setId(id);
        item.setName(name);
        item.setPrice(new BigDecimal(price));
        item.setCategory(MenuCategory.MAINS);
        item.setAvailable(available);
        return item;
    }

    private static CheckoutRequest checkout(CartItemRequest... items) {
        return new CheckoutRequest(new ArrayList<>(List.of(items)), null);
    }

    @Test
    void firstCheckoutOpensPendingOrder() {
        when(orderRepository.findFirstByUserIdAndStatusOrderByCreatedAtDescIdDesc(1L, OrderStatus.PENDING))
                .thenReturn(Optional.empty());

        OrderResponse response = service.placeOrder(1L, checkout(CartItemRequest.ofMenuItem(10L, 1)));

        assertThat(response.getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(response.getOrderNumber()).startsWith("CT-");
        assertThat(response.getCustomerEmail()).isEqualTo("diner@calmtable.test");
        assertThat(response.getTotalAmount()).isEqualByComparingTo("7000.00");
        assertThat(response.getClientSecret()).isEqualTo("test_client_secret_order_1");
        verify(eventPublisher).publishEvent(any(OrderPlacedEvent.class));
    }

    @Test
    void secondCheckoutAppendsToExistingPendingOrder() {
        Order[] pending = new Order[1];
        when(orderRepository.findFirstByUserIdAndStatusOrderByCreatedAtDescIdDesc(1L, OrderStatus.PENDING))
                .thenAnswer(invocation -> Optional.ofNullable(pending[0]));

        OrderResponse first = service.placeOrder(1L, checkout(
                CartItemRequest.ofMenuItem(10L, 1), CartItemRequest.ofMenuItem(11L, 2)));
        pending[0] = new Order();
        pending[0].setId(first.getId());
        pending[0].setOrderNumber(first.getOrderNumber());
        pending[0].setUserId(1L);
        pending[0].setStatus(OrderStatus.PENDING);

        OrderResponse second = service.placeOrder(1L, checkout(CartItemRequest.ofMenuItem(11L, 1)));

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(second.getItems()).hasSize(3);
        assertThat(second.getTotalAmount()).isEqualByComparingTo("17500");
        // backfilled from the account
        assertThat(second.getCustomerEmail()).isEqualTo("diner@calmtable.test");
        verify(eventPublisher, times(2)).publishEvent(any(OrderPlacedEvent.class));
    }

    @Test
    void unavailableItemRejectsWholeCartBeforeAnyWrite() {
        assertThrows(InvalidCartItemException.class, () -> service.placeOrder(1L, checkout(
                CartItemRequest.ofMenuItem(10L, 1), CartItemRequest.ofMenuItem(12L, 1))));

        verify(orderRepository, never()).save(any());
        verify(orderItemRepository, never()).save(any());
        verify(eventPublisher, never()).publishEvent(any());
    }

    @Test
    void unknownMenuItemIsInvalidCartItem() {
        when(menuItemRepository.findById(99L)).thenReturn(Optional.empty());

        assertThrows(InvalidCartItemException.class,
                () -> service.placeOrder(1L, checkout(CartItemRequest.ofMenuItem(99L, 1))));
    }

    @Test
    void adHocItemNeedsPrice() {
        assertThrows(InvalidCartItemException.class,
                () -> service.placeOrder(1L, checkout(CartItemRequest.adHoc("Bread basket", null, 1))));
        assertThrows(InvalidCartItemException.class,
                () -> service.placeOrder(1L, checkout(CartItemRequest.adHoc("Bread basket", new BigDecimal("-1"), 1))));
    }

    @Test
    void adHocPriceIsLimitedToCents() {
        assertThrows(InvalidCartItemException.class,
                () -> service.placeOrder(1L, checkout(CartItemRequest.adHoc("Corkage", new BigDecimal("0.005"), 1))));
        verify(orderItemRepository, never()).save(any(OrderItem.class));

        OrderResponse response = service.placeOrder(1L,
                checkout(CartItemRequest.adHoc("Corkage", new BigDecimal("1.500"), 3)));

        assertThat(storedItems).singleElement().satisfies(item -> {
            assertThat(item.getUnitPrice()).isEqualTo(new BigDecimal("1.50"));
            assertThat(item.getLineTotal()).isEqualTo(new BigDecimal("4.50"));
        });
        assertThat(response.getTotalAmount()).isEqualByComparingTo("4.50");
    }

    @Test
    void adHocItemIsSnapshotWithoutMenuReference() {
        OrderResponse response = service.placeOrder(1L,
                checkout(CartItemRequest.adHoc("Bread basket", new BigDecimal("4.25"), 2)));

        assertThat(storedItems).singleElement().satisfies(item -> {
            assertThat(item.getMenuItemId()).isNull();
            assertThat(item.getItemName()).isEqualTo("Bread basket");
        });
        assertThat(response.getTotalAmount()).isEqualByComparingTo("8.50");
    }

    @Test
    void emptyCartAndBadQuantityAreValidationErrors() {
        assertThrows(ValidationException.class, () -> service.placeOrder(1L, checkout()));
        assertThrows(ValidationException.class,
                () -> service.placeOrder(1L, checkout(CartItemRequest.ofMenuItem(10L, 0))));
        assertThrows(ValidationException.class,
                () -> service.placeOrder(1L, checkout(CartItemRequest.ofMenuItem(10L, 51))));
    }

    @Test
    void staffCannotCheckOut() {
        User admin = new User();
        admin.setId(2L);
        admin.setEmail("admin@calmtable.test");
        admin.setRole(User.ROLE_ADMIN);
        when(userRepository.findById(2L)).thenReturn(Optional.of(admin));

        assertThrows(ForbiddenRoleException.class,
                () -> service.placeOrder(2L, checkout(CartItemRequest.ofMenuItem(10L, 1))));
    }

    @Test
    void accountWithoutEmailCannotCheckOut() {
        customer.setEmail(" ");

        assertThrows(MissingContactInfoException.class,
                () -> service.placeOrder(1L, checkout(CartItemRequest.ofMenuItem(10L, 1))));
    }

    @Test
    void paymentFailureStillReturnsOrderWithEmptySecret() {
        when(paymentGateway.createIntent(anyLong(), anyString(), any()))
                .thenThrow(new PaymentException("card network down"));

        OrderResponse response = service.placeOrder(1L, checkout(CartItemRequest.ofMenuItem(10L, 1)));

        assertThat(response.getId()).isNotNull();
        assertThat(response.getClientSecret()).isEmpty();
    }

    @Test
    void paymentIntentIdIsStoredOnOrder() {
        Order stored = new Order();
        stored.setId(101L);
        when(paymentGateway.createIntent(anyLong(), anyString(), any()))
                .thenReturn(new PaymentIntent("pi_123", "pi_123_secret"));
        when(orderRepository.findById(101L)).thenReturn(Optional.of(stored));

        OrderResponse response = service.placeOrder(1L, checkout(CartItemRequest.ofMenuItem(10L, 1)));

        assertThat(response.getId()).isEqualTo(101L);
        assertThat(response.getClientSecret()).isEqualTo("pi_123_secret");
        assertThat(stored.getPaymentIntentId()).isEqualTo("pi_123");
    }

    @Test
    void statusChangePublishesEventForCustomer() {
        Order order = new Order();
        order.setId(5L);
        order.setOrderNumber("CT-00000005");
        order.setUserId(1L);
        order.setStatus(OrderStatus.PENDING);
        when(orderRepository.findById(5L)).thenReturn(Optional.of(order));

        OrderResponse response = service.updateOrderStatus(5L, OrderStatus.PREPARING);

        assertThat(response.getStatus()).isEqualTo(OrderStatus.PREPARING);
        ArgumentCaptor<OrderStatusChangedEvent> event = ArgumentCaptor.forClass(OrderStatusChangedEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().customerId()).isEqualTo(1L);
        assertThat(event.getValue().newStatus()).isEqualTo(OrderStatus.PREPARING);
    }

    @Test
    void customerCannotViewSomeoneElsesOrder() {
        Order order = new Order();
        order.setId(6L);
        order.setUserId(42L);
        when(orderRepository.findById(6L)).thenReturn(Optional.of(order));

        assertThrows(ForbiddenRoleException.class, () -> service.getOrderForCaller(1L, 6L));
        verify(orderItemRepository, never()).findByOrderIdOrderByIdAsc(eq(6L));
    }
}
