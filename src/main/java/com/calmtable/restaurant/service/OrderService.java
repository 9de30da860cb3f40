package com.calmtable.restaurant.service;

import com.calmtable.restaurant.dto.CartItemRequest;
import com.calmtable.restaurant.dto.CheckoutRequest;
import com.calmtable.restaurant.dto.OrderResponse;
import com.calmtable.restaurant.event.OrderPlacedEvent;
import com.calmtable.restaurant.event.OrderStatusChangedEvent;
import com.calmtable.restaurant.exception.ForbiddenRoleException;
import com.calmtable.restaurant.exception.InvalidCartItemException;
import com.calmtable.restaurant.exception.MissingContactInfoException;
import com.calmtable.restaurant.exception.NotFoundException;
import com.calmtable.restaurant.exception.ValidationException;
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
import com.calmtable.restaurant.util.MoneyConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Service
public class OrderService {

    private static final Logger logger = LoggerFactory.getLogger(OrderService.class);
    private static final int MAX_ORDER_NUMBER_ATTEMPTS = 5;

    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;
    private final MenuItemRepository menuItemRepository;
    private final OrderNumberGenerator orderNumberGenerator;
    private final LockedTransactionRunner transactionRunner;
    private final CallerResolver callerResolver;
    private final PaymentGateway paymentGateway;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public OrderService(OrderRepository orderRepository,
                        OrderItemRepository orderItemRepository,
                        MenuItemRepository menuItemRepository,
                        OrderNumberGenerator orderNumberGenerator,
                        LockedTransactionRunner transactionRunner,
                        CallerResolver callerResolver,
                        PaymentGateway paymentGateway,
                        ApplicationEventPublisher eventPublisher,
                        Clock clock) {
        this.orderRepository = orderRepository;
        this.orderItemRepository = orderItemRepository;
        this.menuItemRepository = menuItemRepository;
        this.orderNumberGenerator = orderNumberGenerator;
        this.transactionRunner = transactionRunner;
        this.callerResolver = callerResolver;
        this.paymentGateway = paymentGateway;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * Adds the cart to the caller's open order, creating that order when none is pending.
     * Every line is validated before anything is written, and all writes share one
     * transaction, so a bad line leaves storage untouched.
     */
    public OrderResponse placeOrder(Long callerId, CheckoutRequest request) {
        User customer = callerResolver.requireCustomer(callerId, "place orders");
        if (customer.getEmail() == null || customer.getEmail().isBlank()) {
            throw new MissingContactInfoException("Please set an email address on your account before checkout.");
        }
        List<CartItemRequest> cart = validateCart(request);
        String lockKey = "customer:" + customer.getId();

        Consolidated result = null;
        for (int attempt = 1; result == null; attempt++) {
            try {
                result = transactionRunner.execute(lockKey, () -> consolidate(customer, cart, request.getNotes()));
            } catch (DataIntegrityViolationException e) {
                // Only a fresh order can collide (on its order number); the rollback discarded it
                if (attempt >= MAX_ORDER_NUMBER_ATTEMPTS) {
                    throw e;
                }
                logger.warn("[OrderService] Order number collision for customer {}, retrying ({}/{})",
                        customer.getId(), attempt, MAX_ORDER_NUMBER_ATTEMPTS);
            }
        }

        logger.info("[OrderService] Checkout for customer {} added {} line(s) to order {}, total {}",
                customer.getId(), cart.size(), result.order().getOrderNumber(), result.order().getTotalAmount());

        OrderResponse response = OrderResponse.from(result.order(), result.items());
        response.setClientSecret(requestPayment(lockKey, result.order()));
        return response;
    }

    private List<CartItemRequest> validateCart(CheckoutRequest request) {
        if (request == null || request.getItems() == null || request.getItems().isEmpty()) {
            throw new ValidationException("Cart must contain at least one item");
        }
        List<CartItemRequest> cart = new ArrayList<>();
        for (CartItemRequest item : request.getItems()) {
            if (item == null) {
                throw new InvalidCartItemException("Cart item is empty");
            }
            int quantity = item.getQuantity() == null ? 1 : item.getQuantity();
            if (quantity < OrderItem.MIN_QUANTITY || quantity > OrderItem.MAX_QUANTITY) {
                throw new ValidationException("Quantity must be between " + OrderItem.MIN_QUANTITY
                        + " and " + OrderItem.MAX_QUANTITY);
            }
            if (item.getMenuItemId() == null) {
                if (item.getName() == null || item.getName().isBlank()) {
                    throw new InvalidCartItemException("Each item must include menu_item_id or name.");
                }
                if (item.getPrice() == null) {
                    throw new InvalidCartItemException("Price is required when menu_item_id is not provided.");
                }
                if (item.getPrice().signum() < 0) {
                    throw new InvalidCartItemException("Price cannot be negative.");
                }
                if (item.getPrice().stripTrailingZeros().scale() > MoneyConverter.SCALE) {
                    throw new InvalidCartItemException("Price cannot have more than 2 decimal places.");
                }
            }
            cart.add(new CartItemRequest(item.getMenuItemId(), item.getName(), item.getPrice(), quantity));
        }
        return cart;
    }

    private Consolidated consolidate(User customer, List<CartItemRequest> cart, String notes) {
        List<ResolvedLine> lines = resolveLines(cart);
        LocalDateTime now = LocalDateTime.now(clock);

        Order order = orderRepository.findFirstByUserIdAndStatusOrderByCreatedAtDescIdDesc(customer.getId(), OrderStatus.PENDING)
                .orElseGet(() -> openOrder(customer, now));
        backfillCustomer(order, customer);
        if ((order.getNotes() == null || order.getNotes().isBlank()) && notes != null && !notes.isBlank()) {
            order.setNotes(notes.trim());
        }

        for (ResolvedLine line : lines) {
            orderItemRepository.save(OrderItem.snapshot(order.getId(), line.menuItemId(), line.name(),
                    line.unitPrice(), line.quantity()));
        }

        List<OrderItem> items = orderItemRepository.findByOrderIdOrderByIdAsc(order.getId());
        BigDecimal total = items.stream()
                .map(OrderItem::getLineTotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        order.setTotalAmount(total);
        order.setUpdatedAt(now);
        Order saved = orderRepository.save(order);

        eventPublisher.publishEvent(OrderPlacedEvent.of(saved.getId(), saved.getOrderNumber(), customer.getId(),
                saved.getCustomerName(), saved.getTotalAmount(), lines.size()));
        return new Consolidated(saved, items);
    }

    private List<ResolvedLine> resolveLines(List<CartItemRequest> cart) {
        List<ResolvedLine> lines = new ArrayList<>();
        for (CartItemRequest item : cart) {
            if (item.getMenuItemId() != null) {
                MenuItem menuItem = menuItemRepository.findById(item.getMenuItemId())
                        .orElseThrow(() -> new InvalidCartItemException(
                                "Menu item " + item.getMenuItemId() + " does not exist."));
                if (!menuItem.isOrderable()) {
                    throw new InvalidCartItemException(menuItem.getName() + " is currently unavailable.");
                }
                lines.add(new ResolvedLine(menuItem.getId(), menuItem.getName(), menuItem.getPrice(), item.getQuantity()));
            } else {
                lines.add(new ResolvedLine(null, item.getName().trim(), item.getPrice(), item.getQuantity()));
            }
        }
        return lines;
    }

    private Order openOrder(User customer, LocalDateTime now) {
        String orderNumber = orderNumberGenerator.generate();
        while (orderRepository.existsByOrderNumber(orderNumber)) {
            orderNumber = orderNumberGenerator.generate();
        }
        Order order = new Order();
        order.setOrderNumber(orderNumber);
        order.setUserId(customer.getId());
        order.setCustomerName(customer.getFullName());
        order.setCustomerEmail(customer.getEmail());
        order.setStatus(OrderStatus.PENDING);
        order.setTotalAmount(BigDecimal.ZERO);
        order.setCreatedAt(now);
        order.setUpdatedAt(now);
        Order saved = orderRepository.save(order);
        logger.info("[OrderService] Opened order {} for customer {}", saved.getOrderNumber(), customer.getId());
        return saved;
    }

    private static void backfillCustomer(Order order, User customer) {
        if (order.getUserId() == null) {
            order.setUserId(customer.getId());
        }
        if (order.getCustomerName() == null || order.getCustomerName().isBlank()) {
            order.setCustomerName(customer.getFullName());
        }
        if (order.getCustomerEmail() == null || order.getCustomerEmail().isBlank()) {
            order.setCustomerEmail(customer.getEmail());
        }
    }

    private String requestPayment(String lockKey, Order order) {
        try {
            PaymentIntent intent = paymentGateway.createIntent(order.getId(), order.getOrderNumber(), order.getTotalAmount());
            if (intent.intentId() != null) {
                transactionRunner.execute(lockKey, () -> {
                    orderRepository.findById(order.getId()).ifPresent(stored -> {
                        stored.setPaymentIntentId(intent.intentId());
                        orderRepository.save(stored);
                    });
                    return null;
                });
            }
            return intent.clientSecret() == null ? "" : intent.clientSecret();
        } catch (PaymentException e) {
            logger.warn("[OrderService] Payment intent unavailable for order {}: {}", order.getOrderNumber(), e.getMessage());
            return "";
        }
    }

    /**
     * Staff override of the order status; the customer is notified only on an actual change.
     */
    public OrderResponse updateOrderStatus(Long orderId, OrderStatus newStatus) {
        if (newStatus == null) {
            throw new ValidationException("Status is required");
        }
        Consolidated result = transactionRunner.execute("order:" + orderId, () -> {
            Order order = orderRepository.findById(orderId)
                    .orElseThrow(() -> new NotFoundException("Order not found"));
            OrderStatus previous = order.getStatus();
            if (previous != newStatus) {
                order.setStatus(newStatus);
                order.setUpdatedAt(LocalDateTime.now(clock));
                order = orderRepository.save(order);
                eventPublisher.publishEvent(OrderStatusChangedEvent.of(order.getId(), order.getOrderNumber(),
                        order.getUserId(), previous, newStatus));
                logger.info("[OrderService] Order {} status {} -> {}", order.getOrderNumber(), previous, newStatus);
            }
            return new Consolidated(order, orderItemRepository.findByOrderIdOrderByIdAsc(order.getId()));
        });
        return OrderResponse.from(result.order(), result.items());
    }

    public List<OrderResponse> findOrdersForCustomer(Long callerId) {
        User user = callerResolver.requireUser(callerId);
        return orderRepository.findByUserIdOrderByCreatedAtDescIdDesc(user.getId()).stream()
                .map(order -> OrderResponse.from(order, orderItemRepository.findByOrderIdOrderByIdAsc(order.getId())))
                .toList();
    }

    public OrderResponse getOrderForCaller(Long callerId, Long orderId) {
        User user = callerResolver.requireUser(callerId);
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new NotFoundException("Order not found"));
        if (!user.isStaff() && !user.getId().equals(order.getUserId())) {
            throw new ForbiddenRoleException("You can only view your own orders");
        }
        return OrderResponse.from(order, orderItemRepository.findByOrderIdOrderByIdAsc(order.getId()));
    }

    public List<OrderResponse> listForStaff(OrderStatus status) {
        List<Order> orders = orderRepository.findAllByOrderByCreatedAtDescIdDesc();
        return orders.stream()
                .filter(order -> status == null || order.getStatus() == status)
                .map(order -> OrderResponse.from(order, orderItemRepository.findByOrderIdOrderByIdAsc(order.getId())))
                .toList();
    }

    private record ResolvedLine(Long menuItemId, String name, BigDecimal unitPrice, int quantity) {
    }

    private record Consolidated(Order order, List<OrderItem> items) {
    }
}
