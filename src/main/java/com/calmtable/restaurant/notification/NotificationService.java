package com.calmtable.restaurant.notification;

import com.calmtable.restaurant.event.OrderPlacedEvent;
import com.calmtable.restaurant.event.OrderStatusChangedEvent;
import com.calmtable.restaurant.exception.NotFoundException;
import com.calmtable.restaurant.model.AdminNotification;
import com.calmtable.restaurant.model.NotificationType;
import com.calmtable.restaurant.model.User;
import com.calmtable.restaurant.repository.AdminNotificationRepository;
import com.calmtable.restaurant.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-app notification rows. Writes run in their own transaction because callers are
 * after-commit listeners whose original transaction has already finished.
 */
@Service
public class NotificationService {

    private static final Logger logger = LoggerFactory.getLogger(NotificationService.class);
    private static final List<String> STAFF_ROLES = List.of(User.ROLE_EMPLOYEE, User.ROLE_ADMIN);

    private final AdminNotificationRepository notificationRepository;
    private final UserRepository userRepository;
    private final TransactionTemplate writeTransaction;
    private final Clock clock;

    public NotificationService(AdminNotificationRepository notificationRepository,
                               UserRepository userRepository,
                               PlatformTransactionManager transactionManager,
                               Clock clock) {
        this.notificationRepository = notificationRepository;
        this.userRepository = userRepository;
        this.writeTransaction = new TransactionTemplate(transactionManager);
        this.writeTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    /**
     * One NEW_ORDER row per active staff member and one STATUS_UPDATE row for the customer.
     *
     * @return number of rows written; zero when the event was already recorded
     */
    public int recordOrderPlaced(OrderPlacedEvent event) {
        Integer written = writeTransaction.execute(status -> {
            int count = 0;
            String total = formatAmount(event.totalAmount());
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("order_number", event.orderNumber());
            payload.put("total_amount", total);
            payload.put("added_lines", event.addedLines());
            payload.put("checkout_id", event.checkoutId());

            for (User staff : userRepository.findByRoleInAndActiveTrueOrderByIdAsc(STAFF_ROLES)) {
                String customer = event.customerName() == null || event.customerName().isBlank()
                        ? "A guest" : event.customerName();
                if (createIfAbsent(staff.getId(), event.orderId(), NotificationType.NEW_ORDER, event.checkoutId(),
                        "New order " + event.orderNumber(),
                        customer + " checked out. Order total is now " + total + ".",
                        payload)) {
                    count++;
                }
            }

            if (event.customerId() != null) {
                Map<String, Object> customerPayload = new LinkedHashMap<>(payload);
                customerPayload.put("status", "pending");
                if (createIfAbsent(event.customerId(), event.orderId(), NotificationType.STATUS_UPDATE,
                        event.checkoutId(),
                        "Order " + event.orderNumber() + " received",
                        "We received your order. Current total: " + total + ".",
                        customerPayload)) {
                    count++;
                }
            }
            return count;
        });
        int result = written == null ? 0 : written;
        logger.info("[NotificationService] Checkout {} on order {} produced {} notification(s)",
                event.checkoutId(), event.orderNumber(), result);
        return result;
    }

    public int recordOrderStatusChanged(OrderStatusChangedEvent event) {
        if (event.customerId() == null) {
            return 0;
        }
        Integer written = writeTransaction.execute(status -> {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("order_number", event.orderNumber());
            payload.put("previous_status", event.previousStatus().toJson());
            payload.put("status", event.newStatus().toJson());
            boolean created = createIfAbsent(event.customerId(), event.orderId(), NotificationType.STATUS_UPDATE,
                    event.eventId(),
                    "Order " + event.orderNumber() + " updated",
                    "Your order is now " + event.newStatus().toJson() + ".",
                    payload);
            return created ? 1 : 0;
        });
        return written == null ? 0 : written;
    }

    private boolean createIfAbsent(Long recipientId, Long orderId, NotificationType type, String eventKey,
                                   String title, String message, Map<String, Object> payload) {
        if (notificationRepository.existsByRecipientIdAndEventKeyAndType(recipientId, eventKey, type)) {
            logger.debug("[NotificationService] {} for recipient {} and event {} already recorded",
                    type, recipientId, eventKey);
            return false;
        }
        AdminNotification notification = new AdminNotification();
        notification.setRecipientId(recipientId);
        notification.setOrderId(orderId);
        notification.setType(type);
        notification.setEventKey(eventKey);
        notification.setTitle(title);
        notification.setMessage(message);
        notification.setPayload(payload);
        notification.setRead(false);
        notification.setCreatedAt(LocalDateTime.now(clock));
        notificationRepository.save(notification);
        return true;
    }

    public List<AdminNotification> listFor(Long recipientId) {
        return notificationRepository.findByRecipientIdOrderByCreatedAtDescIdDesc(recipientId);
    }

    public long unreadCount(Long recipientId) {
        return notificationRepository.countByRecipientIdAndReadFalse(recipientId);
    }

    public AdminNotification markRead(Long recipientId, Long notificationId, boolean read) {
        return writeTransaction.execute(status -> {
            AdminNotification notification = notificationRepository.findByIdAndRecipientId(notificationId, recipientId)
                    .orElseThrow(() -> new NotFoundException("Notification not found"));
            notification.setRead(read);
            return notificationRepository.save(notification);
        });
    }

    public int markAllRead(Long recipientId) {
        Integer updated = writeTransaction.execute(status -> {
            List<AdminNotification> unread = notificationRepository.findByRecipientIdAndReadFalse(recipientId);
            unread.forEach(notification -> notification.setRead(true));
            notificationRepository.saveAll(unread);
            return unread.size();
        });
        return updated == null ? 0 : updated;
    }

    private static String formatAmount(BigDecimal amount) {
        return amount == null ? "0.00" : amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
