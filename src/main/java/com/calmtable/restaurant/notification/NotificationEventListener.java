package com.calmtable.restaurant.notification;

import com.calmtable.restaurant.dispatch.TaskDispatcher;
import com.calmtable.restaurant.event.OrderPlacedEvent;
import com.calmtable.restaurant.event.OrderStatusChangedEvent;
import com.calmtable.restaurant.event.ReservationCreatedEvent;
import com.calmtable.restaurant.event.ReservationStatusChangedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Side effects of committed orders and reservations. A failure here is logged and never reaches
 * the request that triggered the event.
 */
@Component
public class NotificationEventListener {

    private static final Logger logger = LoggerFactory.getLogger(NotificationEventListener.class);

    private final NotificationService notificationService;
    private final ReservationMailer reservationMailer;
    private final TaskDispatcher taskDispatcher;

    public NotificationEventListener(NotificationService notificationService,
                                     ReservationMailer reservationMailer,
                                     TaskDispatcher taskDispatcher) {
        this.notificationService = notificationService;
        this.reservationMailer = reservationMailer;
        this.taskDispatcher = taskDispatcher;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onOrderPlaced(OrderPlacedEvent event) {
        try {
            notificationService.recordOrderPlaced(event);
        } catch (RuntimeException e) {
            logger.error("[NotificationEventListener] Fan-out failed for order {} checkout {}: {}",
                    event.orderNumber(), event.checkoutId(), e.getMessage(), e);
        }
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onOrderStatusChanged(OrderStatusChangedEvent event) {
        try {
            notificationService.recordOrderStatusChanged(event);
        } catch (RuntimeException e) {
            logger.error("[NotificationEventListener] Status notification failed for order {}: {}",
                    event.orderNumber(), e.getMessage(), e);
        }
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onReservationCreated(ReservationCreatedEvent event) {
        taskDispatcher.dispatch("reservation-confirmation-" + event.confirmationCode(),
                () -> reservationMailer.sendConfirmation(event.reservationId()));
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onReservationStatusChanged(ReservationStatusChangedEvent event) {
        taskDispatcher.dispatch("reservation-status-" + event.confirmationCode(),
                () -> reservationMailer.sendStatusUpdate(event.reservationId()));
    }
}
