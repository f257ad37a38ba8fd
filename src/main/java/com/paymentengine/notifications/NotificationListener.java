package com.paymentengine.notifications;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Delivers notifications after the financial transaction that raised them has
 * committed. Delivery is fire-and-forget: a failure is logged and dropped, and
 * can never undo the money movement.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NotificationListener {

    private final NotificationService notificationService;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onNotification(NotificationEvent event) {
        try {
            notificationService.send(event);
        } catch (RuntimeException e) {
            log.warn("Dropped {} notification for user {} ({}): {}",
                event.getType(), event.getUserId(), event.getReferenceId(), e.getMessage());
        }
    }
}
