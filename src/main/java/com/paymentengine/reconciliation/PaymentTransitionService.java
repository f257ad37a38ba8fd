package com.paymentengine.reconciliation;

import com.paymentengine.agreements.RecurringAgreementService;
import com.paymentengine.ledger.LedgerService;
import com.paymentengine.notifications.NotificationEvents;
import com.paymentengine.payments.PaymentRecord;
import com.paymentengine.payments.PaymentRecordService;
import com.paymentengine.payments.PaymentStatus;
import com.paymentengine.processor.ChargeResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Applies state machine transitions to stored records.
 *
 * Each call is one transaction: the record update, the ledger row and the agreement
 * pause commit together or not at all. Notifications are published as events and
 * only delivered once that transaction has committed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentTransitionService {

    private final PaymentRecordService paymentRecordService;
    private final PaymentStateMachine stateMachine;
    private final LedgerService ledgerService;
    private final RecurringAgreementService agreementService;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional
    public PaymentRecord recordChargeOutcome(String paymentId, ChargeResult result, Instant now) {
        return apply(paymentId, PaymentEvent.chargeCompleted(result, now));
    }

    @Transactional
    public PaymentRecord resetForManualRetry(String paymentId, Instant now) {
        return apply(paymentId, PaymentEvent.manualRetry(now));
    }

    @Transactional
    public PaymentRecord cancel(String paymentId, Instant now) {
        return apply(paymentId, PaymentEvent.cancel(now));
    }

    private PaymentRecord apply(String paymentId, PaymentEvent event) {
        PaymentRecord record = paymentRecordService.get(paymentId);
        PaymentTransition transition = stateMachine.transition(record, event);
        if (!transition.isChanged()) {
            log.debug("Payment {} unchanged by {}", paymentId, event.getType());
            return record;
        }

        PaymentStatus fromStatus = record.getStatus();
        record.apply(transition, event.getAt());
        PaymentRecord saved = paymentRecordService.save(record);

        log.info("Payment {} {} -> {} on {} (retryCount={}, nextRetryAt={})",
            paymentId, fromStatus, saved.getStatus(), event.getType(),
            saved.getRetryCount(), saved.getNextRetryAt());

        runEffects(saved, transition);
        return saved;
    }

    private void runEffects(PaymentRecord record, PaymentTransition transition) {
        for (PaymentEffect effect : transition.getEffects()) {
            switch (effect) {
                case RECORD_LEDGER_PAYMENT:
                    ledgerService.recordPayment(record);
                    break;
                case PAUSE_AGREEMENT:
                    agreementService.pauseForFailedPayment(record.getAgreementId(),
                        "Payment " + record.getPaymentId() + " failed after " + record.getMaxRetries()
                            + " attempts: " + record.getFailureReason());
                    break;
                case NOTIFY_RETRY_SCHEDULED:
                    eventPublisher.publishEvent(NotificationEvents.retryScheduled(record));
                    break;
                case NOTIFY_ACTION_REQUIRED:
                    eventPublisher.publishEvent(NotificationEvents.actionRequired(record));
                    break;
                case NOTIFY_PERMANENT_FAILURE:
                    eventPublisher.publishEvent(NotificationEvents.permanentFailure(record));
                    break;
                default:
                    throw new IllegalStateException("Unhandled effect: " + effect);
            }
        }
    }
}
