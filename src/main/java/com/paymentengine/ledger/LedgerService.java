package com.paymentengine.ledger;

import com.paymentengine.common.IdempotencyKey;
import com.paymentengine.common.Money;
import com.paymentengine.payments.PaymentRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Service for the append-only transaction ledger.
 *
 * Every write carries an idempotency key derived from the record that produced it,
 * so each charge, payout and refund maps to exactly one row however often the
 * write is repeated.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private final LedgerRepository ledgerRepository;
    private final Clock clock;

    /**
     * Record a successful recurring charge against the payer.
     */
    @Transactional
    public String recordPayment(PaymentRecord payment) {
        return record(
            payment.getPayerId(),
            TransactionType.PAYMENT,
            LedgerTransaction.EntryType.DEBIT,
            payment.getAmount(),
            ReferenceType.PAYMENT_RECORD,
            payment.getPaymentId(),
            payment.getExternalTransactionReference(),
            "Recurring booking payment",
            paymentKey(payment.getPaymentId())
        );
    }

    /**
     * Record escrowed funds paid out to a provider.
     */
    @Transactional
    public String recordPayout(String providerId, Money amount, String escrowHoldId) {
        return record(
            providerId,
            TransactionType.PAYOUT,
            LedgerTransaction.EntryType.CREDIT,
            amount,
            ReferenceType.ESCROW_HOLD,
            escrowHoldId,
            null,
            "Early payout released from escrow",
            payoutKey(escrowHoldId)
        );
    }

    /**
     * Record a cancellation refund credited to a customer.
     */
    @Transactional
    public String recordRefund(String customerId, Money amount, String refundId) {
        return record(
            customerId,
            TransactionType.REFUND,
            LedgerTransaction.EntryType.CREDIT,
            amount,
            ReferenceType.REFUND,
            refundId,
            null,
            "Booking cancellation refund",
            refundKey(refundId)
        );
    }

    public static String paymentKey(String paymentId) {
        return IdempotencyKey.derive("ledger-payment", paymentId);
    }

    public static String payoutKey(String escrowHoldId) {
        return IdempotencyKey.derive("ledger-payout", escrowHoldId);
    }

    public static String refundKey(String refundId) {
        return IdempotencyKey.derive("ledger-refund", refundId);
    }

    @Transactional(readOnly = true)
    public Optional<LedgerTransaction> findByIdempotencyKey(String idempotencyKey) {
        return ledgerRepository.findByIdempotencyKey(idempotencyKey);
    }

    @Transactional(readOnly = true)
    public List<LedgerTransaction> getUserLedger(String userId) {
        return ledgerRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    @Transactional(readOnly = true)
    public List<LedgerTransaction> getReferenceLedger(ReferenceType referenceType, String referenceId) {
        return ledgerRepository.findByReferenceTypeAndReferenceId(referenceType, referenceId);
    }

    private String record(String userId, TransactionType type, LedgerTransaction.EntryType entryType,
                          Money amount, ReferenceType referenceType, String referenceId,
                          String externalReference, String description, String idempotencyKey) {
        IdempotencyKey.validate(idempotencyKey);

        Optional<LedgerTransaction> existing = ledgerRepository.findByIdempotencyKey(idempotencyKey);
        if (existing.isPresent()) {
            log.info("Duplicate {} ledger write for {} {}", type, referenceType, referenceId);
            return existing.get().getTransactionId();
        }

        LedgerTransaction transaction = new LedgerTransaction(
            userId, type, entryType, amount, referenceType, referenceId,
            externalReference, description, idempotencyKey, clock.instant());
        ledgerRepository.save(transaction);

        log.info("Recorded {}: txn={}, user={}, {}={}, amount={}",
            type, transaction.getTransactionId(), userId, referenceType, referenceId, amount);

        return transaction.getTransactionId();
    }
}
