package com.paymentengine.wallet;

import com.paymentengine.common.Money;
import com.paymentengine.common.exception.PaymentEngineException;
import com.paymentengine.common.exception.ResourceNotFoundException;
import com.paymentengine.ledger.LedgerService;
import com.paymentengine.ledger.LedgerTransaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;

/**
 * Wallet balance changes.
 *
 * Each change is one delta UPDATE paired with one ledger row in the same
 * transaction. The ledger idempotency key is checked first, so repeating a
 * payout or refund neither double-credits nor writes a second row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WalletService {

    private final WalletRepository walletRepository;
    private final LedgerService ledgerService;
    private final Clock clock;

    @Transactional
    public String creditPayout(String providerId, Money amount, String escrowHoldId) {
        Optional<LedgerTransaction> existing = ledgerService.findByIdempotencyKey(LedgerService.payoutKey(escrowHoldId));
        if (existing.isPresent()) {
            log.info("Payout for escrow hold {} already credited", escrowHoldId);
            return existing.get().getTransactionId();
        }
        applyDelta(providerId, amount);
        return ledgerService.recordPayout(providerId, amount, escrowHoldId);
    }

    @Transactional
    public String creditRefund(String customerId, Money amount, String refundId) {
        Optional<LedgerTransaction> existing = ledgerService.findByIdempotencyKey(LedgerService.refundKey(refundId));
        if (existing.isPresent()) {
            log.info("Refund {} already credited", refundId);
            return existing.get().getTransactionId();
        }
        applyDelta(customerId, amount);
        return ledgerService.recordRefund(customerId, amount, refundId);
    }

    @Transactional(readOnly = true)
    public Wallet getWallet(String ownerId) {
        return walletRepository.findByOwnerId(ownerId)
            .orElseThrow(() -> new ResourceNotFoundException("Wallet", ownerId));
    }

    private void applyDelta(String ownerId, Money delta) {
        if (!delta.isPositive()) {
            throw new IllegalArgumentException("Wallet credit must be positive: " + delta);
        }
        if (walletRepository.findByOwnerId(ownerId).isEmpty()) {
            walletRepository.saveAndFlush(new Wallet(ownerId, Money.zero(delta.getCurrency()), clock.instant()));
            log.info("Opened {} wallet for {}", delta.getCurrency(), ownerId);
        }

        int updated = walletRepository.applyDelta(ownerId, delta.getAmount(), delta.getCurrency(), clock.instant());
        if (updated != 1) {
            throw new PaymentEngineException(String.format(
                "Wallet of %s does not hold %s, cannot apply %s", ownerId, delta.getCurrency(), delta));
        }
        log.info("Applied wallet delta {} to {}", delta, ownerId);
    }
}
