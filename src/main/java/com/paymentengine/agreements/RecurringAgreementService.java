package com.paymentengine.agreements;

import com.paymentengine.common.Money;
import com.paymentengine.common.exception.ResourceNotFoundException;
import com.paymentengine.payments.PaymentRecord;
import com.paymentengine.payments.PaymentRecordService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Service for recurring agreements and the billing cycles they open.
 *
 * A paused agreement opens no cycles until the customer resumes it. Nothing
 * resumes an agreement automatically.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecurringAgreementService {

    private final RecurringAgreementRepository agreementRepository;
    private final PaymentRecordService paymentRecordService;
    private final Clock clock;

    @Transactional
    public RecurringAgreement create(String customerId, String providerId, String instrumentId,
                                     Money amount, BillingFrequency frequency, LocalDate firstBillingDate) {
        if (!amount.isPositive()) {
            throw new IllegalArgumentException("Agreement amount must be positive: " + amount);
        }
        RecurringAgreement agreement = new RecurringAgreement(customerId, providerId, instrumentId,
            amount, frequency, firstBillingDate, clock.instant());
        agreementRepository.save(agreement);

        log.info("Created {} agreement {} for customer {} amount {} first billing {}",
            frequency, agreement.getAgreementId(), customerId, amount, firstBillingDate);

        return agreement;
    }

    @Transactional(readOnly = true)
    public RecurringAgreement get(String agreementId) {
        return agreementRepository.findById(agreementId)
            .orElseThrow(() -> new ResourceNotFoundException("Agreement", agreementId));
    }

    @Transactional
    public RecurringAgreement pause(String agreementId, String reason) {
        RecurringAgreement agreement = get(agreementId);
        if (!agreement.isActive()) {
            log.debug("Agreement {} already paused", agreementId);
            return agreement;
        }
        agreement.pause(reason, clock.instant());
        agreementRepository.save(agreement);

        log.warn("Paused agreement {}: {}", agreementId, reason);
        return agreement;
    }

    /**
     * Stop billing after a payment has run out of retries. Records opened outside an
     * agreement have nothing to pause.
     */
    @Transactional
    public void pauseForFailedPayment(String agreementId, String reason) {
        if (!agreementRepository.existsById(agreementId)) {
            log.warn("No agreement {} to pause: {}", agreementId, reason);
            return;
        }
        pause(agreementId, reason);
    }

    @Transactional
    public RecurringAgreement resume(String agreementId) {
        RecurringAgreement agreement = get(agreementId);
        agreement.resume(clock.instant());
        agreementRepository.save(agreement);

        log.info("Resumed agreement {}", agreementId);
        return agreement;
    }

    /**
     * Switch the agreement and any payments still waiting to be charged to a new instrument.
     */
    @Transactional
    public RecurringAgreement updatePaymentMethod(String agreementId, String instrumentId) {
        RecurringAgreement agreement = get(agreementId);
        agreement.setInstrumentId(instrumentId);
        agreement.setUpdatedAt(clock.instant());
        agreementRepository.save(agreement);

        paymentRecordService.updatePaymentMethod(agreementId, instrumentId);
        return agreement;
    }

    /**
     * Open one payment record for every active agreement billed on or before today.
     * An agreement that fell several cycles behind catches up one cycle per call.
     */
    @Transactional
    public List<PaymentRecord> openDueBillingCycles(LocalDate today) {
        List<RecurringAgreement> due = agreementRepository.findByActiveTrueAndNextBillingDateLessThanEqual(today);
        List<PaymentRecord> opened = new ArrayList<>();

        for (RecurringAgreement agreement : due) {
            PaymentRecord record = paymentRecordService.create(agreement.getAgreementId(),
                agreement.getCustomerId(), agreement.getInstrumentId(), agreement.getAmount());
            agreement.advanceBillingDate(clock.instant());
            agreementRepository.save(agreement);
            opened.add(record);
        }

        if (!opened.isEmpty()) {
            log.info("Opened {} billing cycles for {}", opened.size(), today);
        }
        return opened;
    }

    @Transactional(readOnly = true)
    public List<RecurringAgreement> listByCustomer(String customerId) {
        return agreementRepository.findByCustomerId(customerId);
    }
}
