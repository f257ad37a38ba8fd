package com.paymentengine.refunds;

import com.paymentengine.bookings.Booking;
import com.paymentengine.bookings.BookingRepository;
import com.paymentengine.bookings.BookingStatus;
import com.paymentengine.common.exception.InvalidRefundStateException;
import com.paymentengine.common.exception.RefundAccessDeniedException;
import com.paymentengine.common.exception.RefundNotEligibleException;
import com.paymentengine.common.exception.ResourceNotFoundException;
import com.paymentengine.escrow.EscrowService;
import com.paymentengine.notifications.NotificationEvents;
import com.paymentengine.wallet.WalletService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Service for cancellation refunds.
 *
 * Eligibility is evaluated against the booking as stored, in the marketplace's
 * time zone. Completing a refund credits the customer's wallet and returns the
 * escrowed payment; the processor is not called.
 */
@Service
@Slf4j
public class RefundService {

    static final String WITHDRAWN_NOTE = "Cancelled by requester";

    private final RefundRepository refundRepository;
    private final BookingRepository bookingRepository;
    private final RefundEligibilityEngine eligibilityEngine;
    private final EscrowService escrowService;
    private final WalletService walletService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final ZoneId zone;

    public RefundService(RefundRepository refundRepository,
                         BookingRepository bookingRepository,
                         RefundEligibilityEngine eligibilityEngine,
                         EscrowService escrowService,
                         WalletService walletService,
                         ApplicationEventPublisher eventPublisher,
                         Clock clock,
                         @Value("${payment-engine.refunds.zone:UTC}") String zone) {
        this.refundRepository = refundRepository;
        this.bookingRepository = bookingRepository;
        this.eligibilityEngine = eligibilityEngine;
        this.escrowService = escrowService;
        this.walletService = walletService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.zone = ZoneId.of(zone);
    }

    @Transactional(readOnly = true)
    public RefundEligibility checkEligibility(String bookingId, CancellingParty cancelledBy) {
        return checkEligibility(getBooking(bookingId), cancelledBy);
    }

    private RefundEligibility checkEligibility(Booking booking, CancellingParty cancelledBy) {
        long daysUntilService = ChronoUnit.DAYS.between(today(), booking.getScheduledDate());

        if (booking.getStatus() == BookingStatus.COMPLETED) {
            return RefundEligibility.rejected(booking.getPrice(), daysUntilService,
                "Completed bookings cannot be refunded", "Booking already completed");
        }
        if (booking.getStatus() == BookingStatus.CANCELLED) {
            return RefundEligibility.rejected(booking.getPrice(), daysUntilService,
                "Booking already cancelled", "Booking already cancelled");
        }
        Optional<Refund> existing = refundRepository.findByBookingId(booking.getBookingId());
        if (existing.isPresent()) {
            return RefundEligibility.rejected(booking.getPrice(), daysUntilService,
                "Refund already requested", "Refund already " + existing.get().getStatus().name().toLowerCase());
        }

        return eligibilityEngine.evaluate(booking.getScheduledDate(), cancelledBy, booking.getPrice(), today());
    }

    @Transactional
    public Refund requestRefund(String bookingId, CancellingParty cancelledBy, String reason,
                                String notes, String requestedBy) {
        Booking booking = getBooking(bookingId);
        RefundEligibility eligibility = checkEligibility(booking, cancelledBy);
        if (!eligibility.isEligible()) {
            throw new RefundNotEligibleException(bookingId, eligibility.getReason());
        }

        Refund refund = new Refund(booking.getBookingId(), booking.getCustomerId(), eligibility,
            cancelledBy, reason, notes, requestedBy, clock.instant());
        refundRepository.save(refund);

        log.info("Refund {} requested for booking {}: {}% = {} ({})",
            refund.getRefundId(), booking.getBookingId(), refund.getRefundPercentage(),
            refund.getAmount(), eligibility.getPolicy());
        return refund;
    }

    @Transactional
    public Refund completeRefund(String refundId) {
        Refund refund = get(refundId);
        if (refund.getStatus() != RefundStatus.PENDING) {
            throw new InvalidRefundStateException(refundId, refund.getStatus().name(), "complete");
        }
        Booking booking = getBooking(refund.getBookingId());

        refund.setStatus(RefundStatus.COMPLETED);
        refund.setProcessedAt(clock.instant());
        refundRepository.save(refund);

        escrowService.refund(booking);

        if (refund.getAmount().isZero()) {
            log.info("Completed refund {} for booking {}: {}% rounds to {}, nothing to credit",
                refundId, refund.getBookingId(), refund.getRefundPercentage(), refund.getAmount());
            return refund;
        }

        String transactionId = walletService.creditRefund(refund.getCustomerId(), refund.getAmount(), refundId);

        eventPublisher.publishEvent(NotificationEvents.refundIssued(
            refund.getCustomerId(), refund.getAmount(), refund.getRefundPercentage(), refundId));

        log.info("Completed refund {} of {} to customer {}: txn={}",
            refundId, refund.getAmount(), refund.getCustomerId(), transactionId);
        return refund;
    }

    /**
     * Withdraw a pending refund request. Only the user who requested it may do so.
     */
    @Transactional
    public Refund cancelRefund(String refundId, String userId) {
        Refund refund = get(refundId);
        if (!userId.equals(refund.getRequestedBy())) {
            throw new RefundAccessDeniedException(refundId, userId);
        }
        if (refund.getStatus() != RefundStatus.PENDING) {
            throw new InvalidRefundStateException(refundId, refund.getStatus().name(), "cancel");
        }

        refund.setStatus(RefundStatus.REJECTED);
        refund.setNotes(WITHDRAWN_NOTE);
        refund.setProcessedAt(clock.instant());
        refundRepository.save(refund);

        log.info("Refund {} for booking {} withdrawn by {}", refundId, refund.getBookingId(), userId);
        return refund;
    }

    @Transactional(readOnly = true)
    public Refund get(String refundId) {
        return refundRepository.findById(refundId)
            .orElseThrow(() -> new ResourceNotFoundException("Refund", refundId));
    }

    @Transactional(readOnly = true)
    public List<Refund> listByCustomer(String customerId) {
        return refundRepository.findByCustomerIdOrderByCreatedAtDesc(customerId);
    }

    private LocalDate today() {
        return LocalDate.now(clock.withZone(zone));
    }

    private Booking getBooking(String bookingId) {
        return bookingRepository.findById(bookingId)
            .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
    }
}
