package com.paymentengine.bookings;

import com.paymentengine.common.Money;
import com.paymentengine.common.exception.InvalidBookingStateException;
import com.paymentengine.common.exception.ResourceNotFoundException;
import com.paymentengine.escrow.EscrowService;
import com.paymentengine.escrow.PayoutService;
import com.paymentengine.refunds.CancellingParty;
import com.paymentengine.refunds.Refund;
import com.paymentengine.refunds.RefundEligibility;
import com.paymentengine.refunds.RefundService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * Service for the booking lifecycle events that move money.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BookingService {

    private final BookingRepository bookingRepository;
    private final BookingCancellationRepository cancellationRepository;
    private final EscrowService escrowService;
    private final PayoutService payoutService;
    private final RefundService refundService;
    private final Clock clock;

    /**
     * Record a paid booking and hold the provider's share in escrow.
     */
    @Transactional
    public Booking createBooking(String customerId, String providerId, BookingType bookingType,
                                 LocalDate scheduledDate, LocalTime scheduledTime,
                                 Money price, Money providerPayout) {
        if (!price.isPositive()) {
            throw new IllegalArgumentException("Booking price must be positive: " + price);
        }
        if (providerPayout.getAmount().compareTo(price.getAmount()) > 0) {
            throw new IllegalArgumentException("Provider payout " + providerPayout + " exceeds price " + price);
        }

        Booking booking = new Booking(customerId, providerId, bookingType, scheduledDate, scheduledTime,
            price, providerPayout, clock.instant());
        bookingRepository.save(booking);
        escrowService.hold(booking);

        log.info("Created {} booking {} for customer {} with provider {} on {}",
            bookingType, booking.getBookingId(), customerId, providerId, scheduledDate);
        return booking;
    }

    @Transactional(readOnly = true)
    public Booking get(String bookingId) {
        return bookingRepository.findById(bookingId)
            .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
    }

    @Transactional(readOnly = true)
    public List<Booking> listByCustomer(String customerId) {
        return bookingRepository.findByCustomerId(customerId);
    }

    @Transactional
    public Booking completeBooking(String bookingId) {
        Booking booking = get(bookingId);
        if (booking.isClosed()) {
            throw new InvalidBookingStateException(bookingId, booking.getStatus().name(), "complete");
        }

        Instant now = clock.instant();
        booking.setStatus(BookingStatus.COMPLETED);
        booking.setCompletedAt(now);
        booking.setUpdatedAt(now);
        bookingRepository.save(booking);

        payoutService.createScheduleForCompletedBooking(bookingId);

        log.info("Completed booking {}", bookingId);
        return booking;
    }

    /**
     * Cancel a booking and, when the cancellation qualifies, refund the customer in
     * the same transaction.
     */
    @Transactional
    public BookingCancellation cancelBooking(String bookingId, CancellingParty cancelledBy, String reason) {
        Booking booking = get(bookingId);
        if (booking.isClosed()) {
            throw new InvalidBookingStateException(bookingId, booking.getStatus().name(), "cancel");
        }

        RefundEligibility eligibility = refundService.checkEligibility(bookingId, cancelledBy);
        Refund refund = null;
        if (eligibility.isEligible()) {
            String requestedBy = cancelledBy == CancellingParty.PROVIDER
                ? booking.getProviderId()
                : booking.getCustomerId();
            refund = refundService.requestRefund(bookingId, cancelledBy, reason,
                "Automatic refund on cancellation: " + eligibility.getPolicy(), requestedBy);
        }

        Instant now = clock.instant();
        booking.setStatus(BookingStatus.CANCELLED);
        booking.setCancelledAt(now);
        booking.setUpdatedAt(now);
        bookingRepository.save(booking);

        BookingCancellation cancellation = new BookingCancellation(bookingId, cancelledBy, reason,
            eligibility.getRefundPercentage(), eligibility.getRefundAmount(),
            refund == null ? null : refund.getRefundId(), now);
        cancellationRepository.save(cancellation);

        log.info("Cancelled booking {} by {}: refund {}% ({})",
            bookingId, cancelledBy, eligibility.getRefundPercentage(), eligibility.getPolicy());

        if (refund != null) {
            refundService.completeRefund(refund.getRefundId());
        }
        return cancellation;
    }
}
