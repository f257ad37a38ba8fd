package com.paymentengine.escrow;

import com.paymentengine.bookings.Booking;
import com.paymentengine.bookings.BookingEscrowStatus;
import com.paymentengine.bookings.BookingRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Holds a booking's payment in escrow and settles the hold one way or the other.
 * The booking's escrow status mirrors the hold.
 */
@Service
@Slf4j
public class EscrowService {

    private final EscrowHoldRepository escrowHoldRepository;
    private final BookingRepository bookingRepository;
    private final Clock clock;
    private final Duration holdPeriod;

    public EscrowService(EscrowHoldRepository escrowHoldRepository,
                         BookingRepository bookingRepository,
                         Clock clock,
                         @Value("${payment-engine.escrow.hold-days:90}") long holdDays) {
        this.escrowHoldRepository = escrowHoldRepository;
        this.bookingRepository = bookingRepository;
        this.clock = clock;
        this.holdPeriod = Duration.ofDays(holdDays);
    }

    /**
     * Hold the provider's share of a booking. Returns the existing hold if there is one.
     */
    @Transactional
    public EscrowHold hold(Booking booking) {
        Optional<EscrowHold> existing = escrowHoldRepository.findByBookingId(booking.getBookingId());
        if (existing.isPresent()) {
            return existing.get();
        }

        Instant now = clock.instant();
        EscrowHold hold = new EscrowHold(booking.getBookingId(), booking.getCustomerId(),
            booking.getProviderId(), booking.getProviderPayout(), now, now.plus(holdPeriod));
        escrowHoldRepository.save(hold);

        booking.changeEscrowStatus(BookingEscrowStatus.HELD, now);
        bookingRepository.save(booking);

        log.info("Holding {} in escrow for booking {}: hold={}, expires={}",
            hold.getAmount(), booking.getBookingId(), hold.getEscrowHoldId(), hold.getExpiresAt());
        return hold;
    }

    @Transactional(readOnly = true)
    public Optional<EscrowHold> findByBooking(String bookingId) {
        return escrowHoldRepository.findByBookingId(bookingId);
    }

    @Transactional
    public EscrowHold release(EscrowHold hold, Booking booking) {
        Instant now = clock.instant();
        hold.release(now);
        booking.changeEscrowStatus(BookingEscrowStatus.RELEASED, now);
        bookingRepository.save(booking);

        log.info("Released escrow hold {} for booking {}", hold.getEscrowHoldId(), booking.getBookingId());
        return escrowHoldRepository.save(hold);
    }

    /**
     * Return a held booking payment to the customer. No-op when nothing is held.
     */
    @Transactional
    public Optional<EscrowHold> refund(Booking booking) {
        Optional<EscrowHold> held = escrowHoldRepository.findByBookingId(booking.getBookingId())
            .filter(EscrowHold::isHeld);
        if (held.isEmpty()) {
            log.debug("No held escrow to refund for booking {}", booking.getBookingId());
            return Optional.empty();
        }

        Instant now = clock.instant();
        EscrowHold hold = held.get();
        hold.refund(now);
        escrowHoldRepository.save(hold);

        booking.changeEscrowStatus(BookingEscrowStatus.REFUNDED, now);
        bookingRepository.save(booking);

        log.info("Refunded escrow hold {} for booking {}", hold.getEscrowHoldId(), booking.getBookingId());
        return Optional.of(hold);
    }
}
