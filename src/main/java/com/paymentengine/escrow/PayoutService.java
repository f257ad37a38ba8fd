package com.paymentengine.escrow;

import com.paymentengine.bookings.Booking;
import com.paymentengine.bookings.BookingRepository;
import com.paymentengine.bookings.BookingStatus;
import com.paymentengine.common.exception.ActiveDisputesException;
import com.paymentengine.common.exception.InvalidBookingStateException;
import com.paymentengine.common.exception.PayoutRejectedException;
import com.paymentengine.common.exception.ResourceNotFoundException;
import com.paymentengine.disputes.DisputeService;
import com.paymentengine.notifications.NotificationEvents;
import com.paymentengine.wallet.WalletService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

/**
 * Service for provider payouts out of escrow.
 *
 * A completed booking gets a payout schedule on the regular cycle. A provider may ask
 * for the money sooner once the early eligibility window opens; the early release
 * re-checks every precondition and settles the hold, the schedule, the wallet and the
 * ledger in one transaction.
 */
@Service
@Slf4j
public class PayoutService {

    private final PayoutScheduleRepository payoutScheduleRepository;
    private final BookingRepository bookingRepository;
    private final EscrowService escrowService;
    private final DisputeService disputeService;
    private final WalletService walletService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final ZoneId payoutZone;

    public PayoutService(PayoutScheduleRepository payoutScheduleRepository,
                         BookingRepository bookingRepository,
                         EscrowService escrowService,
                         DisputeService disputeService,
                         WalletService walletService,
                         ApplicationEventPublisher eventPublisher,
                         Clock clock,
                         @Value("${payment-engine.payouts.zone:UTC}") String payoutZone) {
        this.payoutScheduleRepository = payoutScheduleRepository;
        this.bookingRepository = bookingRepository;
        this.escrowService = escrowService;
        this.disputeService = disputeService;
        this.walletService = walletService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.payoutZone = ZoneId.of(payoutZone);
    }

    /**
     * Put a completed booking's payout on the regular cycle. Returns the existing
     * schedule when the booking already has one.
     */
    @Transactional
    public PayoutSchedule createScheduleForCompletedBooking(String bookingId) {
        Booking booking = getBooking(bookingId);
        if (booking.getStatus() != BookingStatus.COMPLETED) {
            throw new InvalidBookingStateException(bookingId, booking.getStatus().name(), "schedule payout");
        }

        return payoutScheduleRepository.findByBookingId(bookingId)
            .orElseGet(() -> createSchedule(booking));
    }

    private PayoutSchedule createSchedule(Booking booking) {
        EscrowHold hold = escrowService.hold(booking);

        Instant completedAt = booking.getCompletedAt() != null ? booking.getCompletedAt() : clock.instant();
        PayoutTiming timing = PayoutTiming.forBookingType(booking.getBookingType());
        Instant eligibleAt = completedAt.plus(Duration.ofDays(timing.getCutoffDays()));
        LocalDate scheduledDate = LocalDate.ofInstant(eligibleAt, payoutZone).plusDays(timing.getCycleDays());
        Instant earlyEligibleAt = completedAt.plus(Duration.ofDays(timing.getEarlyDays()));

        PayoutSchedule schedule = new PayoutSchedule(booking.getBookingId(), booking.getProviderId(),
            hold.getEscrowHoldId(), booking.getBookingType(), hold.getAmount(), completedAt,
            eligibleAt, scheduledDate, earlyEligibleAt, clock.instant());
        payoutScheduleRepository.save(schedule);

        log.info("Scheduled payout {} of {} for booking {} on {} (early from {})",
            schedule.getScheduleId(), schedule.getPayoutAmount(), booking.getBookingId(),
            scheduledDate, earlyEligibleAt);
        return schedule;
    }

    @Transactional(readOnly = true)
    public PayoutSchedule get(String scheduleId) {
        return payoutScheduleRepository.findById(scheduleId)
            .orElseThrow(() -> new ResourceNotFoundException("Payout schedule", scheduleId));
    }

    @Transactional(readOnly = true)
    public List<PayoutSchedule> listByProvider(String providerId) {
        return payoutScheduleRepository.findByProviderIdOrderByScheduledPayoutDateAsc(providerId);
    }

    @Transactional
    public PayoutSchedule requestEarlyPayout(String scheduleId) {
        PayoutSchedule schedule = get(scheduleId);
        Instant now = clock.instant();

        if (schedule.getStatus() != PayoutStatus.PENDING && schedule.getStatus() != PayoutStatus.SCHEDULED) {
            throw new PayoutRejectedException(scheduleId,
                "payout is " + schedule.getStatus() + " and can no longer be requested early");
        }
        if (!schedule.isEarlyPayoutEligible(now)) {
            throw new PayoutRejectedException(scheduleId,
                "not eligible for early payout until " + schedule.getEarlyPayoutEligibleAt());
        }

        schedule.markEarlyPayoutRequested(now);
        log.info("Early payout requested for schedule {} by provider {}", scheduleId, schedule.getProviderId());
        return payoutScheduleRepository.save(schedule);
    }

    /**
     * Release an early-requested payout to the provider's wallet.
     *
     * A dispute that opened after the request reverts the request to the regular
     * schedule. That revert commits even though the call fails.
     */
    @Transactional(noRollbackFor = ActiveDisputesException.class)
    public EarlyPayoutResult releaseEarly(String scheduleId) {
        PayoutSchedule schedule = get(scheduleId);
        Instant now = clock.instant();

        if (schedule.getStatus() != PayoutStatus.PROCESSING) {
            throw new PayoutRejectedException(scheduleId,
                "payout is " + schedule.getStatus() + ", expected PROCESSING");
        }
        if (!schedule.isEarlyPayoutEligible(now)) {
            throw new PayoutRejectedException(scheduleId,
                "not eligible for early payout until " + schedule.getEarlyPayoutEligibleAt());
        }
        if (disputeService.hasActiveDisputes(schedule.getBookingId())) {
            schedule.revertEarlyPayoutRequest(now);
            payoutScheduleRepository.save(schedule);
            log.warn("Early payout {} blocked by active dispute on booking {}; reverted to regular schedule",
                scheduleId, schedule.getBookingId());
            throw new ActiveDisputesException(scheduleId, schedule.getBookingId());
        }

        EscrowHold hold = escrowService.findByBooking(schedule.getBookingId())
            .filter(EscrowHold::isHeld)
            .orElseThrow(() -> new PayoutRejectedException(scheduleId, "escrow funds are not held"));
        Booking booking = getBooking(schedule.getBookingId());

        escrowService.release(hold, booking);
        schedule.complete(now);
        payoutScheduleRepository.save(schedule);

        String transactionId = walletService.creditPayout(schedule.getProviderId(),
            schedule.getPayoutAmount(), hold.getEscrowHoldId());

        eventPublisher.publishEvent(NotificationEvents.earlyPayoutCompleted(
            schedule.getProviderId(), schedule.getPayoutAmount(), scheduleId));

        log.info("Released early payout {} of {} to provider {}: txn={}",
            scheduleId, schedule.getPayoutAmount(), schedule.getProviderId(), transactionId);

        return new EarlyPayoutResult(true, schedule.getPayoutAmount(), scheduleId, transactionId);
    }

    private Booking getBooking(String bookingId) {
        return bookingRepository.findById(bookingId)
            .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
    }
}
