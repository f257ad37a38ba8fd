package com.paymentengine.escrow;

import com.paymentengine.bookings.Booking;
import com.paymentengine.bookings.BookingEscrowStatus;
import com.paymentengine.bookings.BookingService;
import com.paymentengine.bookings.BookingType;
import com.paymentengine.common.Currency;
import com.paymentengine.common.Money;
import com.paymentengine.common.exception.ActiveDisputesException;
import com.paymentengine.common.exception.InvalidBookingStateException;
import com.paymentengine.common.exception.PayoutRejectedException;
import com.paymentengine.common.exception.ResourceNotFoundException;
import com.paymentengine.disputes.Dispute;
import com.paymentengine.disputes.DisputeService;
import com.paymentengine.disputes.DisputeStatus;
import com.paymentengine.ledger.LedgerService;
import com.paymentengine.ledger.LedgerTransaction;
import com.paymentengine.ledger.TransactionType;
import com.paymentengine.notifications.NotificationService;
import com.paymentengine.notifications.NotificationType;
import com.paymentengine.wallet.WalletService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for provider payouts and early release from escrow.
 */
@SpringBootTest
@ActiveProfiles("test")
class PayoutServiceTest {

    @Autowired
    private PayoutService payoutService;

    @Autowired
    private PayoutScheduleRepository payoutScheduleRepository;

    @Autowired
    private BookingService bookingService;

    @Autowired
    private EscrowService escrowService;

    @Autowired
    private DisputeService disputeService;

    @Autowired
    private WalletService walletService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private NotificationService notificationService;

    private String customerId;
    private String providerId;

    @BeforeEach
    void setUp() {
        customerId = "customer-" + UUID.randomUUID();
        providerId = "provider-" + UUID.randomUUID();
    }

    @Test
    void testScheduleTiming_Job() {
        Booking booking = completedBooking(BookingType.JOB);
        PayoutSchedule schedule = payoutService.createScheduleForCompletedBooking(booking.getBookingId());

        Instant completedAt = schedule.getBookingCompletedAt();
        assertEquals(completedAt.plus(Duration.ofDays(3)), schedule.getEligibleForPayoutAt());
        assertEquals(completedAt.plus(Duration.ofDays(3)), schedule.getEarlyPayoutEligibleAt());
        assertEquals(LocalDate.ofInstant(schedule.getEligibleForPayoutAt(), ZoneOffset.UTC).plusDays(7),
            schedule.getScheduledPayoutDate());
        assertEquals(PayoutStatus.PENDING, schedule.getStatus());
        assertEquals(Money.of("85.00", Currency.USD), schedule.getPayoutAmount());
    }

    @Test
    void testScheduleTiming_Service() {
        Booking booking = completedBooking(BookingType.SERVICE);
        PayoutSchedule schedule = payoutService.createScheduleForCompletedBooking(booking.getBookingId());

        Instant completedAt = schedule.getBookingCompletedAt();
        assertEquals(completedAt.plus(Duration.ofDays(5)), schedule.getEligibleForPayoutAt());
        assertEquals(completedAt.plus(Duration.ofDays(7)), schedule.getEarlyPayoutEligibleAt());
        assertEquals(LocalDate.ofInstant(schedule.getEligibleForPayoutAt(), ZoneOffset.UTC).plusDays(14),
            schedule.getScheduledPayoutDate());
    }

    @Test
    void testCreateScheduleIsIdempotent() {
        Booking booking = completedBooking(BookingType.JOB);

        PayoutSchedule first = payoutService.createScheduleForCompletedBooking(booking.getBookingId());
        PayoutSchedule second = payoutService.createScheduleForCompletedBooking(booking.getBookingId());

        assertEquals(first.getScheduleId(), second.getScheduleId());
        assertEquals(1, payoutService.listByProvider(providerId).size());
    }

    @Test
    void testCreateScheduleRequiresCompletedBooking() {
        Booking booking = openBooking(BookingType.JOB);

        assertThrows(InvalidBookingStateException.class,
            () -> payoutService.createScheduleForCompletedBooking(booking.getBookingId()));
    }

    @Test
    void testEarlyPayoutTooSoonIsRejected() {
        Booking booking = completedBooking(BookingType.SERVICE);
        PayoutSchedule schedule = payoutService.createScheduleForCompletedBooking(booking.getBookingId());

        assertThrows(PayoutRejectedException.class, () -> payoutService.requestEarlyPayout(schedule.getScheduleId()));
        assertEquals(PayoutStatus.PENDING, payoutService.get(schedule.getScheduleId()).getStatus());
    }

    @Test
    void testReleaseEarly_CreditsProviderWallet() {
        Booking booking = completedBooking(BookingType.JOB);
        String scheduleId = eligibleSchedule(booking);

        PayoutSchedule requested = payoutService.requestEarlyPayout(scheduleId);
        assertEquals(PayoutStatus.PROCESSING, requested.getStatus());
        assertTrue(requested.isEarlyPayoutRequested());

        EarlyPayoutResult result = payoutService.releaseEarly(scheduleId);

        assertTrue(result.isSuccess());
        assertEquals(Money.of("85.00", Currency.USD), result.getPayoutAmount());
        assertNotNull(result.getLedgerTransactionId());

        PayoutSchedule completed = payoutService.get(scheduleId);
        assertEquals(PayoutStatus.COMPLETED, completed.getStatus());
        assertNotNull(completed.getProcessedAt());

        assertEquals(Money.of("85.00", Currency.USD), walletService.getWallet(providerId).getBalance());
        List<LedgerTransaction> ledger = ledgerService.getUserLedger(providerId);
        assertEquals(1, ledger.size());
        assertEquals(TransactionType.PAYOUT, ledger.get(0).getTransactionType());
        assertEquals(result.getLedgerTransactionId(), ledger.get(0).getTransactionId());

        assertEquals(EscrowHoldStatus.RELEASED,
            escrowService.findByBooking(booking.getBookingId()).orElseThrow().getStatus());
        assertEquals(BookingEscrowStatus.RELEASED, bookingService.get(booking.getBookingId()).getEscrowStatus());
        assertEquals(NotificationType.EARLY_PAYOUT_COMPLETED,
            notificationService.getInbox(providerId).get(0).getType());
    }

    @Test
    void testReleaseEarly_TwiceDoesNotPayTwice() {
        Booking booking = completedBooking(BookingType.JOB);
        String scheduleId = eligibleSchedule(booking);
        payoutService.requestEarlyPayout(scheduleId);
        payoutService.releaseEarly(scheduleId);

        assertThrows(PayoutRejectedException.class, () -> payoutService.releaseEarly(scheduleId));

        assertEquals(Money.of("85.00", Currency.USD), walletService.getWallet(providerId).getBalance());
        assertEquals(1, ledgerService.getUserLedger(providerId).size());
    }

    @Test
    void testReleaseEarly_WithoutRequestIsRejected() {
        Booking booking = completedBooking(BookingType.JOB);
        String scheduleId = eligibleSchedule(booking);

        assertThrows(PayoutRejectedException.class, () -> payoutService.releaseEarly(scheduleId));
        assertTrue(ledgerService.getUserLedger(providerId).isEmpty());
    }

    @Test
    void testReleaseEarly_ActiveDisputeRevertsRequest() {
        Booking booking = completedBooking(BookingType.JOB);
        String scheduleId = eligibleSchedule(booking);
        payoutService.requestEarlyPayout(scheduleId);
        disputeService.open(booking.getBookingId(), customerId, "Work not finished");

        assertThrows(ActiveDisputesException.class, () -> payoutService.releaseEarly(scheduleId));

        PayoutSchedule reverted = payoutService.get(scheduleId);
        assertEquals(PayoutStatus.PENDING, reverted.getStatus());
        assertFalse(reverted.isEarlyPayoutRequested());
        assertNull(reverted.getRequestedAt());

        assertEquals(EscrowHoldStatus.HELD,
            escrowService.findByBooking(booking.getBookingId()).orElseThrow().getStatus());
        assertTrue(ledgerService.getUserLedger(providerId).isEmpty());
    }

    @Test
    void testReleaseEarly_DisputeUnderReviewRevertsRequest() {
        Booking booking = completedBooking(BookingType.SERVICE);
        String scheduleId = eligibleSchedule(booking);
        payoutService.requestEarlyPayout(scheduleId);
        Dispute dispute = disputeService.open(booking.getBookingId(), customerId, "Damaged item");
        disputeService.updateStatus(dispute.getDisputeId(), DisputeStatus.UNDER_REVIEW);

        assertThrows(ActiveDisputesException.class, () -> payoutService.releaseEarly(scheduleId));

        PayoutSchedule reverted = payoutService.get(scheduleId);
        assertEquals(PayoutStatus.PENDING, reverted.getStatus());
        assertFalse(reverted.isEarlyPayoutRequested());
        assertEquals(EscrowHoldStatus.HELD,
            escrowService.findByBooking(booking.getBookingId()).orElseThrow().getStatus());
        assertTrue(ledgerService.getUserLedger(providerId).isEmpty());
    }

    @Test
    void testReleaseEarly_HoldNoLongerHeldIsRejected() {
        Booking booking = completedBooking(BookingType.JOB);
        String scheduleId = eligibleSchedule(booking);
        payoutService.requestEarlyPayout(scheduleId);
        escrowService.refund(bookingService.get(booking.getBookingId()));

        assertThrows(PayoutRejectedException.class, () -> payoutService.releaseEarly(scheduleId));

        assertEquals(PayoutStatus.PROCESSING, payoutService.get(scheduleId).getStatus());
        assertEquals(EscrowHoldStatus.REFUNDED,
            escrowService.findByBooking(booking.getBookingId()).orElseThrow().getStatus());
        assertTrue(ledgerService.getUserLedger(providerId).isEmpty());
        assertThrows(ResourceNotFoundException.class, () -> walletService.getWallet(providerId));
    }

    @Test
    void testReleaseEarly_ResolvedDisputeDoesNotBlock() {
        Booking booking = completedBooking(BookingType.JOB);
        String scheduleId = eligibleSchedule(booking);
        Dispute dispute = disputeService.open(booking.getBookingId(), customerId, "Late arrival");
        disputeService.updateStatus(dispute.getDisputeId(), DisputeStatus.RESOLVED);
        payoutService.requestEarlyPayout(scheduleId);

        EarlyPayoutResult result = payoutService.releaseEarly(scheduleId);

        assertTrue(result.isSuccess());
    }

    private Booking openBooking(BookingType type) {
        return bookingService.createBooking(customerId, providerId, type,
            LocalDate.now(ZoneOffset.UTC).minusDays(1), LocalTime.of(9, 0),
            Money.of("100.00", Currency.USD), Money.of("85.00", Currency.USD));
    }

    private Booking completedBooking(BookingType type) {
        return bookingService.completeBooking(openBooking(type).getBookingId());
    }

    private String eligibleSchedule(Booking booking) {
        PayoutSchedule schedule = payoutService.createScheduleForCompletedBooking(booking.getBookingId());
        PayoutSchedule stored = payoutScheduleRepository.findById(schedule.getScheduleId()).orElseThrow();
        stored.setEarlyPayoutEligibleAt(Instant.now().minus(1, ChronoUnit.HOURS));
        payoutScheduleRepository.save(stored);
        return schedule.getScheduleId();
    }
}
