package com.paymentengine.disputes;

import com.paymentengine.common.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

@Service
@RequiredArgsConstructor
@Slf4j
public class DisputeService {

    /**
     * Statuses that block early release of escrowed funds.
     */
    private static final Set<DisputeStatus> PAYOUT_BLOCKING =
        EnumSet.of(DisputeStatus.OPEN, DisputeStatus.UNDER_REVIEW);

    private final DisputeRepository disputeRepository;
    private final Clock clock;

    @Transactional
    public Dispute open(String bookingId, String raisedBy, String reason) {
        Dispute dispute = new Dispute(bookingId, raisedBy, reason, clock.instant());
        disputeRepository.save(dispute);

        log.info("Opened dispute {} on booking {} by {}", dispute.getDisputeId(), bookingId, raisedBy);
        return dispute;
    }

    @Transactional
    public Dispute updateStatus(String disputeId, DisputeStatus status) {
        Dispute dispute = disputeRepository.findById(disputeId)
            .orElseThrow(() -> new ResourceNotFoundException("Dispute", disputeId));
        log.info("Dispute {} {} -> {}", disputeId, dispute.getStatus(), status);
        dispute.setStatus(status);
        dispute.setUpdatedAt(clock.instant());
        return disputeRepository.save(dispute);
    }

    @Transactional(readOnly = true)
    public boolean hasActiveDisputes(String bookingId) {
        return disputeRepository.existsByBookingIdAndStatusIn(bookingId, PAYOUT_BLOCKING);
    }

    @Transactional(readOnly = true)
    public List<Dispute> listByBooking(String bookingId) {
        return disputeRepository.findByBookingId(bookingId);
    }
}
