package com.paymentengine.escrow;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PayoutScheduleRepository extends JpaRepository<PayoutSchedule, String> {

    Optional<PayoutSchedule> findByBookingId(String bookingId);

    List<PayoutSchedule> findByProviderIdOrderByScheduledPayoutDateAsc(String providerId);
}
