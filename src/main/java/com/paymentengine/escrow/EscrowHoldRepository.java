package com.paymentengine.escrow;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface EscrowHoldRepository extends JpaRepository<EscrowHold, String> {

    Optional<EscrowHold> findByBookingId(String bookingId);
}
