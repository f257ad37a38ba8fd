package com.paymentengine.refunds;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RefundRepository extends JpaRepository<Refund, String> {

    Optional<Refund> findByBookingId(String bookingId);

    List<Refund> findByCustomerIdOrderByCreatedAtDesc(String customerId);
}
