package com.paymentengine.disputes;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface DisputeRepository extends JpaRepository<Dispute, String> {

    boolean existsByBookingIdAndStatusIn(String bookingId, Collection<DisputeStatus> statuses);

    List<Dispute> findByBookingId(String bookingId);
}
