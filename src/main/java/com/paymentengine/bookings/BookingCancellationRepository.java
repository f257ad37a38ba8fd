package com.paymentengine.bookings;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface BookingCancellationRepository extends JpaRepository<BookingCancellation, String> {

    Optional<BookingCancellation> findByBookingId(String bookingId);
}
