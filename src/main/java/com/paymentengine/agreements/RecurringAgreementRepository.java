package com.paymentengine.agreements;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface RecurringAgreementRepository extends JpaRepository<RecurringAgreement, String> {

    List<RecurringAgreement> findByActiveTrueAndNextBillingDateLessThanEqual(LocalDate date);

    List<RecurringAgreement> findByCustomerId(String customerId);
}
