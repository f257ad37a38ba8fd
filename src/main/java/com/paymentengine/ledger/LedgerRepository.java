package com.paymentengine.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for ledger transactions.
 */
@Repository
public interface LedgerRepository extends JpaRepository<LedgerTransaction, String> {

    List<LedgerTransaction> findByUserIdOrderByCreatedAtDesc(String userId);

    List<LedgerTransaction> findByReferenceTypeAndReferenceId(ReferenceType referenceType, String referenceId);

    Optional<LedgerTransaction> findByIdempotencyKey(String idempotencyKey);

    long countByTransactionType(TransactionType transactionType);
}
