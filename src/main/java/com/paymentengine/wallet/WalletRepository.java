package com.paymentengine.wallet;

import com.paymentengine.common.Currency;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

/**
 * Repository for wallets.
 */
@Repository
public interface WalletRepository extends JpaRepository<Wallet, String> {

    Optional<Wallet> findByOwnerId(String ownerId);

    /**
     * Atomic balance change. Returns 0 when the owner has no wallet in that currency.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Wallet w SET w.balance.amount = w.balance.amount + :delta, w.updatedAt = :now " +
           "WHERE w.ownerId = :ownerId AND w.balance.currency = :currency")
    int applyDelta(@Param("ownerId") String ownerId,
                   @Param("delta") BigDecimal delta,
                   @Param("currency") Currency currency,
                   @Param("now") Instant now);
}
