package com.paymentengine.wallet;

import com.paymentengine.common.Money;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A user's marketplace balance. The balance column is only ever changed by
 * {@link WalletRepository#applyDelta}; the entity has no setter-based update path
 * in the services.
 */
@Entity
@Table(name = "wallets", uniqueConstraints = {
    @UniqueConstraint(name = "uk_wallet_owner", columnNames = "owner_id")
})
@Data
@NoArgsConstructor
public class Wallet {

    @Id
    private String walletId;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private String ownerId;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "amount", column = @Column(name = "balance_amount")),
        @AttributeOverride(name = "currency", column = @Column(name = "balance_currency"))
    })
    private Money balance;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public Wallet(String ownerId, Money openingBalance, Instant now) {
        this.walletId = UUID.randomUUID().toString();
        this.ownerId = ownerId;
        this.balance = openingBalance;
        this.createdAt = now;
        this.updatedAt = now;
    }
}
