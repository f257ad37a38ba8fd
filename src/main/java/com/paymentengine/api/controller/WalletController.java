package com.paymentengine.api.controller;

import com.paymentengine.ledger.LedgerService;
import com.paymentengine.ledger.LedgerTransaction;
import com.paymentengine.notifications.Notification;
import com.paymentengine.notifications.NotificationService;
import com.paymentengine.wallet.Wallet;
import com.paymentengine.wallet.WalletService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Read-only views of a user's wallet, ledger and notifications.
 */
@RestController
@RequestMapping("/api/v1/users/{userId}")
@RequiredArgsConstructor
@Tag(name = "Wallets", description = "Wallet, ledger and notification API")
public class WalletController {

    private final WalletService walletService;
    private final LedgerService ledgerService;
    private final NotificationService notificationService;

    @GetMapping("/wallet")
    @Operation(summary = "Get a user's wallet balance")
    public ResponseEntity<Wallet> getWallet(@PathVariable String userId) {
        return ResponseEntity.ok(walletService.getWallet(userId));
    }

    @GetMapping("/ledger")
    @Operation(summary = "Get a user's ledger, newest first")
    public ResponseEntity<List<LedgerTransaction>> getLedger(@PathVariable String userId) {
        return ResponseEntity.ok(ledgerService.getUserLedger(userId));
    }

    @GetMapping("/notifications")
    @Operation(summary = "Get a user's notifications, newest first")
    public ResponseEntity<List<Notification>> getNotifications(@PathVariable String userId) {
        return ResponseEntity.ok(notificationService.getInbox(userId));
    }
}
