package com.paymentengine.processor;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;

/**
 * Maps processor error codes onto {@link ChargeFailureCode}.
 *
 * Codes follow the common card-network vocabulary (decline codes such as
 * {@code do_not_honor}, {@code expired_card}). Unknown card-level codes count as
 * declines; anything unrecognised is treated as the processor being unavailable so
 * it enters the normal retry path.
 */
@Component
public class ChargeFailureClassifier {

    private static final Set<String> INSUFFICIENT_FUNDS_CODES = Set.of(
        "insufficient_funds",
        "card_velocity_exceeded",
        "withdrawal_count_limit_exceeded"
    );

    private static final Set<String> AUTHENTICATION_CODES = Set.of(
        "authentication_required",
        "authentication_not_handled",
        "requires_action",
        "payment_intent_authentication_failure"
    );

    private static final Set<String> DECLINE_CODES = Set.of(
        "card_declined",
        "generic_decline",
        "do_not_honor",
        "expired_card",
        "incorrect_cvc",
        "incorrect_number",
        "lost_card",
        "stolen_card",
        "pickup_card",
        "restricted_card",
        "transaction_not_allowed"
    );

    private static final Set<String> UNAVAILABLE_CODES = Set.of(
        "processing_error",
        "api_connection_error",
        "rate_limit",
        "timeout",
        "service_unavailable"
    );

    public ChargeFailureCode classify(String processorCode) {
        if (processorCode == null || processorCode.isBlank()) {
            return ChargeFailureCode.PROCESSOR_UNAVAILABLE;
        }
        String code = processorCode.trim().toLowerCase(Locale.ROOT);

        if (INSUFFICIENT_FUNDS_CODES.contains(code)) {
            return ChargeFailureCode.INSUFFICIENT_FUNDS;
        }
        if (AUTHENTICATION_CODES.contains(code)) {
            return ChargeFailureCode.AUTHENTICATION_REQUIRED;
        }
        if (UNAVAILABLE_CODES.contains(code)) {
            return ChargeFailureCode.PROCESSOR_UNAVAILABLE;
        }
        if (DECLINE_CODES.contains(code) || code.endsWith("_card") || code.contains("decline")) {
            return ChargeFailureCode.CARD_DECLINED;
        }
        return ChargeFailureCode.PROCESSOR_UNAVAILABLE;
    }
}
