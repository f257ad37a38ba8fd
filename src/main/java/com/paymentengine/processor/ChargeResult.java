package com.paymentengine.processor;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one charge call, already classified.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChargeResult {

    private ChargeStatus status;

    /**
     * Processor's transaction reference, set on success.
     */
    private String externalReference;

    private ChargeFailureCode failureCode;

    private String failureReason;

    public static ChargeResult succeeded(String externalReference) {
        return ChargeResult.builder()
            .status(ChargeStatus.SUCCEEDED)
            .externalReference(externalReference)
            .build();
    }

    public static ChargeResult failed(ChargeFailureCode code, String reason) {
        return ChargeResult.builder()
            .status(ChargeStatus.FAILED)
            .failureCode(code)
            .failureReason(reason)
            .build();
    }

    public boolean isSucceeded() {
        return status == ChargeStatus.SUCCEEDED;
    }
}
