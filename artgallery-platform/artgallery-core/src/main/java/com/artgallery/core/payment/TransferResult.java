package com.artgallery.core.payment;

import java.math.BigInteger;

/**
 * Outcome of one outward transfer reported by the payment substrate.
 *
 * @param reference substrate-assigned reference, used to reverse the transfer
 */
public record TransferResult(
        String reference,
        String recipient,
        BigInteger amount,
        boolean successful,
        String failureReason
) {

    public static TransferResult completed(String reference, String recipient, BigInteger amount) {
        return new TransferResult(reference, recipient, amount, true, null);
    }

    public static TransferResult failed(String recipient, BigInteger amount, String reason) {
        return new TransferResult(null, recipient, amount, false, reason);
    }
}
