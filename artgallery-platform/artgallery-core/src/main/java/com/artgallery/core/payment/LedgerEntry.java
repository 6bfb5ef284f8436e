package com.artgallery.core.payment;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Objects;

/**
 * Double-entry ledger line. Immutable once created.
 */
public record LedgerEntry(
        String reference,
        Instant timestamp,
        String debitAccount,
        String creditAccount,
        BigInteger amount,
        String memo
) {

    public LedgerEntry {
        Objects.requireNonNull(reference, "Reference cannot be null");
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        if (debitAccount.equals(creditAccount)) {
            throw new IllegalArgumentException("Debit and credit accounts must be different");
        }
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
    }
}
