package com.artgallery.core.payment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * In-process payment substrate backed by a double-entry ledger.
 * Every payout debits the registry escrow account and credits the recipient's account.
 * Frozen accounts reject incoming transfers.
 */
public class LedgerPaymentGateway implements PaymentGateway {

    private static final Logger log = LoggerFactory.getLogger(LedgerPaymentGateway.class);
    private static final String ACCOUNT_PREFIX = "ACCOUNT:";

    private final String escrowAccount;
    private final Clock clock;
    private final List<LedgerEntry> entries = new ArrayList<>();
    private final Map<String, BigInteger> balances = new HashMap<>();
    private final Set<String> frozen = new HashSet<>();

    public LedgerPaymentGateway(String escrowAccount, Clock clock) {
        this.escrowAccount = Objects.requireNonNull(escrowAccount, "Escrow account cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    @Override
    public synchronized TransferResult transfer(String recipient, BigInteger amount) {
        if (recipient == null || recipient.isBlank()) {
            return TransferResult.failed(recipient, amount, "Recipient is missing");
        }
        if (amount == null || amount.signum() <= 0) {
            return TransferResult.failed(recipient, amount, "Transfer amount must be positive");
        }
        if (frozen.contains(recipient)) {
            log.warn("Rejected transfer of {} to frozen account {}", amount, recipient);
            return TransferResult.failed(recipient, amount, "Account is frozen: " + recipient);
        }

        String reference = UUID.randomUUID().toString();
        entries.add(new LedgerEntry(reference, clock.instant(), escrowAccount, ACCOUNT_PREFIX + recipient,
                amount, "payout"));
        balances.merge(recipient, amount, BigInteger::add);
        return TransferResult.completed(reference, recipient, amount);
    }

    @Override
    public synchronized void reverse(TransferResult completed) {
        if (!completed.successful()) {
            return;
        }
        entries.add(new LedgerEntry(UUID.randomUUID().toString(), clock.instant(),
                ACCOUNT_PREFIX + completed.recipient(), escrowAccount, completed.amount(),
                "reversal of " + completed.reference()));
        balances.merge(completed.recipient(), completed.amount().negate(), BigInteger::add);
        log.info("Reversed transfer {} of {} to {}", completed.reference(), completed.amount(), completed.recipient());
    }

    public synchronized BigInteger balanceOf(String identity) {
        return balances.getOrDefault(identity, BigInteger.ZERO);
    }

    /**
     * Total paid out of escrow net of reversals; equals the sum of all account balances.
     */
    public synchronized BigInteger totalPaidOut() {
        return balances.values().stream().reduce(BigInteger.ZERO, BigInteger::add);
    }

    public synchronized List<LedgerEntry> entries() {
        return List.copyOf(entries);
    }

    public synchronized void freeze(String identity) {
        frozen.add(identity);
    }

    public synchronized void unfreeze(String identity) {
        frozen.remove(identity);
    }
}
