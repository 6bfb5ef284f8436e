package com.artgallery.core.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Append-only, hash-chained record of every committed registry transition.
 *
 * Downstream indexers rebuild their view by replaying {@link #all()} from the start,
 * or follow the feed incrementally with {@link #since(long)} and {@link #subscribe}.
 * Subscribers are observers only: their failures are logged and never undo an append.
 */
public class EventLog {

    private static final Logger log = LoggerFactory.getLogger(EventLog.class);

    public static final String GENESIS_HASH = "0000000000000000000000000000000000000000000000000000000000000000";
    private static final String HASH_ALGORITHM = "SHA-256";

    private final List<RegistryEvent> events = new ArrayList<>();
    private final Map<String, Consumer<RegistryEvent>> subscribers = new ConcurrentHashMap<>();
    private String lastHash = GENESIS_HASH;
    private EventJournal journal;

    /**
     * Sequences, hashes and appends a drafted event, then notifies subscribers.
     */
    public RegistryEvent append(RegistryEvent.Draft draft, Instant timestamp) {
        Objects.requireNonNull(draft, "Draft cannot be null");
        return appendAll(List.of(draft), timestamp).get(0);
    }

    /**
     * Appends a batch of drafts atomically. The batch is chained and written to the
     * attached journal first; only when the journal accepts it do the events join the
     * log and reach subscribers. A journal failure propagates and leaves the log unchanged.
     */
    public List<RegistryEvent> appendAll(List<RegistryEvent.Draft> drafts, Instant timestamp) {
        Objects.requireNonNull(drafts, "Drafts cannot be null");
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");

        List<RegistryEvent> batch = new ArrayList<>(drafts.size());
        synchronized (this) {
            String previous = lastHash;
            long sequence = events.size();
            for (RegistryEvent.Draft draft : drafts) {
                String hash = computeHash(sequence, draft.type(), draft.subject(), draft.attributes(), timestamp, previous);
                batch.add(new RegistryEvent(sequence, draft.type(), draft.subject(), draft.attributes(),
                        timestamp, previous, hash));
                previous = hash;
                sequence++;
            }
            if (batch.isEmpty()) {
                return List.of();
            }
            if (journal != null) {
                journal.write(List.copyOf(batch));
            }
            events.addAll(batch);
            lastHash = previous;
        }
        batch.forEach(this::notifySubscribers);
        return List.copyOf(batch);
    }

    /**
     * Makes every later append durable in {@code journal} before it becomes visible.
     */
    public synchronized void attachJournal(EventJournal journal) {
        this.journal = Objects.requireNonNull(journal, "Journal cannot be null");
    }

    /**
     * Appends an event produced by another log instance (journal recovery).
     * The event must continue this chain exactly.
     */
    public synchronized void appendVerified(RegistryEvent event) {
        Objects.requireNonNull(event, "Event cannot be null");

        if (event.sequence() != events.size()) {
            throw new ChainIntegrityException(
                    "Event sequence out of order: expected " + events.size() + ", got " + event.sequence());
        }
        if (!event.prevHash().equals(lastHash)) {
            throw new ChainIntegrityException(
                    "Event prev_hash does not match last hash: expected " + lastHash + ", got " + event.prevHash());
        }
        String expectedHash = computeHash(event.sequence(), event.type(), event.subject(),
                event.attributes(), event.timestamp(), event.prevHash());
        if (!expectedHash.equals(event.hash())) {
            throw new ChainIntegrityException(
                    "Event hash mismatch at sequence " + event.sequence() + ": expected " + expectedHash
                            + ", got " + event.hash());
        }

        events.add(event);
        lastHash = event.hash();
    }

    /**
     * Recomputes every hash and link from genesis.
     */
    public synchronized ChainVerificationResult verifyChain() {
        List<String> violations = new ArrayList<>();
        String expectedPrevHash = GENESIS_HASH;
        int verified = 0;

        for (int i = 0; i < events.size(); i++) {
            RegistryEvent event = events.get(i);
            if (event.sequence() != i) {
                violations.add("Sequence gap at position " + i + ": found " + event.sequence());
            }
            if (!event.prevHash().equals(expectedPrevHash)) {
                violations.add("Chain break at event " + event.sequence()
                        + ": expected prev_hash " + expectedPrevHash + ", got " + event.prevHash());
            }
            String computed = computeHash(event.sequence(), event.type(), event.subject(),
                    event.attributes(), event.timestamp(), event.prevHash());
            if (!computed.equals(event.hash())) {
                violations.add("Hash mismatch at event " + event.sequence()
                        + ": expected " + computed + ", got " + event.hash());
            }
            expectedPrevHash = event.hash();
            verified++;
        }

        return new ChainVerificationResult(violations.isEmpty(), verified, violations);
    }

    public synchronized List<RegistryEvent> all() {
        return List.copyOf(events);
    }

    /**
     * Events with a sequence strictly greater than {@code sequence}; pass -1 for everything.
     */
    public synchronized List<RegistryEvent> since(long sequence) {
        int from = (int) Math.max(0, Math.min(events.size(), sequence + 1));
        return List.copyOf(events.subList(from, events.size()));
    }

    public synchronized List<RegistryEvent> ofType(RegistryEventType type) {
        return events.stream().filter(e -> e.type() == type).toList();
    }

    public synchronized String getLastHash() {
        return lastHash;
    }

    public synchronized int size() {
        return events.size();
    }

    public synchronized boolean isEmpty() {
        return events.isEmpty();
    }

    public String subscribe(Consumer<RegistryEvent> subscriber) {
        Objects.requireNonNull(subscriber, "Subscriber cannot be null");
        String subscriptionId = UUID.randomUUID().toString();
        subscribers.put(subscriptionId, subscriber);
        return subscriptionId;
    }

    public void unsubscribe(String subscriptionId) {
        subscribers.remove(subscriptionId);
    }

    private void notifySubscribers(RegistryEvent event) {
        for (Map.Entry<String, Consumer<RegistryEvent>> entry : subscribers.entrySet()) {
            try {
                entry.getValue().accept(event);
            } catch (RuntimeException e) {
                // the event is committed; a failing consumer must not undo it
                log.warn("Subscriber {} failed on event {} ({})", entry.getKey(), event.sequence(), event.type(), e);
            }
        }
    }

    static String computeHash(long sequence, RegistryEventType type, String subject,
                              Map<String, String> attributes, Instant timestamp, String prevHash) {
        try {
            MessageDigest digest = MessageDigest.getInstance(HASH_ALGORITHM);

            StringBuilder sb = new StringBuilder();
            sb.append(sequence).append('|');
            sb.append(type.name()).append('|');
            sb.append(subject).append('|');
            sb.append(timestamp).append('|');
            sb.append(prevHash).append('|');
            attributes.entrySet().stream()
                    .sorted(Map.Entry.comparingByKey())
                    .forEach(e -> sb.append(e.getKey()).append('=').append(e.getValue()).append(','));

            return HexFormat.of().formatHex(digest.digest(sb.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Outcome of {@link #verifyChain()}.
     */
    public record ChainVerificationResult(
            boolean isValid,
            int verifiedCount,
            List<String> violations
    ) {}

    /**
     * Raised when an event does not continue the chain it is appended to.
     */
    public static class ChainIntegrityException extends RuntimeException {
        public ChainIntegrityException(String message) {
            super(message);
        }
    }
}
