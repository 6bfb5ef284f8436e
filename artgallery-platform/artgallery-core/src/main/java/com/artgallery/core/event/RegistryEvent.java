package com.artgallery.core.event;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One committed entry of the event log, hash-chained to its predecessor.
 *
 * @param sequence   position in the log, starting at 0
 * @param subject    key of the record the event is about (asset id, gallery key, administrator)
 * @param attributes the operation's key fields, as strings
 */
public record RegistryEvent(
        long sequence,
        RegistryEventType type,
        String subject,
        Map<String, String> attributes,
        Instant timestamp,
        String prevHash,
        String hash
) {

    public RegistryEvent {
        Objects.requireNonNull(type, "Type cannot be null");
        Objects.requireNonNull(subject, "Subject cannot be null");
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        Objects.requireNonNull(prevHash, "Previous hash cannot be null");
        Objects.requireNonNull(hash, "Hash cannot be null");
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }

    public String attribute(String name) {
        String value = attributes.get(name);
        if (value == null) {
            throw new IllegalStateException(type + " event " + sequence + " has no attribute '" + name + "'");
        }
        return value;
    }

    public long longAttribute(String name) {
        return Long.parseLong(attribute(name));
    }

    public int intAttribute(String name) {
        return Integer.parseInt(attribute(name));
    }

    public BigInteger amountAttribute(String name) {
        return new BigInteger(attribute(name));
    }

    public boolean followsFrom(RegistryEvent previous) {
        return previous.hash().equals(prevHash) && previous.sequence() + 1 == sequence;
    }

    /**
     * Event content before it is sequenced and hashed by the log.
     */
    public record Draft(RegistryEventType type, String subject, Map<String, String> attributes) {

        public Draft {
            Objects.requireNonNull(type, "Type cannot be null");
            Objects.requireNonNull(subject, "Subject cannot be null");
            attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
        }
    }
}
