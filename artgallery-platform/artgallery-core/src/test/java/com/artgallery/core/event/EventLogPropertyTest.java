package com.artgallery.core.event;

import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for the hash-chained event log.
 */
class EventLogPropertyTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    /**
     * Any sequence of appended events forms a valid chain with gap-free sequence numbers.
     */
    @Property(tries = 100)
    void appendedEvents_formValidChain(@ForAll("drafts") List<RegistryEvent.Draft> drafts) {
        EventLog log = new EventLog();
        for (int i = 0; i < drafts.size(); i++) {
            log.append(drafts.get(i), T0.plusSeconds(i));
        }

        EventLog.ChainVerificationResult result = log.verifyChain();
        assertThat(result.isValid()).as("Chain should be valid").isTrue();
        assertThat(result.verifiedCount()).isEqualTo(drafts.size());
        assertThat(result.violations()).isEmpty();

        List<RegistryEvent> events = log.all();
        for (int i = 0; i < events.size(); i++) {
            assertThat(events.get(i).sequence()).isEqualTo(i);
            if (i == 0) {
                assertThat(events.get(i).prevHash()).isEqualTo(EventLog.GENESIS_HASH);
            } else {
                assertThat(events.get(i).followsFrom(events.get(i - 1))).isTrue();
            }
        }
        if (!events.isEmpty()) {
            assertThat(log.getLastHash()).isEqualTo(events.get(events.size() - 1).hash());
        }
    }

    /**
     * Replaying the events of one log into another reproduces the same chain.
     */
    @Property(tries = 50)
    void appendVerified_acceptsFaithfulCopy(@ForAll("drafts") List<RegistryEvent.Draft> drafts) {
        EventLog source = new EventLog();
        drafts.forEach(draft -> source.append(draft, T0));

        EventLog copy = new EventLog();
        source.all().forEach(copy::appendVerified);

        assertThat(copy.all()).isEqualTo(source.all());
        assertThat(copy.getLastHash()).isEqualTo(source.getLastHash());
    }

    /**
     * Altering any attribute of any event breaks the chain when it is re-verified.
     */
    @Property(tries = 50)
    void tamperedEvent_isRejected(
            @ForAll("nonEmptyDrafts") List<RegistryEvent.Draft> drafts,
            @ForAll @IntRange(min = 0, max = 100) int position) {
        EventLog source = new EventLog();
        drafts.forEach(draft -> source.append(draft, T0));
        List<RegistryEvent> events = new ArrayList<>(source.all());
        int target = position % events.size();

        RegistryEvent original = events.get(target);
        Map<String, String> altered = new HashMap<>(original.attributes());
        altered.merge("amount", "0", String::concat);
        events.set(target, new RegistryEvent(original.sequence(), original.type(), original.subject(), altered,
                original.timestamp(), original.prevHash(), original.hash()));

        EventLog copy = new EventLog();
        assertThatThrownBy(() -> events.forEach(copy::appendVerified))
                .isInstanceOf(EventLog.ChainIntegrityException.class)
                .hasMessageContaining("hash mismatch");
        assertThat(copy.size()).isEqualTo(target);
    }

    /**
     * since(n) returns exactly the events after sequence n, in order.
     */
    @Property(tries = 50)
    void since_returnsSuffix(
            @ForAll("drafts") List<RegistryEvent.Draft> drafts,
            @ForAll @IntRange(min = -1, max = 40) int after) {
        EventLog log = new EventLog();
        drafts.forEach(draft -> log.append(draft, T0));

        List<RegistryEvent> suffix = log.since(after);

        int expectedSize = Math.max(0, drafts.size() - (after + 1));
        assertThat(suffix).hasSize(expectedSize);
        for (int i = 0; i < suffix.size(); i++) {
            assertThat(suffix.get(i).sequence()).isEqualTo(after + 1L + i);
        }
    }

    @Example
    void outOfOrderEvent_isRejected() {
        EventLog source = new EventLog();
        source.append(new RegistryEvent.Draft(RegistryEventType.GALLERY_CREATED, "a", Map.of()), T0);
        source.append(new RegistryEvent.Draft(RegistryEventType.GALLERY_CREATED, "b", Map.of()), T0);

        EventLog copy = new EventLog();
        assertThatThrownBy(() -> copy.appendVerified(source.all().get(1)))
                .isInstanceOf(EventLog.ChainIntegrityException.class)
                .hasMessageContaining("out of order");
    }

    @Example
    void subscribers_seeEventsAfterAppend_andFailuresDoNotUndoThem() {
        EventLog log = new EventLog();
        List<RegistryEvent> seen = new ArrayList<>();
        log.subscribe(event -> {
            throw new IllegalStateException("consumer down");
        });
        String id = log.subscribe(seen::add);

        RegistryEvent appended = log.append(
                new RegistryEvent.Draft(RegistryEventType.PRICE_UPDATED, "1", Map.of("price", "10")), T0);
        log.unsubscribe(id);
        log.append(new RegistryEvent.Draft(RegistryEventType.PRICE_UPDATED, "1", Map.of("price", "20")), T0);

        assertThat(seen).containsExactly(appended);
        assertThat(log.size()).isEqualTo(2);
        assertThat(log.ofType(RegistryEventType.PRICE_UPDATED)).hasSize(2);
    }

    @Example
    void journalFailure_leavesLogAndSubscribersUntouched() {
        EventLog log = new EventLog();
        List<RegistryEvent> journaled = new ArrayList<>();
        List<RegistryEvent> seen = new ArrayList<>();
        log.subscribe(seen::add);
        log.attachJournal(batch -> {
            if (batch.stream().anyMatch(event -> event.type() == RegistryEventType.ASSET_SOLD)) {
                throw new UncheckedIOException(new IOException("disk full"));
            }
            journaled.addAll(batch);
        });

        log.append(new RegistryEvent.Draft(RegistryEventType.GALLERY_CREATED, "g1", Map.of()), T0);
        String hashBefore = log.getLastHash();

        assertThatThrownBy(() -> log.appendAll(List.of(
                new RegistryEvent.Draft(RegistryEventType.PRICE_UPDATED, "1", Map.of("price", "5")),
                new RegistryEvent.Draft(RegistryEventType.ASSET_SOLD, "1", Map.of("buyer", "0xb"))), T0))
                .isInstanceOf(UncheckedIOException.class);

        assertThat(log.size()).isEqualTo(1);
        assertThat(log.getLastHash()).isEqualTo(hashBefore);
        assertThat(seen).hasSize(1);
        assertThat(journaled).containsExactlyElementsOf(log.all());

        RegistryEvent next = log.append(
                new RegistryEvent.Draft(RegistryEventType.PRICE_UPDATED, "1", Map.of("price", "6")), T0);
        assertThat(next.sequence()).isEqualTo(1);
        assertThat(journaled).containsExactlyElementsOf(log.all());
    }

    @Provide
    Arbitrary<List<RegistryEvent.Draft>> nonEmptyDrafts() {
        return draft().list().ofMinSize(1).ofMaxSize(25);
    }

    @Provide
    Arbitrary<List<RegistryEvent.Draft>> drafts() {
        return draft().list().ofMaxSize(25);
    }

    private Arbitrary<RegistryEvent.Draft> draft() {
        Arbitrary<RegistryEventType> types = Arbitraries.of(RegistryEventType.class);
        Arbitrary<String> subjects = Arbitraries.strings().alpha().numeric().ofMinLength(1).ofMaxLength(12);
        Arbitrary<Map<String, String>> attributes = Arbitraries.maps(
                Arbitraries.strings().alpha().ofMinLength(1).ofMaxLength(8),
                Arbitraries.strings().ofMaxLength(20)).ofMaxSize(4);
        return Combinators.combine(types, subjects, attributes)
                .as(RegistryEvent.Draft::new);
    }
}
