package com.artgallery.core.event;

import java.util.List;

/**
 * Durable store written as part of every commit. A failed write aborts the commit.
 */
@FunctionalInterface
public interface EventJournal {

    /**
     * Persists a batch of sequenced events, or throws without having persisted any.
     */
    void write(List<RegistryEvent> events);
}
