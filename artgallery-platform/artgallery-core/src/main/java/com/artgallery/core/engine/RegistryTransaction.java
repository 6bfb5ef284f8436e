package com.artgallery.core.engine;

import com.artgallery.core.event.EventLog;
import com.artgallery.core.event.RegistryEvent;
import com.artgallery.core.event.RegistryEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Unit of work for one public engine operation.
 * Events are staged and reach the log only on commit; undo actions run in reverse
 * registration order on rollback.
 */
class RegistryTransaction {

    private static final Logger log = LoggerFactory.getLogger(RegistryTransaction.class);

    private final String operation;
    private final Instant timestamp;
    private final List<RegistryEvent.Draft> staged = new ArrayList<>();
    private final List<Runnable> undoActions = new ArrayList<>();

    RegistryTransaction(String operation, Instant timestamp) {
        this.operation = operation;
        this.timestamp = timestamp;
    }

    String operation() {
        return operation;
    }

    Instant timestamp() {
        return timestamp;
    }

    void emit(RegistryEventType type, String subject, Map<String, String> attributes) {
        staged.add(new RegistryEvent.Draft(type, subject, attributes));
    }

    void onRollback(Runnable undo) {
        undoActions.add(undo);
    }

    /**
     * Appends the staged events as one batch. If the log rejects the batch (journal
     * failure) nothing is cleared, so the caller can still roll back.
     */
    List<RegistryEvent> commit(EventLog eventLog) {
        List<RegistryEvent> committed = eventLog.appendAll(List.copyOf(staged), timestamp);
        staged.clear();
        undoActions.clear();
        return committed;
    }

    /**
     * Discards staged events and undoes applied changes. Undo failures are attached to {@code cause}.
     */
    void rollback(RuntimeException cause) {
        staged.clear();
        if (undoActions.isEmpty()) {
            return;
        }
        log.warn("Rolling back {} ({} undo actions): {}", operation, undoActions.size(), cause.getMessage());
        for (int i = undoActions.size() - 1; i >= 0; i--) {
            try {
                undoActions.get(i).run();
            } catch (RuntimeException undoFailure) {
                log.error("Undo action {} of {} failed", i, operation, undoFailure);
                cause.addSuppressed(undoFailure);
            }
        }
        undoActions.clear();
    }
}
