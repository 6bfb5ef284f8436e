package com.artgallery.api.event;

import com.artgallery.core.event.EventLog;
import com.artgallery.core.event.RegistryEvent;
import com.artgallery.core.event.RegistryEventType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Read-only feed over the registry event log, for indexers and audit.
 */
@RestController
@RequestMapping("/api/v1/events")
public class EventController {

    private final EventLog eventLog;

    public EventController(EventLog eventLog) {
        this.eventLog = eventLog;
    }

    /**
     * Events after the given sequence number, optionally of one type.
     * GET /api/v1/events?after=&type=
     */
    @GetMapping
    public ResponseEntity<List<RegistryEvent>> getEvents(
            @RequestParam(defaultValue = "-1") long after,
            @RequestParam(required = false) RegistryEventType type) {
        List<RegistryEvent> events = eventLog.since(after);
        if (type != null) {
            events = events.stream().filter(event -> event.type() == type).toList();
        }
        return ResponseEntity.ok(events);
    }

    @GetMapping("/verification")
    public ResponseEntity<VerificationResponse> verifyChain() {
        EventLog.ChainVerificationResult result = eventLog.verifyChain();
        return ResponseEntity.ok(new VerificationResponse(
                result.isValid(), result.verifiedCount(), eventLog.getLastHash(), result.violations()));
    }

    public record VerificationResponse(boolean valid, int verifiedCount, String lastHash, List<String> violations) {}
}
