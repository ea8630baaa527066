package io.aegis.core.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.aegis.core.middleware.SecretsDetector;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records security-relevant events. Text is redacted before it is kept or persisted; store
 * failures are logged and never interrupt the caller.
 */
public final class AuditTrail {
    private static final Logger LOG = LoggerFactory.getLogger(AuditTrail.class);
    private static final int MAX_EVENTS = 10_000;

    private final AuditStore store;
    private final Clock clock;
    private final SecretsDetector secretsDetector;
    private final boolean structured;
    private final ObjectMapper mapper;
    private final Deque<AuditEvent> events = new ArrayDeque<>();

    public AuditTrail(AuditStore store, Clock clock, SecretsDetector secretsDetector, boolean structured) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.secretsDetector = Objects.requireNonNull(secretsDetector, "secretsDetector must not be null");
        this.structured = structured;
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public static AuditTrail inMemory(Clock clock) {
        return new AuditTrail(new InMemoryAuditStore(), clock, new SecretsDetector(), true);
    }

    public synchronized AuditEvent record(
        AuditSeverity severity,
        AuditEventType type,
        String operation,
        String resource,
        AuditResult result,
        String message,
        Map<String, Object> details
    ) {
        AuditEvent event = new AuditEvent(
            UUID.randomUUID().toString(),
            clock.instant(),
            severity,
            type,
            operation,
            secretsDetector.redact(resource),
            result,
            secretsDetector.redact(message),
            redact(details)
        );
        events.addLast(event);
        while (events.size() > MAX_EVENTS) {
            events.removeFirst();
        }
        try {
            store.append(event);
        } catch (IOException e) {
            LOG.warn("Failed to persist audit event {}: {}", event.id(), e.getMessage());
        }
        return event;
    }

    /**
     * Newest first.
     */
    public synchronized List<AuditEvent> recent(int limit) {
        int safe = Math.max(1, limit);
        List<AuditEvent> out = new ArrayList<>(Math.min(safe, events.size()));
        Iterator<AuditEvent> it = events.descendingIterator();
        while (it.hasNext() && out.size() < safe) {
            out.add(it.next());
        }
        return out;
    }

    /**
     * Everything recorded since start-up, oldest first, as JSON lines or as text lines
     * depending on the structured flag.
     */
    public synchronized String export() {
        StringBuilder out = new StringBuilder();
        for (AuditEvent event : events) {
            out.append(structured ? toJson(event) : event.toLine()).append('\n');
        }
        return out.toString();
    }

    public List<AuditEvent> history() throws IOException {
        return store.load();
    }

    private String toJson(AuditEvent event) {
        try {
            return mapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize audit event " + event.id(), e);
        }
    }

    private Map<String, Object> redact(Map<String, Object> details) {
        if (details == null || details.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> out = new LinkedHashMap<>();
        details.forEach((key, value) -> {
            if (key == null || value == null) {
                return;
            }
            out.put(key, value instanceof String text ? secretsDetector.redact(text) : value);
        });
        return out;
    }
}
