package io.aegis.core.audit;

import java.util.ArrayList;
import java.util.List;

public final class InMemoryAuditStore implements AuditStore {
    private final List<AuditEvent> events = new ArrayList<>();

    @Override
    public synchronized List<AuditEvent> load() {
        return List.copyOf(events);
    }

    @Override
    public synchronized void append(AuditEvent event) {
        events.add(event);
    }
}
