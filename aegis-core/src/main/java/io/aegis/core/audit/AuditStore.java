package io.aegis.core.audit;

import java.io.IOException;
import java.util.List;

public interface AuditStore {
    List<AuditEvent> load() throws IOException;

    void append(AuditEvent event) throws IOException;
}
