package medguard.adapter.out.audit;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import io.smallrye.mutiny.Uni;

import medguard.core.model.audit.AuditEvent;
import medguard.core.model.audit.AuditEventKind;
import medguard.core.port.out.AuditLogger;

/**
 * Audit sink that keeps events in memory.
 *
 * <p>Intended for development and tests. It can be told to reject events, which
 * simulates an unavailable sink.
 */
public class InMemoryAuditLogger implements AuditLogger {

    private final CopyOnWriteArrayList<AuditEvent> events = new CopyOnWriteArrayList<>();
    private final AtomicReference<RuntimeException> failure = new AtomicReference<>();

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public Uni<Void> emit(AuditEvent event) {
        return Uni.createFrom().item(() -> {
            final var rejection = failure.get();
            if (rejection != null) {
                throw rejection;
            }
            events.add(event);
            return null;
        });
    }

    /**
     * Reject every following event with the given exception.
     */
    public void failWith(RuntimeException cause) {
        failure.set(cause);
    }

    /**
     * Accept events again.
     */
    public void recover() {
        failure.set(null);
    }

    public List<AuditEvent> events() {
        return List.copyOf(events);
    }

    public List<AuditEvent> events(AuditEventKind kind) {
        return events.stream().filter(event -> event.kind() == kind).toList();
    }

    public void clear() {
        events.clear();
    }
}
