package medguard.core.port.out;

import io.smallrye.mutiny.Uni;

import medguard.core.model.audit.AuditEvent;

/**
 * Port to the external audit logger.
 *
 * <p>The returned {@code Uni} completes when the event is durably recorded. The
 * caller awaits it before any allow decision or state change becomes visible, so
 * a failed or missing acknowledgement aborts the operation.
 */
public interface AuditLogger {

    /**
     * Returns the name of this sink (e.g., "logging", "json-file").
     */
    String name();

    /**
     * Emit an event.
     *
     * @param event the event to record
     * @return Uni completing on acknowledgement, or failing if the sink rejected the event
     */
    Uni<Void> emit(AuditEvent event);

    /**
     * Release any resources held by the sink.
     */
    default void close() {}
}
