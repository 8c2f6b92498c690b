package tech.yump.secretmanager.audit;

/**
 * Destination for audit events.
 */
public interface AuditBackend {

    /**
     * Records the event. Implementations must not throw for serialization problems.
     *
     * @param event the event to record; never null when called through {@link AuditHelper}.
     */
    void logEvent(AuditEvent event);

}
