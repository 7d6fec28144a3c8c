package in.brainlog.repository;

import in.brainlog.domain.audit.AuditEvent;

/**
 * Append-only store for audit events.
 */
public interface AuditSink {

    /**
     * @throws AuditSinkException if the event could not be stored
     */
    void record(AuditEvent event);
}
