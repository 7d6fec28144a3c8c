package in.brainlog.repository;

import in.brainlog.domain.audit.AuditLogEntry;
import in.brainlog.domain.audit.AuditLogQuery;

import java.util.List;

/**
 * Read side of the audit log, newest events first.
 */
public interface AuditLogRepository {

    /**
     * @throws AuditSinkException if the audit store cannot be read
     */
    List<AuditLogEntry> find(AuditLogQuery query);
}
