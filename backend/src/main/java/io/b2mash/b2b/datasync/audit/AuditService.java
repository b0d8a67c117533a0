package io.b2mash.b2b.datasync.audit;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

/** Records and queries the append-only audit trail. */
public interface AuditService {

  /**
   * Persists an audit event in its own transaction. A failure to write is logged with the {@code
   * AUDIT_GAP} marker and never propagates to the caller.
   */
  void log(AuditEventRecord record);

  /**
   * Returns events of the current tenant matching {@code filter}, newest first.
   *
   * @throws io.b2mash.b2b.datasync.exception.MissingTenantContextException if no tenant is bound
   */
  Page<AuditEvent> findEvents(AuditEventFilter filter, Pageable pageable);
}
