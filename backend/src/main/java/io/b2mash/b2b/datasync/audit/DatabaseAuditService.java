package io.b2mash.b2b.datasync.audit;

import io.b2mash.b2b.datasync.multitenancy.RequestScopes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Database-backed {@link AuditService}.
 *
 * <p>{@code log()} writes in a {@code REQUIRES_NEW} transaction so an audit row survives a rollback
 * of the primary operation, and a broken audit store does not abort it: the failure is logged at
 * ERROR with the {@code AUDIT_GAP} marker and swallowed.
 */
@Service
public class DatabaseAuditService implements AuditService {

  private static final Logger log = LoggerFactory.getLogger(DatabaseAuditService.class);

  private final AuditEventRepository auditEventRepository;
  private final TransactionTemplate requiresNew;

  public DatabaseAuditService(
      AuditEventRepository auditEventRepository, PlatformTransactionManager transactionManager) {
    this.auditEventRepository = auditEventRepository;
    this.requiresNew = new TransactionTemplate(transactionManager);
    this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  @Override
  public void log(AuditEventRecord record) {
    try {
      requiresNew.executeWithoutResult(status -> auditEventRepository.save(new AuditEvent(record)));
      log.debug(
          "Recorded audit event: type={}, resource={}/{}, actor={}",
          record.eventType(),
          record.resourceType(),
          record.resourceId(),
          record.actorId());
    } catch (RuntimeException e) {
      log.error(
          "AUDIT_GAP: failed to record audit event type={}, tenant={}, resource={}/{}, actor={}",
          record.eventType(),
          record.tenantId(),
          record.resourceType(),
          record.resourceId(),
          record.actorId(),
          e);
    }
  }

  @Override
  @Transactional(readOnly = true)
  public Page<AuditEvent> findEvents(AuditEventFilter filter, Pageable pageable) {
    return auditEventRepository.findByFilter(
        RequestScopes.requireTenantId(),
        filter.resourceType(),
        filter.resourceId(),
        filter.actorId(),
        filter.eventType(),
        filter.from(),
        filter.to(),
        pageable);
  }
}
