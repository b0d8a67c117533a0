package io.b2mash.b2b.datasync.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.b2b.datasync.audit.AuditEventBuilder;
import io.b2mash.b2b.datasync.audit.AuditService;
import io.b2mash.b2b.datasync.integration.IntegrationRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Hands queued jobs to the worker pool once the inserting transaction has committed, so a worker
 * never looks for a row it cannot see yet.
 *
 * <p>A job the pool rejects is failed as {@code TRANSIENT} the same way a worker fails one: error
 * details on the job, the category on the integration and a {@code sync.failed} audit event. The
 * committed transaction is still bound at this point, so those writes run in a new one.
 */
@Component
public class SyncJobDispatcher {

  private static final Logger log = LoggerFactory.getLogger(SyncJobDispatcher.class);

  static final String POOL_SATURATED = "Sync worker pool is saturated; trigger the sync again";

  private final TaskExecutor syncTaskExecutor;
  private final SyncJobExecutor syncJobExecutor;
  private final SyncJobRepository syncJobRepository;
  private final IntegrationRepository integrationRepository;
  private final AuditService auditService;
  private final ObjectMapper objectMapper;
  private final TransactionTemplate requiresNew;
  private final Clock clock;

  public SyncJobDispatcher(
      @Qualifier("syncTaskExecutor") TaskExecutor syncTaskExecutor,
      SyncJobExecutor syncJobExecutor,
      SyncJobRepository syncJobRepository,
      IntegrationRepository integrationRepository,
      AuditService auditService,
      ObjectMapper objectMapper,
      PlatformTransactionManager transactionManager,
      Clock clock) {
    this.syncTaskExecutor = syncTaskExecutor;
    this.syncJobExecutor = syncJobExecutor;
    this.syncJobRepository = syncJobRepository;
    this.integrationRepository = integrationRepository;
    this.auditService = auditService;
    this.objectMapper = objectMapper;
    this.requiresNew = new TransactionTemplate(transactionManager);
    this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    this.clock = clock;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onSyncJobQueued(SyncJobQueuedEvent event) {
    try {
      syncTaskExecutor.execute(() -> syncJobExecutor.execute(event.jobId()));
      log.debug("Dispatched sync job {}", event.jobId());
    } catch (TaskRejectedException e) {
      log.error("Sync worker pool rejected job {}; marking it failed", event.jobId(), e);
      failRejected(event, e);
    }
  }

  private void failRejected(SyncJobQueuedEvent event, TaskRejectedException error) {
    var failure = SyncFailure.rejected(error, POOL_SATURATED);
    var details = failure.toDetails();
    details.put("cause", failure.message());
    String detailsJson = toJson(details);
    Instant now = clock.instant();

    Boolean failed =
        requiresNew.execute(
            status -> {
              int updated =
                  syncJobRepository.failPending(event.jobId(), failure.message(), detailsJson, now);
              if (updated == 0) {
                return false;
              }
              integrationRepository.markFailed(
                  event.integrationId(), failure.category(), failure.message(), now);
              return true;
            });
    if (!Boolean.TRUE.equals(failed)) {
      log.warn("Sync job {} left PENDING before its rejection was recorded", event.jobId());
      return;
    }
    auditService.log(
        AuditEventBuilder.builder()
            .tenantId(event.tenantId())
            .eventType("sync.failed")
            .resourceType("sync_job")
            .resourceId(event.jobId())
            .details(details)
            .build());
  }

  private String toJson(Map<String, Object> details) {
    try {
      return objectMapper.writeValueAsString(details);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Could not serialize sync error details", e);
    }
  }
}
