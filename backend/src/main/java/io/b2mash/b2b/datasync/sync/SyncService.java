package io.b2mash.b2b.datasync.sync;

import io.b2mash.b2b.datasync.audit.AuditEventBuilder;
import io.b2mash.b2b.datasync.audit.AuditService;
import io.b2mash.b2b.datasync.exception.InvalidStateException;
import io.b2mash.b2b.datasync.exception.ResourceNotFoundException;
import io.b2mash.b2b.datasync.integration.Integration;
import io.b2mash.b2b.datasync.integration.IntegrationRepository;
import io.b2mash.b2b.datasync.multitenancy.RequestScopes;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Queues, cancels and looks up sync jobs. Execution happens on the worker pool through {@link
 * SyncJobDispatcher} and {@link SyncJobExecutor}.
 */
@Service
public class SyncService {

  private static final Logger log = LoggerFactory.getLogger(SyncService.class);

  private final SyncJobRepository syncJobRepository;
  private final IntegrationRepository integrationRepository;
  private final SyncCancellationRegistry cancellationRegistry;
  private final AuditService auditService;
  private final ApplicationEventPublisher eventPublisher;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public SyncService(
      SyncJobRepository syncJobRepository,
      IntegrationRepository integrationRepository,
      SyncCancellationRegistry cancellationRegistry,
      AuditService auditService,
      ApplicationEventPublisher eventPublisher,
      TransactionTemplate transactionTemplate,
      Clock clock) {
    this.syncJobRepository = syncJobRepository;
    this.integrationRepository = integrationRepository;
    this.cancellationRegistry = cancellationRegistry;
    this.auditService = auditService;
    this.eventPublisher = eventPublisher;
    this.transactionTemplate = transactionTemplate;
    this.clock = clock;
  }

  /**
   * Queues a job for an integration of the current tenant.
   *
   * @throws SyncAlreadyInProgressException if the integration has a pending or running job
   * @throws InvalidStateException if the integration is disconnected or needs reconnection, or
   *     the requested range ends before it starts
   */
  public SyncJob triggerSync(UUID integrationId, SyncJobKind kind, SyncParams params) {
    if (params != null && !params.hasValidRange()) {
      throw new InvalidStateException(
          "Invalid date range",
          "since " + params.since() + " is after until " + params.until());
    }
    var integration = requireIntegration(integrationId);
    String triggeredBy = RequestScopes.getUserIdOrNull();
    return triggerFor(
        integration, kind, params, triggeredBy != null ? triggeredBy : "system", null);
  }

  SyncJob triggerFor(
      Integration integration,
      SyncJobKind kind,
      SyncParams params,
      String triggeredBy,
      String source) {
    if (!integration.isActive()) {
      throw new InvalidStateException(
          "Integration disconnected",
          "Integration " + integration.getId() + " is disconnected; connect it again to sync");
    }
    if (integration.requiresReconnect()) {
      throw new InvalidStateException(
          "Reconnection required",
          "Integration " + integration.getId() + " must be reconnected before it can sync");
    }
    if (syncJobRepository.existsByIntegrationIdAndStatusIn(
        integration.getId(), SyncJobStatus.ACTIVE)) {
      throw new SyncAlreadyInProgressException(integration.getId());
    }

    var effectiveParams = params != null ? params : SyncParams.empty();
    if (kind == SyncJobKind.INCREMENTAL && effectiveParams.since() == null) {
      effectiveParams = effectiveParams.withSince(integration.getLastSyncedAt());
    }
    var job =
        new SyncJob(
            integration.getTenantId(),
            integration.getId(),
            kind,
            effectiveParams,
            triggeredBy,
            clock.instant());

    SyncJob saved;
    try {
      saved =
          transactionTemplate.execute(
              status -> {
                var inserted = syncJobRepository.saveAndFlush(job);
                eventPublisher.publishEvent(
                    new SyncJobQueuedEvent(
                        inserted.getId(), inserted.getTenantId(), inserted.getIntegrationId()));
                return inserted;
              });
    } catch (DataIntegrityViolationException e) {
      // Lost the race against a concurrent trigger on the active-job index.
      throw new SyncAlreadyInProgressException(integration.getId());
    }

    log.info("Queued {} sync job {} for integration {}", kind, saved.getId(), integration.getId());
    var details = new LinkedHashMap<String, Object>();
    details.put("integration_id", integration.getId().toString());
    details.put("kind", kind.name());
    details.put("params", effectiveParams.toMap());
    auditService.log(
        AuditEventBuilder.builder()
            .tenantId(integration.getTenantId())
            .eventType("sync.triggered")
            .resourceType("sync_job")
            .resourceId(saved.getId())
            .source(source)
            .details(details)
            .build());
    return saved;
  }

  /**
   * Cancels a pending job immediately or flags a running one; the worker then stops at its next
   * checkpoint.
   *
   * @throws InvalidStateException if the job already finished
   */
  public SyncJob cancelSync(UUID integrationId, UUID jobId) {
    UUID tenantId = RequestScopes.requireTenantId();
    var job =
        syncJobRepository
            .findByIdAndIntegrationIdAndTenantId(jobId, integrationId, tenantId)
            .orElseThrow(() -> new ResourceNotFoundException("SyncJob", jobId));

    if (job.getStatus().isTerminal()) {
      throw new InvalidStateException(
          "Sync job not cancellable",
          "Sync job " + jobId + " is already " + job.getStatus().wireValue());
    }
    if (!requestCancellation(job)) {
      var current = reload(jobId);
      throw new InvalidStateException(
          "Sync job not cancellable",
          "Sync job " + jobId + " is already " + current.getStatus().wireValue());
    }
    return reload(jobId);
  }

  /** Cancels every pending or running job of an integration. Used when it is disconnected. */
  public int cancelActiveJobs(UUID integrationId) {
    int cancelled = 0;
    for (var job :
        syncJobRepository.findByIntegrationIdAndStatusIn(integrationId, SyncJobStatus.ACTIVE)) {
      if (requestCancellation(job)) {
        cancelled++;
      }
    }
    return cancelled;
  }

  public SyncJob getJob(UUID integrationId, UUID jobId) {
    return syncJobRepository
        .findByIdAndIntegrationIdAndTenantId(jobId, integrationId, RequestScopes.requireTenantId())
        .orElseThrow(() -> new ResourceNotFoundException("SyncJob", jobId));
  }

  public Page<SyncJob> listJobs(UUID integrationId, Pageable pageable) {
    var integration = requireIntegration(integrationId);
    return syncJobRepository.findByIntegrationIdAndTenantId(
        integration.getId(), integration.getTenantId(), pageable);
  }

  private boolean requestCancellation(SyncJob job) {
    if (syncJobRepository.cancelPending(job.getId(), clock.instant()) == 1) {
      log.info("Cancelled pending sync job {}", job.getId());
      auditCancel(job, "sync.cancelled");
      return true;
    }
    // The job may have been claimed since it was read.
    if (syncJobRepository.requestCancel(job.getId()) == 1) {
      boolean local = cancellationRegistry.cancel(job.getId());
      log.info(
          "Requested cancellation of running sync job {} (local worker: {})", job.getId(), local);
      auditCancel(job, "sync.cancel_requested");
      return true;
    }
    return false;
  }

  private void auditCancel(SyncJob job, String eventType) {
    var details = new LinkedHashMap<String, Object>();
    details.put("integration_id", job.getIntegrationId().toString());
    details.put("kind", job.getKind().name());
    auditService.log(
        AuditEventBuilder.builder()
            .tenantId(job.getTenantId())
            .eventType(eventType)
            .resourceType("sync_job")
            .resourceId(job.getId())
            .details(details)
            .build());
  }

  private SyncJob reload(UUID jobId) {
    return syncJobRepository
        .findById(jobId)
        .orElseThrow(() -> new ResourceNotFoundException("SyncJob", jobId));
  }

  private Integration requireIntegration(UUID integrationId) {
    return integrationRepository
        .findByIdAndTenantId(integrationId, RequestScopes.requireTenantId())
        .orElseThrow(() -> new ResourceNotFoundException("Integration", integrationId));
  }
}
