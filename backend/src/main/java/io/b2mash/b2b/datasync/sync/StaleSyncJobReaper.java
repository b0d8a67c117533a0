package io.b2mash.b2b.datasync.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.b2b.datasync.audit.AuditEventBuilder;
import io.b2mash.b2b.datasync.audit.AuditService;
import io.b2mash.b2b.datasync.config.SyncProperties;
import io.b2mash.b2b.datasync.integration.ErrorCategory;
import io.b2mash.b2b.datasync.integration.IntegrationRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Fails jobs left RUNNING by an instance that died mid-sync. Without this the active-job index
 * would block the integration forever.
 */
@Component
public class StaleSyncJobReaper {

  private static final Logger log = LoggerFactory.getLogger(StaleSyncJobReaper.class);

  static final String REAPED_MESSAGE = "Sync job stopped reporting and was abandoned";

  private final SyncJobRepository syncJobRepository;
  private final IntegrationRepository integrationRepository;
  private final AuditService auditService;
  private final SyncProperties syncProperties;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public StaleSyncJobReaper(
      SyncJobRepository syncJobRepository,
      IntegrationRepository integrationRepository,
      AuditService auditService,
      SyncProperties syncProperties,
      ObjectMapper objectMapper,
      Clock clock) {
    this.syncJobRepository = syncJobRepository;
    this.integrationRepository = integrationRepository;
    this.auditService = auditService;
    this.syncProperties = syncProperties;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @Scheduled(cron = "${datasync.sync.schedule.reaper-cron:0 */5 * * * *}")
  public void scheduledReap() {
    reapStaleJobs();
  }

  /** @return the number of jobs moved to FAILED */
  public int reapStaleJobs() {
    Instant now = clock.instant();
    Instant cutoff = now.minus(syncProperties.jobTimeout()).minus(syncProperties.staleJobGrace());
    int reaped = 0;
    for (var job : syncJobRepository.findStaleRunning(cutoff)) {
      var details = new LinkedHashMap<String, Object>();
      details.put("category", ErrorCategory.TIMEOUT.name());
      details.put("cause", REAPED_MESSAGE);
      details.put("exception", "StaleJob");
      details.put("attempts", job.getAttempts());
      if (syncJobRepository.fail(job.getId(), REAPED_MESSAGE, toJson(details), now) == 0) {
        continue;
      }
      integrationRepository.markFailed(
          job.getIntegrationId(), ErrorCategory.TIMEOUT, REAPED_MESSAGE, now);
      details.put("integration_id", job.getIntegrationId().toString());
      details.put("started_at", job.getStartedAt().toString());
      auditService.log(
          AuditEventBuilder.builder()
              .tenantId(job.getTenantId())
              .eventType("sync.failed")
              .resourceType("sync_job")
              .resourceId(job.getId())
              .source("SCHEDULED")
              .details(details)
              .build());
      reaped++;
    }
    if (reaped > 0) {
      log.warn("Reaped {} sync jobs that were running past {}", reaped, cutoff);
    }
    return reaped;
  }

  private String toJson(LinkedHashMap<String, Object> details) {
    try {
      return objectMapper.writeValueAsString(details);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Could not serialize sync error details", e);
    }
  }
}
