package io.b2mash.b2b.datasync.sync;

import io.b2mash.b2b.datasync.integration.IntegrationRepository;
import io.b2mash.b2b.datasync.multitenancy.RequestScopes;
import io.b2mash.b2b.datasync.tenant.TenantRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Queues an incremental sync for every healthy integration of an active tenant. */
@Component
public class ScheduledSyncJob {

  private static final Logger log = LoggerFactory.getLogger(ScheduledSyncJob.class);

  static final String TRIGGERED_BY = "scheduler";

  private final IntegrationRepository integrationRepository;
  private final TenantRepository tenantRepository;
  private final SyncService syncService;

  public ScheduledSyncJob(
      IntegrationRepository integrationRepository,
      TenantRepository tenantRepository,
      SyncService syncService) {
    this.integrationRepository = integrationRepository;
    this.tenantRepository = tenantRepository;
    this.syncService = syncService;
  }

  @Scheduled(cron = "${datasync.sync.schedule.incremental-cron:0 0 * * * *}")
  public void triggerIncrementalSyncs() {
    int queued = 0;
    int skipped = 0;
    for (var integration : integrationRepository.findSyncable()) {
      if (!Boolean.TRUE.equals(tenantRepository.findActiveById(integration.getTenantId()))) {
        continue;
      }
      MDC.put("integrationId", integration.getId().toString());
      try {
        RequestScopes.runAs(
            integration.getTenantId(),
            () ->
                syncService.triggerFor(
                    integration,
                    SyncJobKind.INCREMENTAL,
                    SyncParams.empty(),
                    TRIGGERED_BY,
                    "SCHEDULED"));
        queued++;
      } catch (SyncAlreadyInProgressException e) {
        skipped++;
      } catch (RuntimeException e) {
        log.warn(
            "Could not queue scheduled sync for integration {}: {}",
            integration.getId(),
            e.getMessage());
      } finally {
        MDC.remove("integrationId");
      }
    }
    if (queued > 0 || skipped > 0) {
      log.info("Scheduled sync: {} queued, {} already in progress", queued, skipped);
    }
  }
}
