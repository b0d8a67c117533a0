package io.b2mash.b2b.datasync.sync;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.b2b.datasync.TestcontainersConfiguration;
import io.b2mash.b2b.datasync.integration.Integration;
import io.b2mash.b2b.datasync.integration.IntegrationRepository;
import io.b2mash.b2b.datasync.integration.SyncStatus;
import io.b2mash.b2b.datasync.integration.credential.CredentialStore;
import io.b2mash.b2b.datasync.integration.provider.ProviderRecord;
import io.b2mash.b2b.datasync.multitenancy.RequestScopes;
import io.b2mash.b2b.datasync.sync.record.SyncedRecordRepository;
import io.b2mash.b2b.datasync.tenant.TenantService;
import io.b2mash.b2b.datasync.testutil.FakeProviderClient;
import io.b2mash.b2b.datasync.testutil.FakeProviderConfiguration;
import io.b2mash.b2b.datasync.testutil.Polling;
import io.b2mash.b2b.datasync.testutil.TestFixtures;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@Import({TestcontainersConfiguration.class, FakeProviderConfiguration.class})
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class SyncEngineIntegrationTest {

  private static final Duration WAIT = Duration.ofSeconds(15);

  @Autowired private SyncService syncService;
  @Autowired private SyncJobRepository syncJobRepository;
  @Autowired private SyncedRecordRepository syncedRecordRepository;
  @Autowired private IntegrationRepository integrationRepository;
  @Autowired private TenantService tenantService;
  @Autowired private CredentialStore credentialStore;
  @Autowired private FakeProviderClient provider;

  @BeforeEach
  void resetProvider() {
    provider.reset();
  }

  @AfterEach
  void releaseHeldFetches() {
    provider.releaseFetches();
  }

  @Test
  void concurrentTriggers_createExactlyOneActiveJob() throws Exception {
    var integration = newIntegration("sync-race");
    provider.holdFetches();
    int callers = 10;
    var start = new CountDownLatch(1);
    var pool = Executors.newFixedThreadPool(callers);
    try {
      var futures = new ArrayList<Future<Boolean>>();
      for (int i = 0; i < callers; i++) {
        futures.add(
            pool.submit(
                () -> {
                  start.await();
                  try {
                    syncService.triggerFor(
                        integration, SyncJobKind.MANUAL, SyncParams.empty(), "test", null);
                    return true;
                  } catch (SyncAlreadyInProgressException e) {
                    return false;
                  }
                }));
      }
      start.countDown();

      int queued = 0;
      for (var future : futures) {
        if (future.get(30, TimeUnit.SECONDS)) {
          queued++;
        }
      }

      assertThat(queued).isEqualTo(1);
      assertThat(
              syncJobRepository
                  .findByIntegrationIdAndTenantId(
                      integration.getId(), integration.getTenantId(), PageRequest.of(0, 20))
                  .getTotalElements())
          .isEqualTo(1);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void triggeredJob_runsToCompletionAndStoresRecords() {
    var integration = newIntegration("sync-complete");
    provider.servePages(
        List.of(
            List.of(order("1001"), order("1002")),
            List.of(order("1003"), new ProviderRecord("order", "", Map.of()))));

    var job =
        syncService.triggerFor(integration, SyncJobKind.FULL, SyncParams.empty(), "test", null);

    assertThat(Polling.await(WAIT, () -> status(job) == SyncJobStatus.COMPLETED)).isTrue();
    var finished = syncJobRepository.findById(job.getId()).orElseThrow();
    assertThat(finished.getRecordsFetched()).isEqualTo(4);
    assertThat(finished.getRecordsProcessed()).isEqualTo(3);
    assertThat(finished.getRecordsFailed()).isEqualTo(1);
    assertThat(finished.getAttempts()).isEqualTo(1);
    assertThat(syncedRecordRepository.countByIntegrationId(integration.getId())).isEqualTo(3);

    var refreshed = integrationRepository.findById(integration.getId()).orElseThrow();
    assertThat(refreshed.getSyncStatus()).isEqualTo(SyncStatus.IDLE);
    assertThat(refreshed.getLastSyncedAt()).isEqualTo(finished.getStartedAt());
  }

  @Test
  void resync_upsertsRecordsInsteadOfDuplicating() {
    var integration = newIntegration("sync-upsert");
    provider.servePages(List.of(List.of(order("2001"), order("2002"))));

    var first =
        syncService.triggerFor(integration, SyncJobKind.FULL, SyncParams.empty(), "test", null);
    assertThat(Polling.await(WAIT, () -> status(first) == SyncJobStatus.COMPLETED)).isTrue();
    var second =
        syncService.triggerFor(
            integrationRepository.findById(integration.getId()).orElseThrow(),
            SyncJobKind.INCREMENTAL,
            null,
            "test",
            null);
    assertThat(Polling.await(WAIT, () -> status(second) == SyncJobStatus.COMPLETED)).isTrue();

    assertThat(syncedRecordRepository.countByIntegrationId(integration.getId())).isEqualTo(2);
    var record =
        syncedRecordRepository
            .findByIntegrationIdAndRecordTypeAndExternalId(integration.getId(), "order", "2001")
            .orElseThrow();
    assertThat(record.getLastJobId()).isEqualTo(second.getId());
    assertThat(second.syncParams().since()).isNotNull();
  }

  @Test
  void cancellingRunningJob_stopsItAtNextCheckpoint() throws Exception {
    var integration = newIntegration("sync-cancel");
    provider.servePages(List.of(List.of(order("3001")), List.of(order("3002"))));
    provider.holdFetches();

    var job =
        syncService.triggerFor(integration, SyncJobKind.FULL, SyncParams.empty(), "test", null);
    assertThat(provider.awaitFirstFetch(15)).isTrue();
    assertThat(status(job)).isEqualTo(SyncJobStatus.RUNNING);

    RequestScopes.runAs(
        integration.getTenantId(), () -> syncService.cancelSync(integration.getId(), job.getId()));
    provider.releaseFetches();

    assertThat(Polling.await(WAIT, () -> status(job) == SyncJobStatus.CANCELLED)).isTrue();
    var cancelled = syncJobRepository.findById(job.getId()).orElseThrow();
    assertThat(cancelled.getRecordsProcessed()).isEqualTo(1);
    assertThat(cancelled.isCancelRequested()).isTrue();
    assertThat(provider.fetchCount()).isEqualTo(1);
  }

  @Test
  void cancelActiveJobs_stopsJobWhetherPendingOrRunning() {
    var integration = newIntegration("sync-disconnect");
    provider.servePages(List.of(List.of(order("4001")), List.of(order("4002"))));
    provider.holdFetches();
    var job =
        syncService.triggerFor(integration, SyncJobKind.FULL, SyncParams.empty(), "test", null);

    RequestScopes.runAs(
        integration.getTenantId(),
        () -> assertThat(syncService.cancelActiveJobs(integration.getId())).isEqualTo(1));
    provider.releaseFetches();

    assertThat(Polling.await(WAIT, () -> status(job).isTerminal())).isTrue();
    assertThat(status(job)).isEqualTo(SyncJobStatus.CANCELLED);
    assertThat(provider.fetchCount()).isLessThanOrEqualTo(1);
  }

  private SyncJobStatus status(SyncJob job) {
    return syncJobRepository.findById(job.getId()).orElseThrow().getStatus();
  }

  private Integration newIntegration(String prefix) {
    var tenant = TestFixtures.tenant(tenantService, prefix);
    return TestFixtures.ecommerceIntegration(credentialStore, tenant.getId(), prefix + "-shop");
  }

  private static ProviderRecord order(String id) {
    return new ProviderRecord("order", id, Map.of("id", id, "total", "10.00"));
  }
}
