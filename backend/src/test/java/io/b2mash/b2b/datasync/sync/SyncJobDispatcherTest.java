package io.b2mash.b2b.datasync.sync;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.b2b.datasync.audit.AuditEventRecord;
import io.b2mash.b2b.datasync.audit.AuditService;
import io.b2mash.b2b.datasync.integration.ErrorCategory;
import io.b2mash.b2b.datasync.integration.IntegrationRepository;
import io.b2mash.b2b.datasync.testutil.MutableClock;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.transaction.PlatformTransactionManager;

@ExtendWith(MockitoExtension.class)
class SyncJobDispatcherTest {

  private static final Instant NOW = Instant.parse("2026-05-10T08:00:00Z");
  private static final UUID TENANT_ID = UUID.randomUUID();
  private static final UUID INTEGRATION_ID = UUID.randomUUID();
  private static final UUID JOB_ID = UUID.randomUUID();

  @Mock private SyncJobExecutor syncJobExecutor;
  @Mock private SyncJobRepository syncJobRepository;
  @Mock private IntegrationRepository integrationRepository;
  @Mock private AuditService auditService;

  private final CountDownLatch release = new CountDownLatch(1);
  private ThreadPoolTaskExecutor pool;
  private SyncJobDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    pool = new ThreadPoolTaskExecutor();
    pool.setCorePoolSize(1);
    pool.setMaxPoolSize(1);
    pool.setQueueCapacity(0);
    pool.setThreadNamePrefix("sync-test-");
    pool.initialize();
    dispatcher =
        new SyncJobDispatcher(
            pool,
            syncJobExecutor,
            syncJobRepository,
            integrationRepository,
            auditService,
            new ObjectMapper(),
            mock(PlatformTransactionManager.class),
            new MutableClock(NOW));
  }

  @AfterEach
  void tearDown() {
    release.countDown();
    pool.shutdown();
  }

  @Test
  void freePool_runsJobOnWorker() throws Exception {
    var ran = new CountDownLatch(1);
    doAnswer(
            invocation -> {
              ran.countDown();
              return null;
            })
        .when(syncJobExecutor)
        .execute(JOB_ID);

    dispatcher.onSyncJobQueued(new SyncJobQueuedEvent(JOB_ID, TENANT_ID, INTEGRATION_ID));

    assertThat(ran.await(5, TimeUnit.SECONDS)).isTrue();
    verifyNoInteractions(syncJobRepository, integrationRepository, auditService);
  }

  @Test
  void saturatedPool_failsJobAsTransientAndAudits() {
    occupyOnlyWorker();
    when(syncJobRepository.failPending(
            eq(JOB_ID), eq(SyncJobDispatcher.POOL_SATURATED), anyString(), eq(NOW)))
        .thenReturn(1);

    dispatcher.onSyncJobQueued(new SyncJobQueuedEvent(JOB_ID, TENANT_ID, INTEGRATION_ID));

    var detailsCaptor = ArgumentCaptor.forClass(String.class);
    verify(syncJobRepository)
        .failPending(
            eq(JOB_ID), eq(SyncJobDispatcher.POOL_SATURATED), detailsCaptor.capture(), eq(NOW));
    assertThat(detailsCaptor.getValue())
        .contains("\"category\":\"TRANSIENT\"")
        .contains("\"exception\":\"TaskRejectedException\"")
        .contains("\"attempts\":0");
    verify(integrationRepository)
        .markFailed(
            INTEGRATION_ID, ErrorCategory.TRANSIENT, SyncJobDispatcher.POOL_SATURATED, NOW);
    verify(syncJobExecutor, never()).execute(any());

    var captor = ArgumentCaptor.forClass(AuditEventRecord.class);
    verify(auditService).log(captor.capture());
    var event = captor.getValue();
    assertThat(event.eventType()).isEqualTo("sync.failed");
    assertThat(event.tenantId()).isEqualTo(TENANT_ID);
    assertThat(event.resourceId()).isEqualTo(JOB_ID);
    assertThat(event.details())
        .containsEntry("category", "TRANSIENT")
        .containsEntry("cause", SyncJobDispatcher.POOL_SATURATED);
  }

  @Test
  void saturatedPool_jobAlreadyLeftPending_changesNothingElse() {
    occupyOnlyWorker();
    when(syncJobRepository.failPending(eq(JOB_ID), anyString(), anyString(), eq(NOW)))
        .thenReturn(0);

    dispatcher.onSyncJobQueued(new SyncJobQueuedEvent(JOB_ID, TENANT_ID, INTEGRATION_ID));

    verifyNoInteractions(integrationRepository, auditService);
  }

  private void occupyOnlyWorker() {
    var started = new CountDownLatch(1);
    pool.execute(
        () -> {
          started.countDown();
          try {
            release.await(10, TimeUnit.SECONDS);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
        });
    try {
      assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
    } catch (InterruptedException e) {
      throw new IllegalStateException(e);
    }
  }
}
