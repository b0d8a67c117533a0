package io.b2mash.b2b.datasync.sync;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.b2b.datasync.audit.AuditEventRecord;
import io.b2mash.b2b.datasync.audit.AuditService;
import io.b2mash.b2b.datasync.config.SyncProperties;
import io.b2mash.b2b.datasync.integration.ErrorCategory;
import io.b2mash.b2b.datasync.integration.Integration;
import io.b2mash.b2b.datasync.integration.IntegrationRepository;
import io.b2mash.b2b.datasync.integration.ProviderType;
import io.b2mash.b2b.datasync.integration.credential.CredentialStore;
import io.b2mash.b2b.datasync.integration.credential.TokenPair;
import io.b2mash.b2b.datasync.integration.provider.FetchRequest;
import io.b2mash.b2b.datasync.integration.provider.FetchedPage;
import io.b2mash.b2b.datasync.integration.provider.ProviderClient;
import io.b2mash.b2b.datasync.integration.provider.ProviderPermanentException;
import io.b2mash.b2b.datasync.integration.provider.ProviderRecord;
import io.b2mash.b2b.datasync.integration.provider.ProviderRegistry;
import io.b2mash.b2b.datasync.integration.provider.ProviderTransientException;
import io.b2mash.b2b.datasync.integration.provider.ProviderUnauthorizedException;
import io.b2mash.b2b.datasync.integration.provider.ProviderUnavailableException;
import io.b2mash.b2b.datasync.integration.token.RefreshFailedException;
import io.b2mash.b2b.datasync.integration.token.TokenRefresher;
import io.b2mash.b2b.datasync.ratelimit.RateGovernor;
import io.b2mash.b2b.datasync.sync.record.SyncRecordSink;
import io.b2mash.b2b.datasync.sync.record.SyncRecordSink.PageWriteResult;
import io.b2mash.b2b.datasync.testutil.MutableClock;
import io.b2mash.b2b.datasync.testutil.TestIntegrations;
import io.b2mash.b2b.datasync.testutil.TestSyncProperties;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class SyncJobExecutorTest {

  private static final Instant START = Instant.parse("2026-05-10T08:00:00Z");
  private static final UUID TENANT_ID = UUID.randomUUID();
  private static final UUID INTEGRATION_ID = UUID.randomUUID();
  private static final UUID JOB_ID = UUID.randomUUID();

  @Mock private SyncJobRepository syncJobRepository;
  @Mock private IntegrationRepository integrationRepository;
  @Mock private ProviderRegistry providerRegistry;
  @Mock private CredentialStore credentialStore;
  @Mock private TokenRefresher tokenRefresher;
  @Mock private RateGovernor rateGovernor;
  @Mock private SyncRecordSink recordSink;
  @Mock private AuditService auditService;
  @Mock private ProviderClient client;

  private final SyncCancellationRegistry cancellationRegistry = new SyncCancellationRegistry();
  private final List<Duration> sleeps = new ArrayList<>();
  private final MutableClock clock = new MutableClock(START);

  private JobSleeper sleeper = (duration, handle) -> sleeps.add(duration);
  private SyncJob job;
  private Integration integration;

  @BeforeEach
  void setUp() {
    job =
        new SyncJob(
            TENANT_ID, INTEGRATION_ID, SyncJobKind.MANUAL, SyncParams.empty(), "user-1", START);
    ReflectionTestUtils.setField(job, "id", JOB_ID);
    integration =
        TestIntegrations.connected(
            INTEGRATION_ID,
            TENANT_ID,
            ProviderType.ECOMMERCE,
            "enc-a",
            "enc-r",
            START.plus(Duration.ofHours(1)));

    lenient().when(syncJobRepository.findById(JOB_ID)).thenReturn(Optional.of(job));
    lenient().when(syncJobRepository.claim(eq(JOB_ID), any())).thenReturn(1);
    lenient().when(syncJobRepository.isCancelRequested(JOB_ID)).thenReturn(false);
    lenient().when(syncJobRepository.complete(eq(JOB_ID), any())).thenReturn(1);
    lenient().when(syncJobRepository.fail(eq(JOB_ID), anyString(), anyString(), any()))
        .thenReturn(1);
    lenient().when(syncJobRepository.finishCancelled(eq(JOB_ID), any())).thenReturn(1);
    lenient()
        .when(integrationRepository.findById(INTEGRATION_ID))
        .thenReturn(Optional.of(integration));
    lenient().when(tokenRefresher.ensureFreshToken(integration)).thenReturn(integration);
    lenient()
        .when(credentialStore.readTokens(integration))
        .thenReturn(new TokenPair("access-1", "refresh-1"));
    lenient().when(providerRegistry.resolve(ProviderType.ECOMMERCE)).thenReturn(client);
    lenient().when(rateGovernor.tryAcquire(any(Integration.class))).thenReturn(true);
  }

  @Test
  void execute_pagesThroughAllRecords_andCompletes() {
    when(client.fetchPage(eq("access-1"), any(FetchRequest.class), isNull()))
        .thenReturn(new FetchedPage(List.of(order("1"), order("2")), "page-2"));
    when(client.fetchPage(eq("access-1"), any(FetchRequest.class), eq("page-2")))
        .thenReturn(new FetchedPage(List.of(order("3")), null));
    when(recordSink.write(eq(job), any()))
        .thenReturn(new PageWriteResult(2, 0), new PageWriteResult(0, 1));

    executor().execute(JOB_ID);

    verify(syncJobRepository).recordProgress(JOB_ID, 2, 2, 0);
    verify(syncJobRepository).recordProgress(JOB_ID, 3, 2, 1);
    verify(syncJobRepository).complete(JOB_ID, START);
    verify(integrationRepository).markSyncing(INTEGRATION_ID, START);
    verify(integrationRepository).markSyncSucceeded(INTEGRATION_ID, START);
    var event = lastAudit();
    assertThat(event.eventType()).isEqualTo("sync.completed");
    assertThat(event.details())
        .containsEntry("records_fetched", 3)
        .containsEntry("records_processed", 2)
        .containsEntry("records_failed", 1);
  }

  @Test
  void execute_passesJobParametersToProvider() {
    ReflectionTestUtils.setField(
        job,
        "params",
        new HashMap<>(
            new SyncParams(START.minus(Duration.ofDays(1)), null, Map.of("status", "paid"))
                .toMap()));
    var captor = ArgumentCaptor.forClass(FetchRequest.class);
    when(client.fetchPage(eq("access-1"), captor.capture(), isNull()))
        .thenReturn(new FetchedPage(List.of(), null));

    executor().execute(JOB_ID);

    assertThat(captor.getValue().since()).isEqualTo(START.minus(Duration.ofDays(1)));
    assertThat(captor.getValue().filters()).containsEntry("status", "paid");
    assertThat(captor.getValue().pageSize()).isEqualTo(100);
    verifyNoInteractions(recordSink);
  }

  @Test
  void execute_transientFailures_backOffWithGrowingDelaysThenFail() {
    when(client.fetchPage(any(), any(), any()))
        .thenThrow(new ProviderTransientException("503 Service Unavailable", 503));

    executor().execute(JOB_ID);

    verify(client, times(3)).fetchPage(any(), any(), any());
    assertThat(sleeps).hasSize(2);
    assertThat(sleeps.get(1)).isGreaterThan(sleeps.get(0));
    assertThat(sleeps.get(0)).isGreaterThanOrEqualTo(Duration.ofSeconds(1));

    var detailsCaptor = ArgumentCaptor.forClass(String.class);
    verify(syncJobRepository)
        .fail(eq(JOB_ID), eq("503 Service Unavailable"), detailsCaptor.capture(), any());
    assertThat(detailsCaptor.getValue())
        .contains("\"category\":\"TRANSIENT\"")
        .contains("\"attempts\":3")
        .contains("\"http_status\":503");
    verify(integrationRepository)
        .markFailed(
            eq(INTEGRATION_ID),
            eq(ErrorCategory.TRANSIENT),
            eq("503 Service Unavailable"),
            any());
    assertThat(lastAudit().eventType()).isEqualTo("sync.failed");
  }

  @Test
  void execute_transientFailureThenSuccess_completes() {
    when(client.fetchPage(any(), any(), any()))
        .thenThrow(new ProviderTransientException("timeout", null))
        .thenReturn(new FetchedPage(List.of(order("1")), null));
    when(recordSink.write(eq(job), any())).thenReturn(new PageWriteResult(1, 0));

    executor().execute(JOB_ID);

    assertThat(sleeps).hasSize(1);
    verify(syncJobRepository).complete(eq(JOB_ID), any());
    verify(syncJobRepository, never()).fail(any(), any(), any(), any());
  }

  @Test
  void execute_singleAttemptConfigured_failsWithoutBackoff() {
    when(client.fetchPage(any(), any(), any()))
        .thenThrow(new ProviderTransientException("429 Too Many Requests", 429));

    executor(TestSyncProperties.withRetry(1, Duration.ofSeconds(1), Duration.ofSeconds(5)))
        .execute(JOB_ID);

    assertThat(sleeps).isEmpty();
    verify(integrationRepository)
        .markFailed(eq(INTEGRATION_ID), eq(ErrorCategory.TRANSIENT), anyString(), any());
  }

  @Test
  void execute_permanentError_failsWithoutRetry() {
    when(client.fetchPage(any(), any(), any()))
        .thenThrow(new ProviderPermanentException("400 Bad Request: unknown filter", 400));

    executor().execute(JOB_ID);

    verify(client, times(1)).fetchPage(any(), any(), any());
    assertThat(sleeps).isEmpty();
    verify(integrationRepository)
        .markFailed(eq(INTEGRATION_ID), eq(ErrorCategory.PERMANENT), anyString(), any());
  }

  @Test
  void execute_providerCircuitOpen_failsTransientWithoutRetry() {
    when(client.fetchPage(any(), any(), any()))
        .thenThrow(
            new ProviderUnavailableException(ProviderType.ECOMMERCE, Duration.ofSeconds(60)));

    executor().execute(JOB_ID);

    verify(client, times(1)).fetchPage(any(), any(), any());
    assertThat(sleeps).isEmpty();
    var detailsCaptor = ArgumentCaptor.forClass(String.class);
    verify(syncJobRepository).fail(eq(JOB_ID), anyString(), detailsCaptor.capture(), any());
    assertThat(detailsCaptor.getValue())
        .contains("\"category\":\"TRANSIENT\"")
        .contains("\"retry_after_seconds\":60");
    verify(integrationRepository)
        .markFailed(eq(INTEGRATION_ID), eq(ErrorCategory.TRANSIENT), anyString(), any());
  }

  @Test
  void execute_cancelledDuringBackoff_endsCancelled() {
    sleeper =
        (duration, handle) -> {
          sleeps.add(duration);
          handle.cancel();
        };
    when(client.fetchPage(any(), any(), any()))
        .thenThrow(new ProviderTransientException("503 Service Unavailable", 503));

    executor().execute(JOB_ID);

    verify(client, times(1)).fetchPage(any(), any(), any());
    verify(syncJobRepository).finishCancelled(eq(JOB_ID), any());
    verify(syncJobRepository, never()).fail(any(), any(), any(), any());
    verify(integrationRepository).markSyncStopped(eq(INTEGRATION_ID), any());
    assertThat(lastAudit().eventType()).isEqualTo("sync.cancelled");
  }

  @Test
  void execute_cancelledWhileWritingPage_finishesPageThenStops() {
    when(client.fetchPage(any(), any(), isNull()))
        .thenReturn(new FetchedPage(List.of(order("1"), order("2")), "page-2"));
    when(recordSink.write(eq(job), any()))
        .thenAnswer(
            invocation -> {
              cancellationRegistry.cancel(JOB_ID);
              return new PageWriteResult(2, 0);
            });

    executor().execute(JOB_ID);

    verify(syncJobRepository).recordProgress(JOB_ID, 2, 2, 0);
    verify(client, never()).fetchPage(any(), any(), eq("page-2"));
    verify(syncJobRepository).finishCancelled(eq(JOB_ID), any());
    assertThat(lastAudit().details()).containsEntry("records_processed", 2);
  }

  @Test
  void execute_cancelRequestedFromAnotherInstance_stopsAtCheckpoint() {
    when(syncJobRepository.isCancelRequested(JOB_ID)).thenReturn(true);

    executor().execute(JOB_ID);

    verifyNoInteractions(client);
    verify(syncJobRepository).finishCancelled(eq(JOB_ID), any());
  }

  @Test
  void execute_unauthorized_refreshesOnceAndRetries() {
    var refreshed = TestIntegrations.withTokenVersion(integration(), 2L);
    when(tokenRefresher.forceRefresh(integration)).thenReturn(refreshed);
    when(credentialStore.readTokens(refreshed)).thenReturn(new TokenPair("access-2", "r"));
    when(client.fetchPage(eq("access-1"), any(), any()))
        .thenThrow(new ProviderUnauthorizedException("401 Unauthorized"));
    when(client.fetchPage(eq("access-2"), any(), any()))
        .thenReturn(new FetchedPage(List.of(), null));

    executor().execute(JOB_ID);

    verify(tokenRefresher, times(1)).forceRefresh(any());
    verify(syncJobRepository).complete(eq(JOB_ID), any());
  }

  @Test
  void execute_unauthorizedAfterRefresh_requiresReconnect() {
    var refreshed = TestIntegrations.withTokenVersion(integration(), 2L);
    when(tokenRefresher.forceRefresh(integration)).thenReturn(refreshed);
    when(credentialStore.readTokens(refreshed)).thenReturn(new TokenPair("access-2", "r"));
    when(client.fetchPage(any(), any(), any()))
        .thenThrow(new ProviderUnauthorizedException("401 Unauthorized"));

    executor().execute(JOB_ID);

    verify(client, times(2)).fetchPage(any(), any(), any());
    verify(integrationRepository)
        .markFailed(
            eq(INTEGRATION_ID), eq(ErrorCategory.RECONNECT_REQUIRED), anyString(), any());
  }

  @Test
  void execute_refreshFailsBeforeFirstPage_requiresReconnect() {
    when(tokenRefresher.ensureFreshToken(integration))
        .thenThrow(new RefreshFailedException(INTEGRATION_ID, "no refresh token stored", null));

    executor().execute(JOB_ID);

    verifyNoInteractions(client);
    var detailsCaptor = ArgumentCaptor.forClass(String.class);
    verify(syncJobRepository).fail(eq(JOB_ID), anyString(), detailsCaptor.capture(), any());
    assertThat(detailsCaptor.getValue()).contains("\"category\":\"RECONNECT_REQUIRED\"");
  }

  @Test
  void execute_rateLimitWindowBeyondDeadline_failsWithTimeout() {
    when(rateGovernor.tryAcquire(integration)).thenReturn(false);
    when(rateGovernor.waitTime(integration)).thenReturn(Duration.ofMinutes(45));

    executor().execute(JOB_ID);

    verifyNoInteractions(client);
    assertThat(sleeps).isEmpty();
    verify(integrationRepository)
        .markFailed(eq(INTEGRATION_ID), eq(ErrorCategory.TIMEOUT), anyString(), any());
  }

  @Test
  void execute_rateLimited_waitsForNextWindow() {
    when(rateGovernor.tryAcquire(integration)).thenReturn(false, true);
    when(rateGovernor.waitTime(integration)).thenReturn(Duration.ofSeconds(20));
    when(client.fetchPage(any(), any(), any())).thenReturn(new FetchedPage(List.of(), null));

    executor().execute(JOB_ID);

    assertThat(sleeps).containsExactly(Duration.ofSeconds(20));
    verify(syncJobRepository).complete(eq(JOB_ID), any());
  }

  @Test
  void execute_deadlinePassesDuringBackoff_failsWithTimeout() {
    sleeper =
        (duration, handle) -> {
          sleeps.add(duration);
          clock.advance(Duration.ofMinutes(11));
        };
    when(client.fetchPage(any(), any(), any()))
        .thenThrow(new ProviderTransientException("503 Service Unavailable", 503));

    executor().execute(JOB_ID);

    verify(client, times(1)).fetchPage(any(), any(), any());
    verify(integrationRepository)
        .markFailed(eq(INTEGRATION_ID), eq(ErrorCategory.TIMEOUT), anyString(), any());
  }

  @Test
  void execute_jobNoLongerPending_isSkipped() {
    when(syncJobRepository.claim(eq(JOB_ID), any())).thenReturn(0);

    executor().execute(JOB_ID);

    verifyNoInteractions(client, integrationRepository, auditService);
  }

  @Test
  void execute_integrationDisconnected_cancelsJob() {
    ReflectionTestUtils.setField(integration, "active", false);

    executor().execute(JOB_ID);

    verifyNoInteractions(client, tokenRefresher);
    verify(syncJobRepository).finishCancelled(eq(JOB_ID), any());
    assertThat(lastAudit().details()).containsEntry("reason", "integration_disconnected");
  }

  @Test
  void execute_sinkFailure_failsJobAndKeepsEarlierProgress() {
    when(client.fetchPage(any(), any(), isNull()))
        .thenReturn(new FetchedPage(List.of(order("1")), "page-2"));
    when(client.fetchPage(any(), any(), eq("page-2")))
        .thenReturn(new FetchedPage(List.of(order("2")), null));
    when(recordSink.write(eq(job), any()))
        .thenReturn(new PageWriteResult(1, 0))
        .thenThrow(new IllegalStateException("storage unavailable"));

    executor().execute(JOB_ID);

    verify(syncJobRepository).recordProgress(JOB_ID, 1, 1, 0);
    verify(syncJobRepository, never()).recordProgress(eq(JOB_ID), eq(2), anyInt(), anyInt());
    verify(syncJobRepository).fail(eq(JOB_ID), eq("storage unavailable"), anyString(), any());
  }

  @Test
  void execute_unregistersCancellationHandle() {
    when(client.fetchPage(any(), any(), any())).thenReturn(new FetchedPage(List.of(), null));

    executor().execute(JOB_ID);

    assertThat(cancellationRegistry.cancel(JOB_ID)).isFalse();
  }

  private SyncJobExecutor executor() {
    return executor(TestSyncProperties.defaults());
  }

  private SyncJobExecutor executor(SyncProperties properties) {
    return new SyncJobExecutor(
        syncJobRepository,
        integrationRepository,
        providerRegistry,
        credentialStore,
        tokenRefresher,
        rateGovernor,
        recordSink,
        auditService,
        cancellationRegistry,
        properties,
        (duration, handle) -> sleeper.sleep(duration, handle),
        clock,
        new ObjectMapper());
  }

  private Integration integration() {
    return TestIntegrations.connected(
        INTEGRATION_ID,
        TENANT_ID,
        ProviderType.ECOMMERCE,
        "enc-a2",
        "enc-r2",
        START.plus(Duration.ofHours(1)));
  }

  private AuditEventRecord lastAudit() {
    var captor = ArgumentCaptor.forClass(AuditEventRecord.class);
    verify(auditService, atLeastOnce()).log(captor.capture());
    return captor.getValue();
  }

  private static ProviderRecord order(String id) {
    return new ProviderRecord("order", id, Map.of("id", id));
  }
}
