package io.b2mash.b2b.datasync.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.b2b.datasync.audit.AuditEventBuilder;
import io.b2mash.b2b.datasync.audit.AuditService;
import io.b2mash.b2b.datasync.config.SyncProperties;
import io.b2mash.b2b.datasync.integration.Integration;
import io.b2mash.b2b.datasync.integration.IntegrationRepository;
import io.b2mash.b2b.datasync.integration.credential.CredentialStore;
import io.b2mash.b2b.datasync.integration.provider.FetchRequest;
import io.b2mash.b2b.datasync.integration.provider.FetchedPage;
import io.b2mash.b2b.datasync.integration.provider.ProviderClient;
import io.b2mash.b2b.datasync.integration.provider.ProviderRegistry;
import io.b2mash.b2b.datasync.integration.provider.ProviderTransientException;
import io.b2mash.b2b.datasync.integration.provider.ProviderUnauthorizedException;
import io.b2mash.b2b.datasync.integration.token.TokenRefresher;
import io.b2mash.b2b.datasync.multitenancy.RequestScopes;
import io.b2mash.b2b.datasync.ratelimit.RateGovernor;
import io.b2mash.b2b.datasync.ratelimit.RateLimitExceededException;
import io.b2mash.b2b.datasync.sync.SyncCancellationRegistry.CancellationHandle;
import io.b2mash.b2b.datasync.sync.record.SyncRecordSink;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.ExponentialRandomBackOffPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

/**
 * Runs one sync job on a worker thread: claims it, pulls pages from the provider under the rate
 * governor, writes them to the {@link SyncRecordSink} and records the outcome.
 *
 * <p>Cancellation and the job deadline are checked before every provider call and between pages.
 * Waits (retry backoff, rate-limit windows) go through the {@link JobSleeper} and end early when
 * the job is cancelled. A page that has started writing is always finished.
 */
@Service
public class SyncJobExecutor {

  private static final Logger log = LoggerFactory.getLogger(SyncJobExecutor.class);

  private static final Duration MIN_RATE_LIMIT_WAIT = Duration.ofMillis(100);

  private final SyncJobRepository syncJobRepository;
  private final IntegrationRepository integrationRepository;
  private final ProviderRegistry providerRegistry;
  private final CredentialStore credentialStore;
  private final TokenRefresher tokenRefresher;
  private final RateGovernor rateGovernor;
  private final SyncRecordSink recordSink;
  private final AuditService auditService;
  private final SyncCancellationRegistry cancellationRegistry;
  private final SyncProperties syncProperties;
  private final JobSleeper jobSleeper;
  private final Clock clock;
  private final ObjectMapper objectMapper;

  @Autowired
  public SyncJobExecutor(
      SyncJobRepository syncJobRepository,
      IntegrationRepository integrationRepository,
      ProviderRegistry providerRegistry,
      CredentialStore credentialStore,
      TokenRefresher tokenRefresher,
      RateGovernor rateGovernor,
      SyncRecordSink recordSink,
      AuditService auditService,
      SyncCancellationRegistry cancellationRegistry,
      SyncProperties syncProperties,
      Clock clock,
      ObjectMapper objectMapper) {
    this(
        syncJobRepository,
        integrationRepository,
        providerRegistry,
        credentialStore,
        tokenRefresher,
        rateGovernor,
        recordSink,
        auditService,
        cancellationRegistry,
        syncProperties,
        JobSleeper.latchBacked(),
        clock,
        objectMapper);
  }

  SyncJobExecutor(
      SyncJobRepository syncJobRepository,
      IntegrationRepository integrationRepository,
      ProviderRegistry providerRegistry,
      CredentialStore credentialStore,
      TokenRefresher tokenRefresher,
      RateGovernor rateGovernor,
      SyncRecordSink recordSink,
      AuditService auditService,
      SyncCancellationRegistry cancellationRegistry,
      SyncProperties syncProperties,
      JobSleeper jobSleeper,
      Clock clock,
      ObjectMapper objectMapper) {
    this.syncJobRepository = syncJobRepository;
    this.integrationRepository = integrationRepository;
    this.providerRegistry = providerRegistry;
    this.credentialStore = credentialStore;
    this.tokenRefresher = tokenRefresher;
    this.rateGovernor = rateGovernor;
    this.recordSink = recordSink;
    this.auditService = auditService;
    this.cancellationRegistry = cancellationRegistry;
    this.syncProperties = syncProperties;
    this.jobSleeper = jobSleeper;
    this.clock = clock;
    this.objectMapper = objectMapper;
  }

  /** Runs the job if it is still pending. Never throws; every outcome is recorded on the job. */
  public void execute(UUID jobId) {
    var handle = cancellationRegistry.register(jobId);
    MDC.put("syncJobId", jobId.toString());
    try {
      var job = syncJobRepository.findById(jobId).orElse(null);
      if (job == null) {
        log.warn("Sync job {} no longer exists", jobId);
        return;
      }
      MDC.put("integrationId", job.getIntegrationId().toString());
      RequestScopes.runAs(job.getTenantId(), () -> run(job, handle));
    } catch (RuntimeException e) {
      log.error("Unexpected error while running sync job {}", jobId, e);
    } finally {
      cancellationRegistry.unregister(jobId);
      MDC.remove("integrationId");
      MDC.remove("syncJobId");
    }
  }

  private void run(SyncJob job, CancellationHandle handle) {
    Instant startedAt = clock.instant();
    if (syncJobRepository.claim(job.getId(), startedAt) == 0) {
      log.info("Sync job {} is no longer pending; skipping", job.getId());
      return;
    }
    var integration = integrationRepository.findById(job.getIntegrationId()).orElse(null);
    if (integration == null || !integration.isActive()) {
      syncJobRepository.finishCancelled(job.getId(), clock.instant());
      audit(job, "sync.cancelled", Map.of("reason", "integration_disconnected"));
      return;
    }
    integrationRepository.markSyncing(integration.getId(), startedAt);
    log.info(
        "Started {} sync job {} for {}", job.getKind(), job.getId(), integration.getProvider());

    var run = new JobRun(job, integration, handle, startedAt);
    try {
      run.pullAllPages();
      finishCompleted(run);
    } catch (SyncCancelledException e) {
      finishCancelled(run);
    } catch (RuntimeException e) {
      finishFailed(run, e);
    }
  }

  private void finishCompleted(JobRun run) {
    Instant now = clock.instant();
    if (syncJobRepository.complete(run.job.getId(), now) == 0) {
      log.warn("Sync job {} left RUNNING before it could complete", run.job.getId());
      return;
    }
    integrationRepository.markSyncSucceeded(run.job.getIntegrationId(), run.startedAt);
    log.info(
        "Completed sync job {}: fetched={}, processed={}, failed={}",
        run.job.getId(),
        run.fetched,
        run.processed,
        run.failed);
    var details = run.countDetails();
    details.put("duration_ms", Duration.between(run.startedAt, now).toMillis());
    audit(run.job, "sync.completed", details);
  }

  private void finishCancelled(JobRun run) {
    Instant now = clock.instant();
    if (syncJobRepository.finishCancelled(run.job.getId(), now) == 0) {
      return;
    }
    integrationRepository.markSyncStopped(run.job.getIntegrationId(), now);
    log.info("Cancelled sync job {} after {} records", run.job.getId(), run.fetched);
    audit(run.job, "sync.cancelled", run.countDetails());
  }

  private void finishFailed(JobRun run, RuntimeException error) {
    var failure = SyncFailure.classify(error, run.attempts);
    Instant now = clock.instant();
    var details = failure.toDetails();
    details.put("cause", failure.message());
    if (syncJobRepository.fail(run.job.getId(), failure.message(), toJson(details), now) == 0) {
      log.warn("Sync job {} left RUNNING before its failure was recorded", run.job.getId());
      return;
    }
    integrationRepository.markFailed(
        run.job.getIntegrationId(), failure.category(), failure.message(), now);
    log.warn(
        "Sync job {} failed ({}): {}", run.job.getId(), failure.category(), failure.message());

    var auditDetails = run.countDetails();
    auditDetails.putAll(details);
    audit(run.job, "sync.failed", auditDetails);
  }

  private void audit(SyncJob job, String eventType, Map<String, Object> details) {
    auditService.log(
        AuditEventBuilder.builder()
            .tenantId(job.getTenantId())
            .eventType(eventType)
            .resourceType("sync_job")
            .resourceId(job.getId())
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

  /** Mutable state of one execution. Confined to the worker thread. */
  private final class JobRun {

    private final SyncJob job;
    private final CancellationHandle handle;
    private final Instant startedAt;
    private final Instant deadline;
    private Integration integration;
    private String accessToken;
    private boolean refreshedAfterUnauthorized;
    private int attempts;
    private int fetched;
    private int processed;
    private int failed;

    JobRun(SyncJob job, Integration integration, CancellationHandle handle, Instant startedAt) {
      this.job = job;
      this.integration = integration;
      this.handle = handle;
      this.startedAt = startedAt;
      this.deadline = startedAt.plus(syncProperties.jobTimeout());
    }

    void pullAllPages() {
      integration = tokenRefresher.ensureFreshToken(integration);
      accessToken = credentialStore.readTokens(integration).accessToken();
      ProviderClient client = providerRegistry.resolve(integration.getProvider());

      var params = job.syncParams();
      var request =
          new FetchRequest(
              params.since(), params.until(), syncProperties.pageSize(), params.filters());

      String cursor = null;
      do {
        checkpoint();
        FetchedPage page = fetchWithRetry(client, request, cursor);
        fetched += page.records().size();
        if (!page.records().isEmpty()) {
          var result = recordSink.write(job, page.records());
          processed += result.processed();
          failed += result.failed();
        }
        syncJobRepository.recordProgress(job.getId(), fetched, processed, failed);
        cursor = page.nextCursor();
      } while (cursor != null);
    }

    private FetchedPage fetchWithRetry(ProviderClient client, FetchRequest request, String cursor) {
      var backOff = new ExponentialRandomBackOffPolicy();
      backOff.setInitialInterval(syncProperties.initialBackoff().toMillis());
      backOff.setMultiplier(2.0);
      backOff.setMaxInterval(syncProperties.maxBackoff().toMillis());
      backOff.setSleeper(period -> pause(Duration.ofMillis(period)));

      RetryTemplate retryTemplate =
          RetryTemplate.builder()
              .maxAttempts(syncProperties.maxAttempts())
              .retryOn(ProviderTransientException.class)
              .customBackoff(backOff)
              .build();

      return retryTemplate.execute(
          context -> {
            attempts = context.getRetryCount() + 1;
            if (context.getLastThrowable() != null) {
              log.info(
                  "Retrying page fetch for job {} (attempt {}): {}",
                  job.getId(),
                  attempts,
                  context.getLastThrowable().getMessage());
            }
            return fetchOnce(client, request, cursor);
          });
    }

    private FetchedPage fetchOnce(ProviderClient client, FetchRequest request, String cursor) {
      checkpoint();
      acquireBudget();
      try {
        return client.fetchPage(accessToken, request, cursor);
      } catch (ProviderUnauthorizedException e) {
        if (refreshedAfterUnauthorized) {
          throw e;
        }
        refreshedAfterUnauthorized = true;
        log.info("Provider rejected the access token for job {}; refreshing", job.getId());
        integration = tokenRefresher.forceRefresh(integration);
        accessToken = credentialStore.readTokens(integration).accessToken();
        checkpoint();
        acquireBudget();
        return client.fetchPage(accessToken, request, cursor);
      }
    }

    private void acquireBudget() {
      while (!rateGovernor.tryAcquire(integration)) {
        Duration wait = rateGovernor.waitTime(integration);
        if (clock.instant().plus(wait).isAfter(deadline)) {
          throw new RateLimitExceededException(integration.getId(), wait);
        }
        log.info("Rate limit reached for job {}; waiting {}", job.getId(), wait);
        pause(wait.compareTo(MIN_RATE_LIMIT_WAIT) < 0 ? MIN_RATE_LIMIT_WAIT : wait);
        checkpoint();
      }
    }

    private void pause(Duration duration) {
      Duration untilDeadline = Duration.between(clock.instant(), deadline);
      Duration bounded = duration.compareTo(untilDeadline) > 0 ? untilDeadline : duration;
      if (bounded.isNegative() || bounded.isZero()) {
        return;
      }
      try {
        jobSleeper.sleep(bounded, handle);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new BackOffInterruptedException("Sync worker interrupted while waiting", e);
      }
    }

    private void checkpoint() {
      if (handle.isCancelled()
          || Boolean.TRUE.equals(syncJobRepository.isCancelRequested(job.getId()))) {
        handle.cancel();
        throw new SyncCancelledException();
      }
      if (!clock.instant().isBefore(deadline)) {
        throw new SyncTimeoutException(syncProperties.jobTimeout());
      }
    }

    Map<String, Object> countDetails() {
      var details = new LinkedHashMap<String, Object>();
      details.put("integration_id", job.getIntegrationId().toString());
      details.put("kind", job.getKind().name());
      details.put("records_fetched", fetched);
      details.put("records_processed", processed);
      details.put("records_failed", failed);
      return details;
    }
  }
}
