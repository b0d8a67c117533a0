package io.b2mash.b2b.datasync.sync;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.b2b.datasync.integration.ErrorCategory;
import io.b2mash.b2b.datasync.integration.ProviderType;
import io.b2mash.b2b.datasync.integration.provider.ProviderPermanentException;
import io.b2mash.b2b.datasync.integration.provider.ProviderTransientException;
import io.b2mash.b2b.datasync.integration.provider.ProviderUnauthorizedException;
import io.b2mash.b2b.datasync.integration.provider.ProviderUnavailableException;
import io.b2mash.b2b.datasync.integration.token.RefreshFailedException;
import io.b2mash.b2b.datasync.ratelimit.RateLimitExceededException;
import java.time.Duration;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.retry.backoff.BackOffInterruptedException;

class SyncFailureTest {

  @Test
  void categorizesProviderAndEngineErrors() {
    assertThat(SyncFailure.categoryOf(new ProviderTransientException("502", 502)))
        .isEqualTo(ErrorCategory.TRANSIENT);
    assertThat(SyncFailure.categoryOf(new BackOffInterruptedException("interrupted")))
        .isEqualTo(ErrorCategory.TRANSIENT);
    assertThat(SyncFailure.categoryOf(new ProviderUnauthorizedException("401")))
        .isEqualTo(ErrorCategory.RECONNECT_REQUIRED);
    assertThat(SyncFailure.categoryOf(new RefreshFailedException(UUID.randomUUID(), "x", null)))
        .isEqualTo(ErrorCategory.RECONNECT_REQUIRED);
    assertThat(SyncFailure.categoryOf(new SyncTimeoutException(Duration.ofMinutes(10))))
        .isEqualTo(ErrorCategory.TIMEOUT);
    assertThat(
            SyncFailure.categoryOf(
                new RateLimitExceededException(UUID.randomUUID(), Duration.ofMinutes(30))))
        .isEqualTo(ErrorCategory.TIMEOUT);
    assertThat(SyncFailure.categoryOf(new ProviderPermanentException("404", 404)))
        .isEqualTo(ErrorCategory.PERMANENT);
    assertThat(SyncFailure.categoryOf(new IllegalArgumentException("bad payload")))
        .isEqualTo(ErrorCategory.PERMANENT);
  }

  @Test
  void toDetails_includesHttpStatusOnlyWhenKnown() {
    var withStatus = SyncFailure.classify(new ProviderTransientException("503", 503), 3);
    var withoutStatus = SyncFailure.classify(new IllegalStateException("boom"), 1);

    assertThat(withStatus.toDetails())
        .containsEntry("category", "TRANSIENT")
        .containsEntry("exception", "ProviderTransientException")
        .containsEntry("attempts", 3)
        .containsEntry("http_status", 503);
    assertThat(withoutStatus.toDetails()).doesNotContainKey("http_status");
    assertThat(withoutStatus.message()).isEqualTo("boom");
  }

  @Test
  void classify_refreshFailure_usesProblemDetail() {
    var id = UUID.randomUUID();
    var failure =
        SyncFailure.classify(new RefreshFailedException(id, "no refresh token stored", null), 1);

    assertThat(failure.message())
        .startsWith("Credentials for integration " + id)
        .endsWith("could not be refreshed: no refresh token stored");
  }

  @Test
  void classify_openCircuitBreaker_isTransientWithRetryAfter() {
    var failure =
        SyncFailure.classify(
            new ProviderUnavailableException(ProviderType.PAYMENTS, Duration.ofSeconds(60)), 1);

    assertThat(failure.category()).isEqualTo(ErrorCategory.TRANSIENT);
    assertThat(failure.toDetails())
        .containsEntry("exception", "ProviderUnavailableException")
        .containsEntry("retry_after_seconds", 60L)
        .doesNotContainKey("http_status");
    assertThat(failure.message()).contains("calls are paused for up to 60s");
  }
}
