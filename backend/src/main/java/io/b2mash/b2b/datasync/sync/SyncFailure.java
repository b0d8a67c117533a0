package io.b2mash.b2b.datasync.sync;

import io.b2mash.b2b.datasync.integration.ErrorCategory;
import io.b2mash.b2b.datasync.integration.provider.ProviderException;
import io.b2mash.b2b.datasync.integration.provider.ProviderTransientException;
import io.b2mash.b2b.datasync.integration.provider.ProviderUnauthorizedException;
import io.b2mash.b2b.datasync.integration.provider.ProviderUnavailableException;
import io.b2mash.b2b.datasync.integration.token.RefreshFailedException;
import io.b2mash.b2b.datasync.ratelimit.RateLimitExceededException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.retry.backoff.BackOffInterruptedException;

/** Why a sync job failed, in the shape stored on the job and on the integration. */
record SyncFailure(
    ErrorCategory category,
    String message,
    Integer httpStatus,
    String exception,
    int attempts,
    Long retryAfterSeconds) {

  static SyncFailure classify(Throwable error, int attempts) {
    Integer status = error instanceof ProviderException pe ? pe.getHttpStatus() : null;
    Long retryAfter =
        error instanceof ProviderUnavailableException pue
            ? pue.getRetryAfter().toSeconds()
            : null;
    return new SyncFailure(
        categoryOf(error),
        describe(error),
        status,
        error.getClass().getSimpleName(),
        attempts,
        retryAfter);
  }

  /** The worker pool refused the job before any attempt was made. */
  static SyncFailure rejected(TaskRejectedException error, String message) {
    return new SyncFailure(
        categoryOf(error), message, null, error.getClass().getSimpleName(), 0, null);
  }

  static ErrorCategory categoryOf(Throwable error) {
    if (error instanceof SyncTimeoutException || error instanceof RateLimitExceededException) {
      return ErrorCategory.TIMEOUT;
    }
    if (error instanceof RefreshFailedException
        || error instanceof ProviderUnauthorizedException) {
      return ErrorCategory.RECONNECT_REQUIRED;
    }
    if (error instanceof ProviderTransientException
        || error instanceof ProviderUnavailableException
        || error instanceof TaskRejectedException
        || error instanceof BackOffInterruptedException) {
      return ErrorCategory.TRANSIENT;
    }
    return ErrorCategory.PERMANENT;
  }

  Map<String, Object> toDetails() {
    var details = new LinkedHashMap<String, Object>();
    details.put("category", category.name());
    details.put("exception", exception);
    details.put("attempts", attempts);
    if (httpStatus != null) {
      details.put("http_status", httpStatus);
    }
    if (retryAfterSeconds != null) {
      details.put("retry_after_seconds", retryAfterSeconds);
    }
    return details;
  }

  private static String describe(Throwable error) {
    if (error instanceof RefreshFailedException rfe && rfe.getBody().getDetail() != null) {
      return rfe.getBody().getDetail();
    }
    return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
  }
}
