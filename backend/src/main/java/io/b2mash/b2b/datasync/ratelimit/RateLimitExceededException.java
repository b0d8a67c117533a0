package io.b2mash.b2b.datasync.ratelimit;

import java.time.Duration;
import java.util.UUID;

/**
 * No request budget can be obtained before the job's deadline. Never reaches an HTTP client; the
 * sync engine records it as a timeout.
 */
public class RateLimitExceededException extends RuntimeException {

  private final Duration waitTime;

  public RateLimitExceededException(UUID integrationId, Duration waitTime) {
    super(
        "Rate limit exhausted for integration "
            + integrationId
            + "; next window opens in "
            + waitTime.toSeconds()
            + "s");
    this.waitTime = waitTime;
  }

  public Duration getWaitTime() {
    return waitTime;
  }
}
