package io.b2mash.b2b.datasync.integration.provider;

import io.b2mash.b2b.datasync.integration.ProviderType;
import java.time.Duration;

/**
 * The provider's circuit breaker is open after repeated transient failures, so the call was not
 * made. Not retried in place; the next trigger after {@link #getRetryAfter()} may succeed.
 */
public class ProviderUnavailableException extends ProviderException {

  private final ProviderType provider;
  private final Duration retryAfter;

  public ProviderUnavailableException(ProviderType provider, Duration retryAfter) {
    super(
        provider.getSlug()
            + " is failing repeatedly; calls are paused for up to "
            + retryAfter.toSeconds()
            + "s",
        null,
        null);
    this.provider = provider;
    this.retryAfter = retryAfter;
  }

  public ProviderType getProvider() {
    return provider;
  }

  public Duration getRetryAfter() {
    return retryAfter;
  }
}
