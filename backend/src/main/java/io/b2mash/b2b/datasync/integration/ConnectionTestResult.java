package io.b2mash.b2b.datasync.integration;

import java.time.Duration;

/**
 * Outcome of a single test call against the provider of an integration.
 *
 * @param errorCategory null on success
 * @param retryAfter how long to wait before testing again; null when waiting will not help
 */
public record ConnectionTestResult(
    boolean success,
    ProviderType provider,
    ErrorCategory errorCategory,
    String errorMessage,
    Duration retryAfter) {

  static ConnectionTestResult succeeded(ProviderType provider) {
    return new ConnectionTestResult(true, provider, null, null, null);
  }

  static ConnectionTestResult failed(
      ProviderType provider, ErrorCategory category, String message, Duration retryAfter) {
    return new ConnectionTestResult(false, provider, category, message, retryAfter);
  }
}
