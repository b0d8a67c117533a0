package io.b2mash.b2b.datasync.integration.provider;

/** Timeouts, 5xx and 429 responses. Safe to retry after a backoff. */
public class ProviderTransientException extends ProviderException {

  public ProviderTransientException(String message, Integer httpStatus) {
    super(message, httpStatus, null);
  }

  public ProviderTransientException(String message, Integer httpStatus, Throwable cause) {
    super(message, httpStatus, cause);
  }
}
