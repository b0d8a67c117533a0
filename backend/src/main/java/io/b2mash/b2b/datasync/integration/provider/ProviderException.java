package io.b2mash.b2b.datasync.integration.provider;

/** Base class of failures reported by a {@link ProviderClient}. */
public abstract class ProviderException extends RuntimeException {

  private final Integer httpStatus;

  protected ProviderException(String message, Integer httpStatus, Throwable cause) {
    super(message, cause);
    this.httpStatus = httpStatus;
  }

  /** HTTP status returned by the provider, or null when no response was received. */
  public Integer getHttpStatus() {
    return httpStatus;
  }
}
