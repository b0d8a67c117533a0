package io.b2mash.b2b.datasync.integration.provider;

/** 4xx responses (other than 401/429) and payloads that cannot be parsed. Never retried. */
public class ProviderPermanentException extends ProviderException {

  public ProviderPermanentException(String message, Integer httpStatus) {
    super(message, httpStatus, null);
  }

  public ProviderPermanentException(String message, Integer httpStatus, Throwable cause) {
    super(message, httpStatus, cause);
  }
}
