package io.b2mash.b2b.datasync.integration.provider;

/**
 * The provider rejected the credentials (HTTP 401, or {@code invalid_grant} from the token
 * endpoint).
 */
public class ProviderUnauthorizedException extends ProviderException {

  public ProviderUnauthorizedException(String message) {
    super(message, 401, null);
  }

  public ProviderUnauthorizedException(String message, Integer httpStatus, Throwable cause) {
    super(message, httpStatus, cause);
  }
}
