package io.b2mash.b2b.datasync.integration.provider;

import io.b2mash.b2b.datasync.integration.ProviderType;

/**
 * Outbound adapter for one provider. Implementations are Spring beans picked up by {@link
 * ProviderRegistry}.
 *
 * <p>Failures are reported through the {@link ProviderException} hierarchy: {@link
 * ProviderTransientException} for timeouts, 5xx and 429, {@link ProviderUnauthorizedException} for
 * a rejected access token, {@link ProviderPermanentException} for everything that retrying will not
 * fix.
 */
public interface ProviderClient {

  ProviderType provider();

  TokenGrant exchangeCode(String code, String redirectUri);

  TokenRefreshResult refreshToken(String refreshToken);

  /**
   * Fetches one page of records.
   *
   * @param cursor cursor returned by the previous page, or null for the first page
   */
  FetchedPage fetchPage(String accessToken, FetchRequest request, String cursor);

  default boolean supportsRevocation() {
    return false;
  }

  /** Revokes the token at the provider. Only called when {@link #supportsRevocation()} is true. */
  default void revoke(String token) {
    throw new UnsupportedOperationException(provider() + " does not support token revocation");
  }
}
