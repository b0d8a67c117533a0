package io.b2mash.b2b.datasync.integration.provider;

import java.util.List;

/**
 * Result of exchanging an authorization code.
 *
 * @param refreshToken null when the provider issues no refresh token
 * @param expiresIn access token lifetime in seconds; null when the token does not expire
 * @param externalAccountId stable identifier of the connected account at the provider
 */
public record TokenGrant(
    String accessToken,
    String refreshToken,
    String tokenType,
    Long expiresIn,
    List<String> scopes,
    String externalAccountId,
    String externalAccountName) {

  public TokenGrant {
    scopes = scopes != null ? List.copyOf(scopes) : List.of();
  }

  @Override
  public String toString() {
    return "TokenGrant[tokenType="
        + tokenType
        + ", expiresIn="
        + expiresIn
        + ", scopes="
        + scopes
        + ", externalAccountId="
        + externalAccountId
        + "]";
  }
}
