package io.b2mash.b2b.datasync.integration.provider;

/**
 * @param refreshToken rotated refresh token, or null when the provider keeps the old one valid
 * @param expiresIn lifetime in seconds, or null for non-expiring tokens
 */
public record TokenRefreshResult(String accessToken, String refreshToken, Long expiresIn) {

  @Override
  public String toString() {
    return "TokenRefreshResult[rotated="
        + (refreshToken != null)
        + ", expiresIn="
        + expiresIn
        + "]";
  }
}
