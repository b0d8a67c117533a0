package io.b2mash.b2b.datasync.integration.credential;

/** Decrypted tokens of an integration. {@code refreshToken} may be null. */
public record TokenPair(String accessToken, String refreshToken) {

  public boolean hasRefreshToken() {
    return refreshToken != null && !refreshToken.isBlank();
  }

  @Override
  public String toString() {
    return "TokenPair[accessToken=***, refreshToken=" + (hasRefreshToken() ? "***" : "none") + "]";
  }
}
