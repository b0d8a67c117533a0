package io.b2mash.b2b.datasync.integration.oauth;

import io.b2mash.b2b.datasync.exception.ProblemDetails;
import io.b2mash.b2b.datasync.integration.ProviderType;
import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

/** The provider refused to issue tokens for the authorization code. Not retried. */
public class TokenExchangeException extends ErrorResponseException {

  public TokenExchangeException(ProviderType provider, String providerError, Throwable cause) {
    super(
        HttpStatus.BAD_GATEWAY,
        ProblemDetails.of(
            HttpStatus.BAD_GATEWAY,
            "Token exchange failed",
            "Could not complete the connection to " + provider.getSlug() + ": " + providerError),
        cause);
    getBody().setProperty("provider", provider.getSlug());
    getBody().setProperty("providerError", providerError);
  }
}
