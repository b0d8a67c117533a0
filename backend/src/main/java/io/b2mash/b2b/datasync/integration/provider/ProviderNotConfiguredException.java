package io.b2mash.b2b.datasync.integration.provider;

import io.b2mash.b2b.datasync.exception.ProblemDetails;
import io.b2mash.b2b.datasync.integration.ProviderType;
import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

public class ProviderNotConfiguredException extends ErrorResponseException {

  public ProviderNotConfiguredException(ProviderType provider) {
    super(
        HttpStatus.UNPROCESSABLE_ENTITY,
        ProblemDetails.of(
            HttpStatus.UNPROCESSABLE_ENTITY,
            "Provider not configured",
            "No OAuth client or adapter is configured for provider " + provider.getSlug()),
        null);
  }
}
