package io.b2mash.b2b.datasync.integration.token;

import io.b2mash.b2b.datasync.exception.ProblemDetails;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

/** The access token could not be renewed; the tenant has to reconnect the integration. */
public class RefreshFailedException extends ErrorResponseException {

  private final UUID integrationId;

  public RefreshFailedException(UUID integrationId, String reason, Throwable cause) {
    super(
        HttpStatus.CONFLICT,
        ProblemDetails.of(
            HttpStatus.CONFLICT,
            "Reconnection required",
            "Credentials for integration " + integrationId + " could not be refreshed: " + reason),
        cause);
    this.integrationId = integrationId;
    getBody().setProperty("integrationId", integrationId);
  }

  public UUID getIntegrationId() {
    return integrationId;
  }
}
