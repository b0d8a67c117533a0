package io.b2mash.b2b.datasync.sync;

import io.b2mash.b2b.datasync.exception.ProblemDetails;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

public class SyncAlreadyInProgressException extends ErrorResponseException {

  public SyncAlreadyInProgressException(UUID integrationId) {
    super(
        HttpStatus.CONFLICT,
        ProblemDetails.of(
            HttpStatus.CONFLICT,
            "Sync already in progress",
            "Integration " + integrationId + " already has a pending or running sync job"),
        null);
    getBody().setProperty("integrationId", integrationId);
  }
}
