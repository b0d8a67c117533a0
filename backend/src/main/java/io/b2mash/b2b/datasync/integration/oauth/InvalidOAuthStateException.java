package io.b2mash.b2b.datasync.integration.oauth;

import io.b2mash.b2b.datasync.exception.ProblemDetails;
import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

/**
 * The callback's state token is unknown, already used or expired. The client-facing message is the
 * same in every case; {@link #getReason()} is for logs.
 */
public class InvalidOAuthStateException extends ErrorResponseException {

  private final String reason;

  public InvalidOAuthStateException(String reason) {
    super(
        HttpStatus.BAD_REQUEST,
        ProblemDetails.of(
            HttpStatus.BAD_REQUEST,
            "Invalid OAuth state",
            "The authorization link is invalid or has expired. Please retry connecting."),
        null);
    this.reason = reason;
    getBody().setProperty("reason", reason);
  }

  public String getReason() {
    return reason;
  }
}
