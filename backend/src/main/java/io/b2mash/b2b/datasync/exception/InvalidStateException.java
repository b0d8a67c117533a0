package io.b2mash.b2b.datasync.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when an operation is not allowed in the resource's current state, e.g. cancelling a sync
 * job that already finished.
 */
public class InvalidStateException extends ErrorResponseException {

  public InvalidStateException(String title, String detail) {
    super(HttpStatus.BAD_REQUEST, ProblemDetails.of(HttpStatus.BAD_REQUEST, title, detail), null);
  }
}
