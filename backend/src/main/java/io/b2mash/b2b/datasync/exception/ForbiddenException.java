package io.b2mash.b2b.datasync.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

/** Thrown when the caller's tenant does not own the addressed resource. */
public class ForbiddenException extends ErrorResponseException {

  public ForbiddenException(String title, String detail) {
    super(HttpStatus.FORBIDDEN, ProblemDetails.of(HttpStatus.FORBIDDEN, title, detail), null);
  }
}
