package io.b2mash.b2b.datasync.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

public class ResourceConflictException extends ErrorResponseException {

  public ResourceConflictException(String title, String detail) {
    super(HttpStatus.CONFLICT, ProblemDetails.of(HttpStatus.CONFLICT, title, detail), null);
  }
}
