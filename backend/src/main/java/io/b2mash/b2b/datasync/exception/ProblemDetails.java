package io.b2mash.b2b.datasync.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;

/** Shared factory for the {@link ProblemDetail} bodies carried by this package's exceptions. */
public final class ProblemDetails {

  private ProblemDetails() {}

  public static ProblemDetail of(HttpStatus status, String title, String detail) {
    var problem = ProblemDetail.forStatus(status);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
