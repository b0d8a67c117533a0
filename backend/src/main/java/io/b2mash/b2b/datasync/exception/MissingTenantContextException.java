package io.b2mash.b2b.datasync.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

public class MissingTenantContextException extends ErrorResponseException {

  public MissingTenantContextException() {
    super(
        HttpStatus.UNAUTHORIZED,
        ProblemDetails.of(
            HttpStatus.UNAUTHORIZED,
            "Missing tenant context",
            "JWT token does not carry a tenant_id claim"),
        null);
  }
}
