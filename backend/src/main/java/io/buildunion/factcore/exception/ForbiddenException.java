package io.buildunion.factcore.exception;

import io.buildunion.factcore.access.AccessTier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** The caller's project role does not grant the attempted read or write. */
public class ForbiddenException extends ErrorResponseException {

  public ForbiddenException(String title, String detail) {
    super(HttpStatus.FORBIDDEN, createProblem(title, detail, null), null);
  }

  public ForbiddenException(String title, String detail, AccessTier requiredTier) {
    super(HttpStatus.FORBIDDEN, createProblem(title, detail, requiredTier), null);
  }

  private static ProblemDetail createProblem(String title, String detail, AccessTier required) {
    var problem = Problems.of(HttpStatus.FORBIDDEN, Problems.AUTHORIZATION_DENIED, title, detail);
    if (required != null) {
      problem.setProperty("requiredTier", required.name());
    }
    return problem;
  }
}
