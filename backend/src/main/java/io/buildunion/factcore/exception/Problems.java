package io.buildunion.factcore.exception;

import java.net.URI;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;

/** Problem type identifiers and the shared {@link ProblemDetail} factory. */
public final class Problems {

  private static final String BASE = "https://buildunion.io/problems/";

  public static final URI AUTHORIZATION_DENIED = URI.create(BASE + "authorization-denied");
  public static final URI NOT_FOUND = URI.create(BASE + "not-found");
  public static final URI CHANGE_ALREADY_PENDING = URI.create(BASE + "change-already-pending");
  public static final URI TERMINAL_STATE = URI.create(BASE + "terminal-state");
  public static final URI CONCURRENT_MODIFICATION = URI.create(BASE + "concurrent-modification");
  public static final URI EXTERNAL_SERVICE_DEGRADED =
      URI.create(BASE + "external-service-degraded");
  public static final URI MISSING_ACTOR = URI.create(BASE + "missing-actor");

  private Problems() {}

  static ProblemDetail of(HttpStatus status, URI type, String title, String detail) {
    var problem = ProblemDetail.forStatusAndDetail(status, detail);
    problem.setType(type);
    problem.setTitle(title);
    return problem;
  }
}
