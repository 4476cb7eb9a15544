package io.buildunion.factcore.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

public class MissingActorContextException extends ErrorResponseException {

  public MissingActorContextException() {
    super(
        HttpStatus.UNAUTHORIZED,
        Problems.of(
            HttpStatus.UNAUTHORIZED,
            Problems.MISSING_ACTOR,
            "Missing actor context",
            "Request does not identify the acting member"),
        null);
  }
}
