package io.buildunion.factcore.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

/** A transition was attempted from a terminal state. */
public class InvalidStateException extends ErrorResponseException {

  public InvalidStateException(String title, String detail) {
    super(
        HttpStatus.BAD_REQUEST,
        Problems.of(HttpStatus.BAD_REQUEST, Problems.TERMINAL_STATE, title, detail),
        null);
  }

  public static InvalidStateException transition(String entity, Enum<?> from, String action) {
    var ex =
        new InvalidStateException(
            "Invalid " + entity + " state",
            "Cannot " + action + " " + entity + " in status " + from);
    ex.getBody().setProperty("currentStatus", from.name());
    return ex;
  }
}
