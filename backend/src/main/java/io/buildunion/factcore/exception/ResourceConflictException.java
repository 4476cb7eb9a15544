package io.buildunion.factcore.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

public class ResourceConflictException extends ErrorResponseException {

  public ResourceConflictException(String title, String detail) {
    super(
        HttpStatus.CONFLICT,
        Problems.of(HttpStatus.CONFLICT, Problems.CHANGE_ALREADY_PENDING, title, detail),
        null);
  }

  /** A second proposal for an item that already has a pending change. */
  public static ResourceConflictException alreadyPending(String itemType, String itemId) {
    var ex =
        new ResourceConflictException(
            "Change already pending",
            "A pending change already exists for " + itemType.toLowerCase() + " " + itemId);
    ex.getBody().setProperty("itemType", itemType);
    ex.getBody().setProperty("itemId", itemId);
    return ex;
  }
}
