package io.buildunion.factcore.exception;

import java.util.UUID;

/**
 * The primary facts store could not be read or written. Never surfaced over HTTP: readers fall back
 * to the snapshot cache and background writers log and continue.
 */
public class SourceUnavailableException extends RuntimeException {

  private final UUID projectId;

  public SourceUnavailableException(UUID projectId, String operation, Throwable cause) {
    super("Primary facts store unavailable for " + operation + " of project " + projectId, cause);
    this.projectId = projectId;
  }

  public UUID getProjectId() {
    return projectId;
  }
}
