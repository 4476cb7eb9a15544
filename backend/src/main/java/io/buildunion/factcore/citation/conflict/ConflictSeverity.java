package io.buildunion.factcore.citation.conflict;

public enum ConflictSeverity {
  HIGH,
  MEDIUM,
  LOW
}
