package io.buildunion.factcore.task;

public enum TaskPriority {
  CRITICAL,
  HIGH,
  MEDIUM,
  LOW
}
