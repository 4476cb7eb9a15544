package io.buildunion.factcore.task;

/** Task progress as shown on the project board. */
public enum TaskStatus {
  PENDING,
  IN_PROGRESS,
  COMPLETED;

  /** Status after a checkbox toggle: open tasks complete, completed tasks reopen. */
  public TaskStatus toggled() {
    return this == COMPLETED ? PENDING : COMPLETED;
  }
}
