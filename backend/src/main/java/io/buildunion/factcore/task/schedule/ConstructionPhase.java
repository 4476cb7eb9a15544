package io.buildunion.factcore.task.schedule;

import io.buildunion.factcore.task.TaskPriority;

/** Phases of the generated schedule, in execution order, with their relative duration weights. */
public enum ConstructionPhase {
  DEMOLITION("Demolition", 15, TaskPriority.CRITICAL, "Site Clear Photo"),
  PREPARATION("Preparation", 25, TaskPriority.HIGH, "Prep Complete Checklist"),
  INSTALLATION("Installation", 45, TaskPriority.HIGH, "Progress Photos"),
  FINISHING("Finishing & QC", 15, TaskPriority.MEDIUM, "Final Inspection (OBC)");

  private final String label;
  private final int weight;
  private final TaskPriority workPriority;
  private final String verificationLabel;

  ConstructionPhase(
      String label, int weight, TaskPriority workPriority, String verificationLabel) {
    this.label = label;
    this.weight = weight;
    this.workPriority = workPriority;
    this.verificationLabel = verificationLabel;
  }

  public String label() {
    return label;
  }

  public int weight() {
    return weight;
  }

  public TaskPriority workPriority() {
    return workPriority;
  }

  public String verificationLabel() {
    return verificationLabel;
  }
}
