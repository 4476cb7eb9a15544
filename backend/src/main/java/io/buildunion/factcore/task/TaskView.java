package io.buildunion.factcore.task;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Detached copy of a task as held in session mirrors and returned to clients. */
public record TaskView(
    UUID id,
    UUID projectId,
    String title,
    String description,
    TaskStatus status,
    TaskPriority priority,
    String phase,
    UUID assignedTo,
    LocalDate dueDate,
    List<Map<String, Object>> checklist,
    boolean archived) {

  public static TaskView from(Task task) {
    return new TaskView(
        task.getId(),
        task.getProjectId(),
        task.getTitle(),
        task.getDescription(),
        task.getStatus(),
        task.getPriority(),
        task.getPhase(),
        task.getAssignedTo(),
        task.getDueDate(),
        List.copyOf(task.getChecklist()),
        task.isArchived());
  }
}
