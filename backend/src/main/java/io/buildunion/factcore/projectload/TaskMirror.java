package io.buildunion.factcore.projectload;

import io.buildunion.factcore.task.TaskView;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/** Session-local copy of a project's active tasks, kept current from the change feed. */
public class TaskMirror {

  private final Map<UUID, TaskView> tasks = new ConcurrentHashMap<>();

  public TaskMirror(List<TaskView> initial) {
    initial.stream().filter(t -> t.id() != null).forEach(t -> tasks.put(t.id(), t));
  }

  /** Archived tasks leave the mirror. */
  public void upsert(TaskView task) {
    if (task.id() == null) {
      return;
    }
    if (task.archived()) {
      tasks.remove(task.id());
    } else {
      tasks.put(task.id(), task);
    }
  }

  public void remove(UUID taskId) {
    tasks.remove(taskId);
  }

  public List<TaskView> all() {
    return tasks.values().stream()
        .sorted(
            Comparator.comparing(
                    TaskView::dueDate, Comparator.nullsLast(Comparator.<LocalDate>naturalOrder()))
                .thenComparing(TaskView::title))
        .toList();
  }

  public int size() {
    return tasks.size();
  }
}
