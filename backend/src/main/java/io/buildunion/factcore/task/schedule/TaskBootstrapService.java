package io.buildunion.factcore.task.schedule;

import io.buildunion.factcore.citation.LedgerSnapshot;
import io.buildunion.factcore.event.TaskChangedEvent;
import io.buildunion.factcore.project.ProjectFinancialSummary;
import io.buildunion.factcore.task.Task;
import io.buildunion.factcore.task.TaskRepository;
import io.buildunion.factcore.task.TaskView;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Creates the initial task set of a project that has none. The batch is inserted in one
 * transaction; if it fails nothing is inserted and the load carries on with zero tasks.
 */
@Service
public class TaskBootstrapService {

  private static final Logger log = LoggerFactory.getLogger(TaskBootstrapService.class);

  private final TaskRepository taskRepository;
  private final TaskPhaseScheduler scheduler;
  private final TransactionTemplate transactionTemplate;
  private final ApplicationEventPublisher eventPublisher;

  public TaskBootstrapService(
      TaskRepository taskRepository,
      TaskPhaseScheduler scheduler,
      TransactionTemplate transactionTemplate,
      ApplicationEventPublisher eventPublisher) {
    this.taskRepository = taskRepository;
    this.scheduler = scheduler;
    this.transactionTemplate = transactionTemplate;
    this.eventPublisher = eventPublisher;
  }

  /**
   * Generates tasks when the project has no active tasks and both schedule dates resolve.
   *
   * @return the inserted tasks, empty when not eligible or when the insert failed
   */
  public List<Task> bootstrapIfEmpty(
      UUID projectId,
      List<Task> activeTasks,
      LedgerSnapshot snapshot,
      ProjectFinancialSummary financial) {
    if (!activeTasks.isEmpty()) {
      return List.of();
    }
    var inputs = ScheduleInputs.resolve(snapshot, financial);
    if (inputs.isEmpty()) {
      log.debug("No schedule dates for project {}, skipping task generation", projectId);
      return List.of();
    }

    var windows = scheduler.plan(inputs.get());
    var tasks = scheduler.generateTasks(projectId, windows);
    try {
      var saved =
          transactionTemplate.execute(
              status -> {
                var inserted = taskRepository.saveAll(tasks);
                inserted.forEach(task -> publishInsert(projectId, task));
                return inserted;
              });
      log.info(
          "Generated {} task(s) across {} phase(s) for project {} ({} to {})",
          tasks.size(),
          windows.size(),
          projectId,
          inputs.get().start(),
          inputs.get().end());
      return saved != null ? saved : List.of();
    } catch (RuntimeException e) {
      log.warn("Task generation failed for project {}, no tasks inserted", projectId, e);
      return List.of();
    }
  }

  private void publishInsert(UUID projectId, Task task) {
    eventPublisher.publishEvent(
        new TaskChangedEvent(
            "task.created",
            "task",
            task.getId(),
            projectId,
            null,
            Instant.now(),
            Map.of("title", task.getTitle(), "source", "phase_scheduler"),
            TaskChangedEvent.ChangeKind.INSERT,
            TaskView.from(task)));
  }
}
