package io.buildunion.factcore.task;

import io.buildunion.factcore.access.AccessTierResolver;
import io.buildunion.factcore.access.ProjectAccessService;
import io.buildunion.factcore.event.TaskChangedEvent;
import io.buildunion.factcore.exception.ForbiddenException;
import io.buildunion.factcore.exception.ResourceNotFoundException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class TaskService {

  private static final Logger log = LoggerFactory.getLogger(TaskService.class);

  private final TaskRepository taskRepository;
  private final ProjectAccessService projectAccessService;
  private final ApplicationEventPublisher eventPublisher;

  public TaskService(
      TaskRepository taskRepository,
      ProjectAccessService projectAccessService,
      ApplicationEventPublisher eventPublisher) {
    this.taskRepository = taskRepository;
    this.projectAccessService = projectAccessService;
    this.eventPublisher = eventPublisher;
  }

  @Transactional(readOnly = true)
  public List<Task> listActiveTasks(UUID projectId) {
    return taskRepository.findActiveByProjectId(projectId);
  }

  /**
   * Flips a task between open and completed. Owners and foremen may toggle any task; worker-class
   * roles only the tasks assigned to them.
   */
  @Transactional
  public Task toggleTask(UUID projectId, UUID taskId, UUID memberId) {
    var access = projectAccessService.resolve(projectId, memberId);
    var task =
        taskRepository
            .findById(taskId)
            .filter(t -> t.getProjectId().equals(projectId) && !t.isArchived())
            .orElseThrow(() -> new ResourceNotFoundException("Task", taskId));

    if (!AccessTierResolver.canToggleTask(access.role(), task.getAssignedTo(), memberId)) {
      throw new ForbiddenException(
          "Cannot update task", "You can only update tasks assigned to you");
    }

    var previous = task.getStatus();
    var next = task.toggle();
    var saved = taskRepository.save(task);
    log.info(
        "Task {} in project {} toggled {} -> {} by {}",
        taskId,
        projectId,
        previous,
        next,
        memberId);

    eventPublisher.publishEvent(
        new TaskChangedEvent(
            "task.status_changed",
            "task",
            saved.getId(),
            projectId,
            memberId,
            Instant.now(),
            Map.of("old_status", previous.name(), "new_status", next.name()),
            TaskChangedEvent.ChangeKind.UPDATE,
            TaskView.from(saved)));
    return saved;
  }
}
