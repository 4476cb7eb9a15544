package io.buildunion.factcore.task;

import io.buildunion.factcore.context.RequestScopes;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class TaskController {

  private final TaskService taskService;

  public TaskController(TaskService taskService) {
    this.taskService = taskService;
  }

  @GetMapping("/api/projects/{projectId}/tasks")
  public ResponseEntity<List<TaskView>> listTasks(@PathVariable UUID projectId) {
    RequestScopes.requireMemberId();
    return ResponseEntity.ok(
        taskService.listActiveTasks(projectId).stream().map(TaskView::from).toList());
  }

  @PostMapping("/api/projects/{projectId}/tasks/{taskId}/toggle")
  public ResponseEntity<TaskView> toggleTask(
      @PathVariable UUID projectId, @PathVariable UUID taskId) {
    UUID memberId = RequestScopes.requireMemberId();
    return ResponseEntity.ok(TaskView.from(taskService.toggleTask(projectId, taskId, memberId)));
  }
}
