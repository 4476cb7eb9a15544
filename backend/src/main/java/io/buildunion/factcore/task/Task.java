package io.buildunion.factcore.task;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "project_tasks")
public class Task {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false)
  private UUID projectId;

  @Column(name = "title", nullable = false, length = 500)
  private String title;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private TaskStatus status;

  @Enumerated(EnumType.STRING)
  @Column(name = "priority", nullable = false, length = 20)
  private TaskPriority priority;

  @Column(name = "phase", length = 50)
  private String phase;

  @Column(name = "assigned_to")
  private UUID assignedTo;

  @Column(name = "due_date")
  private LocalDate dueDate;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "checklist", nullable = false, columnDefinition = "jsonb")
  private List<Map<String, Object>> checklist = new ArrayList<>();

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Column(name = "archived_at")
  private Instant archivedAt;

  protected Task() {}

  public Task(
      UUID projectId,
      String title,
      String description,
      TaskPriority priority,
      String phase,
      UUID assignedTo,
      LocalDate dueDate) {
    this.projectId = projectId;
    this.title = title;
    this.description = description;
    this.status = TaskStatus.PENDING;
    this.priority = priority != null ? priority : TaskPriority.MEDIUM;
    this.phase = phase;
    this.assignedTo = assignedTo;
    this.dueDate = dueDate;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** Flips completion. Returns the new status. */
  public TaskStatus toggle() {
    this.status = status.toggled();
    this.updatedAt = Instant.now();
    return status;
  }

  public void archive() {
    this.archivedAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public boolean isArchived() {
    return archivedAt != null;
  }

  public boolean isAssignedTo(UUID memberId) {
    return assignedTo != null && assignedTo.equals(memberId);
  }

  public void setChecklist(List<Map<String, Object>> checklist) {
    this.checklist = checklist != null ? new ArrayList<>(checklist) : new ArrayList<>();
  }

  public UUID getId() {
    return id;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public String getTitle() {
    return title;
  }

  public String getDescription() {
    return description;
  }

  public TaskStatus getStatus() {
    return status;
  }

  public TaskPriority getPriority() {
    return priority;
  }

  public String getPhase() {
    return phase;
  }

  public UUID getAssignedTo() {
    return assignedTo;
  }

  public LocalDate getDueDate() {
    return dueDate;
  }

  public List<Map<String, Object>> getChecklist() {
    return checklist != null ? checklist : List.of();
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public Instant getArchivedAt() {
    return archivedAt;
  }
}
