package io.buildunion.factcore.event;

import io.buildunion.factcore.task.TaskView;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** Insert, update or delete of a task row. On delete {@code task} is the last known state. */
public record TaskChangedEvent(
    String eventType,
    String entityType,
    UUID entityId,
    UUID projectId,
    UUID actorMemberId,
    Instant occurredAt,
    Map<String, Object> details,
    ChangeKind kind,
    TaskView task)
    implements DomainEvent {

  public enum ChangeKind {
    INSERT,
    UPDATE,
    DELETE
  }
}
