package io.buildunion.factcore.projectload;

import io.buildunion.factcore.event.PendingChangeCreatedEvent;
import io.buildunion.factcore.event.PendingChangeResolvedEvent;
import io.buildunion.factcore.event.TaskChangedEvent;
import io.buildunion.factcore.pendingchange.PendingChangeView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Applies committed task and pending-change events to the mirrors of open sessions. Handlers only
 * touch in-memory state and never trigger synthesis.
 */
@Component
public class ProjectChangeFeedListener {

  private static final Logger log = LoggerFactory.getLogger(ProjectChangeFeedListener.class);

  private final ProjectSessionRegistry sessionRegistry;

  public ProjectChangeFeedListener(ProjectSessionRegistry sessionRegistry) {
    this.sessionRegistry = sessionRegistry;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onTaskChanged(TaskChangedEvent event) {
    try {
      for (var session : sessionRegistry.forProject(event.projectId())) {
        if (event.kind() == TaskChangedEvent.ChangeKind.DELETE) {
          session.tasks().remove(event.entityId());
        } else {
          session.tasks().upsert(event.task());
        }
      }
    } catch (RuntimeException e) {
      log.warn(
          "Failed to mirror task event {} for task {}", event.eventType(), event.entityId(), e);
    }
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onPendingChangeCreated(PendingChangeCreatedEvent event) {
    mirror(event.change(), event.eventType());
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onPendingChangeResolved(PendingChangeResolvedEvent event) {
    mirror(event.change(), event.eventType());
  }

  private void mirror(PendingChangeView change, String eventType) {
    try {
      for (var session : sessionRegistry.forProject(change.projectId())) {
        if (!session.owner() && !change.requestedBy().equals(session.memberId())) {
          continue;
        }
        if (session.pendingChanges().apply(change)) {
          log.debug(
              "New pending change {} surfaced to session {}", change.id(), session.sessionId());
        }
      }
    } catch (RuntimeException e) {
      log.warn("Failed to mirror {} for pending change {}", eventType, change.id(), e);
    }
  }
}
