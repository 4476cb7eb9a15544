package io.buildunion.factcore.event;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Base interface for change-feed events published via Spring ApplicationEventPublisher. Events are
 * records holding detached values only, no JPA entities, so they stay valid after the publishing
 * transaction commits.
 */
public sealed interface DomainEvent
    permits PendingChangeCreatedEvent, PendingChangeResolvedEvent, TaskChangedEvent {

  String eventType();

  String entityType();

  UUID entityId();

  UUID projectId();

  UUID actorMemberId();

  Instant occurredAt();

  Map<String, Object> details();
}
