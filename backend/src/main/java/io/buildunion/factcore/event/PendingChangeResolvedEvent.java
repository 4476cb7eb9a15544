package io.buildunion.factcore.event;

import io.buildunion.factcore.pendingchange.PendingChangeView;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** Published on approve, reject or cancel; {@code change.status()} tells which. */
public record PendingChangeResolvedEvent(
    String eventType,
    String entityType,
    UUID entityId,
    UUID projectId,
    UUID actorMemberId,
    Instant occurredAt,
    Map<String, Object> details,
    PendingChangeView change)
    implements DomainEvent {}
