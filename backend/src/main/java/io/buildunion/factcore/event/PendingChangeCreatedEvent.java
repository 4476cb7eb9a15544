package io.buildunion.factcore.event;

import io.buildunion.factcore.pendingchange.PendingChangeView;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record PendingChangeCreatedEvent(
    String eventType,
    String entityType,
    UUID entityId,
    UUID projectId,
    UUID actorMemberId,
    Instant occurredAt,
    Map<String, Object> details,
    PendingChangeView change,
    UUID ownerMemberId,
    String ownerEmail)
    implements DomainEvent {}
