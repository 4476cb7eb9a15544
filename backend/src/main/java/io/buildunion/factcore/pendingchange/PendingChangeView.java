package io.buildunion.factcore.pendingchange;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/** Detached copy of a pending change, safe to publish in events and keep in session mirrors. */
public record PendingChangeView(
    UUID id,
    UUID projectId,
    PendingItemType itemType,
    String itemId,
    String itemName,
    BigDecimal originalQuantity,
    BigDecimal newQuantity,
    String changeReason,
    UUID requestedBy,
    PendingChangeStatus status,
    String reviewNotes,
    Instant createdAt,
    Instant resolvedAt,
    UUID resolvedBy) {

  public static PendingChangeView from(PendingChange change) {
    return new PendingChangeView(
        change.getId(),
        change.getProjectId(),
        change.getItemType(),
        change.getItemId(),
        change.getItemName(),
        change.getOriginalQuantity(),
        change.getNewQuantity(),
        change.getChangeReason(),
        change.getRequestedBy(),
        change.getStatus(),
        change.getReviewNotes(),
        change.getCreatedAt(),
        change.getResolvedAt(),
        change.getResolvedBy());
  }
}
