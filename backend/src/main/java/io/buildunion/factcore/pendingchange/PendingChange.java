package io.buildunion.factcore.pendingchange;

import io.buildunion.factcore.exception.InvalidStateException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A quantity edit proposed by a foreman or subcontractor and awaiting the owner's decision. The
 * entity never touches the item it refers to; applying an approved quantity is the caller's job.
 */
@Entity
@Table(name = "pending_changes")
public class PendingChange {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false)
  private UUID projectId;

  @Enumerated(EnumType.STRING)
  @Column(name = "item_type", nullable = false, length = 20)
  private PendingItemType itemType;

  @Column(name = "item_id", nullable = false, length = 255)
  private String itemId;

  @Column(name = "item_name", nullable = false, length = 255)
  private String itemName;

  @Column(name = "original_quantity", precision = 14, scale = 3)
  private BigDecimal originalQuantity;

  @Column(name = "new_quantity", nullable = false, precision = 14, scale = 3)
  private BigDecimal newQuantity;

  @Column(name = "change_reason", columnDefinition = "TEXT")
  private String changeReason;

  @Column(name = "requested_by", nullable = false)
  private UUID requestedBy;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private PendingChangeStatus status;

  @Column(name = "review_notes", columnDefinition = "TEXT")
  private String reviewNotes;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "resolved_at")
  private Instant resolvedAt;

  @Column(name = "resolved_by")
  private UUID resolvedBy;

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  protected PendingChange() {}

  public PendingChange(
      UUID projectId,
      PendingItemType itemType,
      String itemId,
      String itemName,
      BigDecimal originalQuantity,
      BigDecimal newQuantity,
      String changeReason,
      UUID requestedBy) {
    this.projectId = projectId;
    this.itemType = itemType;
    this.itemId = itemId;
    this.itemName = itemName;
    this.originalQuantity = originalQuantity;
    this.newQuantity = newQuantity;
    this.changeReason = changeReason;
    this.requestedBy = requestedBy;
    this.status = PendingChangeStatus.PENDING;
    this.createdAt = Instant.now();
  }

  public void approve(UUID ownerId, String notes) {
    resolve(PendingChangeStatus.APPROVED, ownerId, notes, "approve");
  }

  public void reject(UUID ownerId, String notes) {
    resolve(PendingChangeStatus.REJECTED, ownerId, notes, "reject");
  }

  /** Withdrawn by the requester. */
  public void cancel(UUID requesterId) {
    resolve(PendingChangeStatus.CANCELLED, requesterId, null, "cancel");
  }

  public boolean isRequestedBy(UUID memberId) {
    return requestedBy.equals(memberId);
  }

  private void resolve(PendingChangeStatus target, UUID actorId, String notes, String action) {
    if (!status.canTransitionTo(target)) {
      throw InvalidStateException.transition("pending change", status, action);
    }
    this.status = target;
    this.resolvedBy = actorId;
    this.resolvedAt = Instant.now();
    if (notes != null && !notes.isBlank()) {
      this.reviewNotes = notes;
    }
  }

  public UUID getId() {
    return id;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public PendingItemType getItemType() {
    return itemType;
  }

  public String getItemId() {
    return itemId;
  }

  public String getItemName() {
    return itemName;
  }

  public BigDecimal getOriginalQuantity() {
    return originalQuantity;
  }

  public BigDecimal getNewQuantity() {
    return newQuantity;
  }

  public String getChangeReason() {
    return changeReason;
  }

  public UUID getRequestedBy() {
    return requestedBy;
  }

  public PendingChangeStatus getStatus() {
    return status;
  }

  public String getReviewNotes() {
    return reviewNotes;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getResolvedAt() {
    return resolvedAt;
  }

  public UUID getResolvedBy() {
    return resolvedBy;
  }

  public int getVersion() {
    return version;
  }
}
