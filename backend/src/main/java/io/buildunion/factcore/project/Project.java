package io.buildunion.factcore.project;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "projects")
public class Project {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "address", length = 500)
  private String address;

  @Column(name = "trade", length = 100)
  private String trade;

  @Column(name = "owner_id", nullable = false)
  private UUID ownerId;

  @Column(name = "owner_email", length = 255)
  private String ownerEmail;

  @Column(name = "edit_mode_enabled", nullable = false)
  private boolean editModeEnabled;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Project() {}

  public Project(String name, String address, String trade, UUID ownerId, String ownerEmail) {
    this.name = name;
    this.address = address;
    this.trade = trade;
    this.ownerId = ownerId;
    this.ownerEmail = ownerEmail;
    this.editModeEnabled = false;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public boolean isOwnedBy(UUID memberId) {
    return ownerId != null && ownerId.equals(memberId);
  }

  /** Owner-controlled switch that grants the owner write access to project facts. */
  public void setEditModeEnabled(boolean editModeEnabled) {
    this.editModeEnabled = editModeEnabled;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getAddress() {
    return address;
  }

  public String getTrade() {
    return trade;
  }

  public UUID getOwnerId() {
    return ownerId;
  }

  public String getOwnerEmail() {
    return ownerEmail;
  }

  public boolean isEditModeEnabled() {
    return editModeEnabled;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
