package io.buildunion.factcore.member;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "team_invitations")
public class TeamInvitation {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false)
  private UUID projectId;

  @Column(name = "email", nullable = false, length = 255)
  private String email;

  @Column(name = "role", nullable = false, length = 50)
  private String role;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private InvitationStatus status;

  @Column(name = "invited_by")
  private UUID invitedBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected TeamInvitation() {}

  public TeamInvitation(UUID projectId, String email, String role, UUID invitedBy) {
    this.projectId = projectId;
    this.email = email;
    this.role = role;
    this.status = InvitationStatus.PENDING;
    this.invitedBy = invitedBy;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public String getEmail() {
    return email;
  }

  public String getRole() {
    return role;
  }

  public InvitationStatus getStatus() {
    return status;
  }

  public UUID getInvitedBy() {
    return invitedBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
