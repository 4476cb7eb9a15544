package io.buildunion.factcore.contract;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "contracts")
public class Contract {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false)
  private UUID projectId;

  @Column(name = "contract_number", nullable = false, length = 100)
  private String contractNumber;

  @Column(name = "client_name", length = 255)
  private String clientName;

  @Column(name = "total_amount", precision = 14, scale = 2)
  private BigDecimal totalAmount;

  @Column(name = "status", nullable = false, length = 30)
  private String status;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Contract() {}

  public Contract(
      UUID projectId,
      String contractNumber,
      String clientName,
      BigDecimal totalAmount,
      String status) {
    this.projectId = projectId;
    this.contractNumber = contractNumber;
    this.clientName = clientName;
    this.totalAmount = totalAmount;
    this.status = status;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public String getContractNumber() {
    return contractNumber;
  }

  public String getClientName() {
    return clientName;
  }

  public BigDecimal getTotalAmount() {
    return totalAmount;
  }

  public String getStatus() {
    return status;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
