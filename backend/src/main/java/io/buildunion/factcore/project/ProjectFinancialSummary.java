package io.buildunion.factcore.project;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/** Cost totals and fallback schedule dates recorded for a project. */
@Entity
@Table(name = "project_financial_summaries")
public class ProjectFinancialSummary {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false, unique = true)
  private UUID projectId;

  @Column(name = "total_cost", precision = 14, scale = 2)
  private BigDecimal totalCost;

  @Column(name = "material_cost", precision = 14, scale = 2)
  private BigDecimal materialCost;

  @Column(name = "labor_cost", precision = 14, scale = 2)
  private BigDecimal laborCost;

  @Column(name = "project_start_date")
  private LocalDate projectStartDate;

  @Column(name = "project_end_date")
  private LocalDate projectEndDate;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected ProjectFinancialSummary() {}

  public ProjectFinancialSummary(
      UUID projectId,
      BigDecimal totalCost,
      BigDecimal materialCost,
      BigDecimal laborCost,
      LocalDate projectStartDate,
      LocalDate projectEndDate) {
    this.projectId = projectId;
    this.totalCost = totalCost;
    this.materialCost = materialCost;
    this.laborCost = laborCost;
    this.projectStartDate = projectStartDate;
    this.projectEndDate = projectEndDate;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public BigDecimal getTotalCost() {
    return totalCost;
  }

  public BigDecimal getMaterialCost() {
    return materialCost;
  }

  public BigDecimal getLaborCost() {
    return laborCost;
  }

  public LocalDate getProjectStartDate() {
    return projectStartDate;
  }

  public LocalDate getProjectEndDate() {
    return projectEndDate;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
