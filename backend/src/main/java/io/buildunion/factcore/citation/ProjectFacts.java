package io.buildunion.factcore.citation;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * The persisted citation collection of one project. Writers replace the whole collection; the
 * {@link Version} column rejects a write based on a stale read.
 */
@Entity
@Table(name = "project_facts")
public class ProjectFacts {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false, unique = true)
  private UUID projectId;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "facts", nullable = false, columnDefinition = "jsonb")
  private List<Map<String, Object>> facts = new ArrayList<>();

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected ProjectFacts() {}

  public ProjectFacts(UUID projectId) {
    this.projectId = projectId;
    this.updatedAt = Instant.now();
  }

  public void replaceFacts(List<Map<String, Object>> records) {
    this.facts = new ArrayList<>(records);
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public List<Map<String, Object>> getFacts() {
    return facts != null ? facts : List.of();
  }

  public int getVersion() {
    return version;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
