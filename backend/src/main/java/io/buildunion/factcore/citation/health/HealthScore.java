package io.buildunion.factcore.citation.health;

import java.util.List;

/**
 * Weighted completeness of a project's verified data, 0 to 100. Pillars are listed by id in
 * declaration order.
 */
public record HealthScore(
    int score,
    int completedCount,
    int totalCount,
    List<String> completedPillars,
    List<String> missingPillars,
    boolean soloMode,
    HealthStatus status) {

  public HealthScore {
    completedPillars = List.copyOf(completedPillars);
    missingPillars = List.copyOf(missingPillars);
  }

  public String statusLabel() {
    return status.label();
  }
}
