package io.buildunion.factcore.citation;

import io.buildunion.factcore.project.ProjectFinancialSummary;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Result of a primary store read: the raw citation records plus the financial fields used as
 * synthesis and scheduling inputs. {@code financial} is null when the project has no summary.
 */
public record StoredFacts(
    UUID projectId,
    List<Map<String, Object>> records,
    ProjectFinancialSummary financial,
    int version) {

  public StoredFacts {
    records = records != null ? Collections.unmodifiableList(new ArrayList<>(records)) : List.of();
  }

  public boolean isEmpty() {
    return records.isEmpty();
  }
}
