package io.buildunion.factcore.citation.health;

import io.buildunion.factcore.citation.CiteType;
import java.util.Arrays;
import java.util.List;

/**
 * A data source that contributes to the project health score. A pillar is complete when the ledger
 * holds at least one citation of its type. Team pillars only count once the project has a crew.
 */
public enum HealthPillar {
  PROJECT_NAME("project_name", "Project Name", CiteType.PROJECT_NAME, true, 1),
  LOCATION("location", "Location", CiteType.LOCATION, true, 1),
  WORK_TYPE("work_type", "Work Type", CiteType.WORK_TYPE, true, 1),
  GFA_LOCK("gfa_lock", "Area (GFA)", CiteType.GFA_LOCK, true, 1.5),
  TRADE_SELECTION("trade_selection", "Trade Selection", CiteType.TRADE_SELECTION, true, 1),
  TEMPLATE_LOCK("template_lock", "Template", CiteType.TEMPLATE_LOCK, true, 1.5),
  SITE_CONDITION("site_condition", "Site Condition", CiteType.SITE_CONDITION, true, 1),
  TIMELINE("timeline", "Start Date", CiteType.TIMELINE, true, 1),
  END_DATE("end_date", "End Date", CiteType.END_DATE, true, 1),
  DNA_FINALIZED("dna_finalized", "Project DNA", CiteType.DNA_FINALIZED, true, 1),
  BUDGET("budget", "Budget", CiteType.BUDGET, true, 1.5),
  MATERIAL("material", "Materials", CiteType.MATERIAL, true, 1),
  DEMOLITION_PRICE("demolition_price", "Demolition", CiteType.DEMOLITION_PRICE, true, 0.5),
  DOCUMENTS("documents", "Documents", CiteType.BLUEPRINT_UPLOAD, false, 1),
  CONTRACTS("contracts", "Contracts", CiteType.CONTRACT, false, 1),
  TEAM("team", "Team", CiteType.TEAM_STRUCTURE, false, 1);

  private final String id;
  private final String label;
  private final CiteType citeType;
  private final boolean requiredInSoloMode;
  private final double weight;

  HealthPillar(
      String id, String label, CiteType citeType, boolean requiredInSoloMode, double weight) {
    this.id = id;
    this.label = label;
    this.citeType = citeType;
    this.requiredInSoloMode = requiredInSoloMode;
    this.weight = weight;
  }

  public String id() {
    return id;
  }

  public String label() {
    return label;
  }

  public CiteType citeType() {
    return citeType;
  }

  public boolean requiredInSoloMode() {
    return requiredInSoloMode;
  }

  public double weight() {
    return weight;
  }

  /** Pillars scored for a project: the solo subset when nobody else is on the crew. */
  public static List<HealthPillar> relevantTo(boolean soloMode) {
    return Arrays.stream(values()).filter(p -> !soloMode || p.requiredInSoloMode).toList();
  }
}
