package io.buildunion.factcore.citation.conflict;

public enum ConflictType {
  AREA,
  COST,
  MATERIALS;

  /** Cost figures are readable only with the financial-view capability. */
  public boolean isFinancial() {
    return this == COST;
  }
}
