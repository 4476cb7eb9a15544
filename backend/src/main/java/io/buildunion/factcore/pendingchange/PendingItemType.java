package io.buildunion.factcore.pendingchange;

/** Kind of line item a quantity change targets. */
public enum PendingItemType {
  MATERIAL,
  LABOR,
  TASK,
  OTHER
}
