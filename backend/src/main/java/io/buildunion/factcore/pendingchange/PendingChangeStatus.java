package io.buildunion.factcore.pendingchange;

import java.util.Map;
import java.util.Set;

/** Approval state of a proposed quantity change. Every non-pending state is terminal. */
public enum PendingChangeStatus {
  PENDING,
  APPROVED,
  REJECTED,
  CANCELLED;

  private static final Map<PendingChangeStatus, Set<PendingChangeStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          PENDING, Set.of(APPROVED, REJECTED, CANCELLED),
          APPROVED, Set.of(),
          REJECTED, Set.of(),
          CANCELLED, Set.of());

  public Set<PendingChangeStatus> allowedTransitions() {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of());
  }

  public boolean canTransitionTo(PendingChangeStatus target) {
    return allowedTransitions().contains(target);
  }

  public boolean isTerminal() {
    return this != PENDING;
  }
}
