package io.buildunion.factcore.projectload;

import io.buildunion.factcore.access.AccessTier;
import io.buildunion.factcore.citation.conflict.SourceConflict;
import io.buildunion.factcore.citation.health.HealthScore;
import io.buildunion.factcore.pendingchange.PendingChangeView;
import io.buildunion.factcore.task.TaskView;
import java.util.List;
import java.util.UUID;

/** Tier-filtered projection of an open project session. */
public record ProjectFactsView(
    UUID sessionId,
    UUID projectId,
    String role,
    AccessTier tier,
    boolean canEdit,
    boolean canViewFinancials,
    List<CitationView> citations,
    List<SectionView> sections,
    List<TaskView> tasks,
    List<PendingChangeView> pendingChanges,
    HealthScore health,
    List<SourceConflict> conflicts,
    LoadSummary load) {

  /** How the ledger behind this view was assembled. Null for views of an already-open session. */
  public record LoadSummary(boolean fromCache, int synthesized, int generatedTasks) {}
}
