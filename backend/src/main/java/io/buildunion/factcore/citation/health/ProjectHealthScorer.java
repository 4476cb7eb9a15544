package io.buildunion.factcore.citation.health;

import io.buildunion.factcore.citation.CiteType;
import io.buildunion.factcore.citation.LedgerSnapshot;
import java.util.ArrayList;

/**
 * Scores how complete a project's verified data is. A project with no crew is scored in solo mode,
 * where the team pillars (documents, contracts and team) are not applicable.
 */
public final class ProjectHealthScorer {

  private ProjectHealthScorer() {}

  /** Scores the ledger alone, counting active roster citations as the crew. */
  public static HealthScore score(LedgerSnapshot ledger) {
    int crew =
        (int)
            ledger.ofType(CiteType.TEAM_MEMBER_INVITE).stream()
                .filter(c -> "active".equals(c.metadataString("status")))
                .count();
    return score(ledger, crew, 0, 0);
  }

  /**
   * Scores the ledger with counts of related records. A positive count completes the matching
   * team pillar even without a citation.
   */
  public static HealthScore score(
      LedgerSnapshot ledger, int teamMemberCount, int documentCount, int contractCount) {
    boolean soloMode = teamMemberCount == 0;
    var completed = new ArrayList<String>();
    var missing = new ArrayList<String>();
    double totalWeight = 0;
    double completedWeight = 0;

    for (var pillar : HealthPillar.relevantTo(soloMode)) {
      totalWeight += pillar.weight();
      boolean complete =
          switch (pillar) {
            case DOCUMENTS -> documentCount > 0 || cited(ledger, pillar);
            case CONTRACTS -> contractCount > 0 || cited(ledger, pillar);
            case TEAM -> teamMemberCount > 0 || cited(ledger, pillar);
            default -> cited(ledger, pillar);
          };
      if (complete) {
        completed.add(pillar.id());
        completedWeight += pillar.weight();
      } else {
        missing.add(pillar.id());
      }
    }

    int score = totalWeight > 0 ? (int) Math.round(completedWeight / totalWeight * 100) : 0;
    return new HealthScore(
        score,
        completed.size(),
        completed.size() + missing.size(),
        completed,
        missing,
        soloMode,
        HealthStatus.of(score));
  }

  private static boolean cited(LedgerSnapshot ledger, HealthPillar pillar) {
    return ledger.findFirst(pillar.citeType()).isPresent();
  }
}
