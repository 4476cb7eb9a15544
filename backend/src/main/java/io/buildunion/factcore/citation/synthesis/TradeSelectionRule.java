package io.buildunion.factcore.citation.synthesis;

import io.buildunion.factcore.citation.Citation;
import io.buildunion.factcore.citation.CiteType;
import io.buildunion.factcore.citation.LedgerSnapshot;
import java.util.List;
import java.util.Map;

/** Derives TRADE_SELECTION from the project's trade field. */
final class TradeSelectionRule implements SynthesisRule {

  @Override
  public String name() {
    return "trade-selection";
  }

  @Override
  public List<Citation> candidates(LedgerSnapshot snapshot, SynthesisContext context) {
    String trade = context.projectTrade();
    if (trade == null || trade.isBlank()) {
      return List.of();
    }
    return List.of(
        SyntheticCitations.create(
            CiteType.TRADE_SELECTION,
            "project",
            WorkTypeLabels.label(trade),
            trade,
            Map.of("source", "project", "trade_key", trade),
            context.now()));
  }
}
