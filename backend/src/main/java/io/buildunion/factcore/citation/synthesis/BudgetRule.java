package io.buildunion.factcore.citation.synthesis;

import io.buildunion.factcore.citation.Citation;
import io.buildunion.factcore.citation.CiteType;
import io.buildunion.factcore.citation.LedgerSnapshot;
import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Derives BUDGET from a positive financial summary total. */
final class BudgetRule implements SynthesisRule {

  @Override
  public String name() {
    return "budget";
  }

  @Override
  public List<Citation> candidates(LedgerSnapshot snapshot, SynthesisContext context) {
    BigDecimal total = context.financialTotal();
    if (total == null || total.signum() <= 0) {
      return List.of();
    }
    return List.of(
        SyntheticCitations.create(
            CiteType.BUDGET,
            "financial-summary",
            String.format(Locale.US, "$%,.2f", total),
            total,
            Map.of("source", "financial_summary"),
            context.now()));
  }
}
