package io.buildunion.factcore.citation.synthesis;

import io.buildunion.factcore.citation.Citation;
import io.buildunion.factcore.citation.CitationKey;
import io.buildunion.factcore.citation.LedgerSnapshot;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fills ledger gaps from related project data. Rules are evaluated in table order against a
 * working snapshot; a candidate is kept only if its {@link CitationKey} is absent, so an existing
 * citation is never replaced regardless of its provenance. A rule that throws is logged and
 * skipped without affecting the others.
 */
@Component
public class FactSynthesizer {

  private static final Logger log = LoggerFactory.getLogger(FactSynthesizer.class);

  static final List<SynthesisRule> DEFAULT_RULES =
      List.of(
          new TradeSelectionRule(),
          TaskTimelineRule.start(),
          TaskTimelineRule.end(),
          new TeamMemberInviteRule(),
          new BudgetRule(),
          new ContractRule(),
          new WeatherAlertRule());

  private final List<SynthesisRule> rules;

  public FactSynthesizer() {
    this(DEFAULT_RULES);
  }

  FactSynthesizer(List<SynthesisRule> rules) {
    this.rules = List.copyOf(rules);
  }

  public SynthesisResult synthesize(LedgerSnapshot snapshot, SynthesisContext context) {
    var working = snapshot;
    var writes = new ArrayList<PendingWrite>();

    for (var rule : rules) {
      List<Citation> candidates;
      try {
        candidates = rule.candidates(working, context);
      } catch (RuntimeException e) {
        log.warn(
            "Synthesis rule {} failed for project {}, skipping",
            rule.name(),
            context.projectId(),
            e);
        continue;
      }

      var accepted = new ArrayList<Citation>();
      var seen = new HashSet<CitationKey>();
      for (var candidate : candidates) {
        var key = CitationKey.of(candidate);
        if (!working.contains(key) && seen.add(key)) {
          accepted.add(candidate);
        }
      }
      if (!accepted.isEmpty()) {
        working = working.withAdded(accepted);
        writes.add(new PendingWrite(rule.name(), accepted));
        log.debug(
            "Rule {} synthesized {} citation(s) for project {}",
            rule.name(),
            accepted.size(),
            context.projectId());
      }
    }

    return new SynthesisResult(working, writes);
  }
}
