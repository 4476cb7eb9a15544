package io.buildunion.factcore.citation.synthesis;

import io.buildunion.factcore.citation.Citation;
import io.buildunion.factcore.citation.LedgerSnapshot;
import java.util.List;

/**
 * One gap-filling rule. A rule proposes candidate citations derived from the synthesis context;
 * {@link FactSynthesizer} keeps only those whose key is absent from the ledger, so rules do not
 * need to check for duplicates themselves.
 */
public interface SynthesisRule {

  /** Stable rule name used in logs and flush outcomes. */
  String name();

  List<Citation> candidates(LedgerSnapshot snapshot, SynthesisContext context);
}
