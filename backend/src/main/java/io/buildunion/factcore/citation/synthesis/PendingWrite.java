package io.buildunion.factcore.citation.synthesis;

import io.buildunion.factcore.citation.Citation;
import java.util.List;

/** Citations one rule added to the ledger that still have to reach the primary store. */
public record PendingWrite(String rule, List<Citation> citations) {

  public PendingWrite {
    citations = List.copyOf(citations);
  }
}
