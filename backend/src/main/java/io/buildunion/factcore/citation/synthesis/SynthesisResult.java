package io.buildunion.factcore.citation.synthesis;

import io.buildunion.factcore.citation.Citation;
import io.buildunion.factcore.citation.LedgerSnapshot;
import java.util.List;

public record SynthesisResult(LedgerSnapshot snapshot, List<PendingWrite> pendingWrites) {

  public SynthesisResult {
    pendingWrites = List.copyOf(pendingWrites);
  }

  public List<Citation> synthesized() {
    return pendingWrites.stream().flatMap(write -> write.citations().stream()).toList();
  }

  public boolean hasChanges() {
    return !pendingWrites.isEmpty();
  }
}
