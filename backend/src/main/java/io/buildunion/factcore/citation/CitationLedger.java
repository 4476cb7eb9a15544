package io.buildunion.factcore.citation;

import java.util.List;
import java.util.Optional;

/**
 * Mutable holder of one session's citations. Readers always see a complete {@link LedgerSnapshot};
 * writers swap the snapshot atomically.
 */
public class CitationLedger {

  private volatile LedgerSnapshot snapshot;

  public CitationLedger(LedgerSnapshot initial) {
    this.snapshot = initial != null ? initial : LedgerSnapshot.empty();
  }

  public Optional<Citation> get(String citationId) {
    return snapshot.find(citationId);
  }

  public synchronized void upsert(Citation citation) {
    snapshot = snapshot.withUpserted(citation);
  }

  public List<Citation> all() {
    return snapshot.all();
  }

  public LedgerSnapshot snapshot() {
    return snapshot;
  }

  public synchronized void replace(LedgerSnapshot next) {
    snapshot = next;
  }
}
