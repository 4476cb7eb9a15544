package io.buildunion.factcore.projectload;

import io.buildunion.factcore.access.AccessTier;
import io.buildunion.factcore.citation.Citation;
import java.time.Instant;
import java.util.Map;

/** A citation as returned to clients, with the tier badge of the lowest tier that can see it. */
public record CitationView(
    String id,
    String citeType,
    String questionKey,
    String answer,
    Object value,
    Map<String, Object> metadata,
    Instant timestamp,
    String provenance,
    AccessTier visibility) {

  static CitationView of(Citation citation, AccessTier visibility) {
    return new CitationView(
        citation.id(),
        citation.citeType(),
        citation.questionKey(),
        citation.answer(),
        citation.value(),
        citation.metadata(),
        citation.timestamp(),
        citation.provenance().wireValue(),
        visibility);
  }
}
