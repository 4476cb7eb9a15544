package io.buildunion.factcore.citation.synthesis;

import io.buildunion.factcore.citation.Citation;
import io.buildunion.factcore.citation.CiteType;
import io.buildunion.factcore.citation.Provenance;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/** Factory for synthesized citations. */
final class SyntheticCitations {

  private SyntheticCitations() {}

  /**
   * Builds a citation with provenance {@code synthetic}. The id embeds the dedup key and the
   * synthesis instant, e.g. {@code synth-contract-4f1c...-1717000000000}.
   */
  static Citation create(
      CiteType type,
      String dedupKey,
      String answer,
      Object value,
      Map<String, Object> metadata,
      Instant now) {
    var meta = new LinkedHashMap<String, Object>(metadata);
    meta.put("synthesized_at", now.toString());
    return new Citation(
        id(type, dedupKey, now),
        type.name(),
        type.name().toLowerCase(Locale.ROOT),
        answer,
        value,
        meta,
        now,
        Provenance.SYNTHETIC);
  }

  static String id(CiteType type, String dedupKey, Instant now) {
    String key = dedupKey.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9@.:-]+", "_");
    return "synth-"
        + type.name().toLowerCase(Locale.ROOT).replace('_', '-')
        + "-"
        + key
        + "-"
        + now.toEpochMilli();
  }
}
