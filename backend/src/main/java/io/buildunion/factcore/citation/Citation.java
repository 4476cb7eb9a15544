package io.buildunion.factcore.citation;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single attributed, typed piece of verified project data. {@code citeType} is the tag of a
 * {@link CiteType} for known facts, or an uppercased free-form tag for migrated legacy keys that
 * have no mapping. {@code value} is a string, a number or a structured map.
 */
public record Citation(
    String id,
    String citeType,
    String questionKey,
    String answer,
    Object value,
    Map<String, Object> metadata,
    Instant timestamp,
    Provenance provenance) {

  public Citation {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(citeType, "citeType");
    metadata =
        metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    provenance = provenance != null ? provenance : Provenance.USER_INPUT;
  }

  public boolean is(CiteType type) {
    return type.name().equals(citeType);
  }

  /** Returns the metadata entry as a string, or null when absent. */
  public String metadataString(String key) {
    Object raw = metadata.get(key);
    return raw != null ? raw.toString() : null;
  }

  /** Returns a copy carrying a user edit: same id, new answer and value, provenance user input. */
  public Citation withEdit(String newAnswer, Object newValue, Instant editedAt) {
    return new Citation(
        id,
        citeType,
        questionKey,
        newAnswer,
        newValue != null ? newValue : newAnswer,
        metadata,
        editedAt,
        Provenance.USER_INPUT);
  }

  /** Canonical serialized shape, as stored in the per-project facts collection. */
  public Map<String, Object> toRecord() {
    var record = new LinkedHashMap<String, Object>();
    record.put("id", id);
    record.put("cite_type", citeType);
    record.put("question_key", questionKey);
    record.put("answer", answer);
    record.put("value", value);
    record.put("metadata", new LinkedHashMap<>(metadata));
    record.put("timestamp", timestamp != null ? timestamp.toString() : null);
    record.put("provenance", provenance.wireValue());
    return record;
  }
}
