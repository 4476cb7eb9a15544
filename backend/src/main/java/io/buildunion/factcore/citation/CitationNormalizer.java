package io.buildunion.factcore.citation;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Converts raw stored records, canonical or legacy-shaped, into {@link Citation}s. Total and order
 * preserving: every input record yields exactly one citation and no record is rejected.
 */
@Component
public class CitationNormalizer {

  private static final Logger log = LoggerFactory.getLogger(CitationNormalizer.class);

  static final String UNKNOWN_TYPE = "UNKNOWN";

  private static final Map<String, CiteType> LEGACY_KEYS =
      Map.ofEntries(
          Map.entry("gfa", CiteType.GFA_LOCK),
          Map.entry("gfa_value", CiteType.GFA_LOCK),
          Map.entry("project_gfa", CiteType.GFA_LOCK),
          Map.entry("project_address", CiteType.LOCATION),
          Map.entry("address", CiteType.LOCATION),
          Map.entry("location", CiteType.LOCATION),
          Map.entry("project_name", CiteType.PROJECT_NAME),
          Map.entry("name", CiteType.PROJECT_NAME),
          Map.entry("work_type", CiteType.WORK_TYPE),
          Map.entry("worktype", CiteType.WORK_TYPE),
          Map.entry("trade", CiteType.TRADE_SELECTION),
          Map.entry("trade_selection", CiteType.TRADE_SELECTION),
          Map.entry("start_date", CiteType.TIMELINE),
          Map.entry("timeline", CiteType.TIMELINE),
          Map.entry("end_date", CiteType.END_DATE),
          Map.entry("site_condition", CiteType.SITE_CONDITION),
          Map.entry("team_size", CiteType.TEAM_SIZE),
          Map.entry("budget", CiteType.BUDGET),
          Map.entry("total_budget", CiteType.BUDGET));

  // Wizard element types, consulted when the question key is not recognised.
  private static final Map<String, CiteType> ELEMENT_TYPES =
      Map.of(
          "project_label", CiteType.PROJECT_NAME,
          "map_location", CiteType.LOCATION,
          "template", CiteType.TEMPLATE_LOCK);

  public List<Citation> normalize(List<Map<String, Object>> records) {
    return normalize(records, Instant.now());
  }

  public List<Citation> normalize(List<Map<String, Object>> records, Instant loadedAt) {
    if (records == null) {
      return List.of();
    }
    var citations = new ArrayList<Citation>(records.size());
    for (int i = 0; i < records.size(); i++) {
      citations.add(toCitation(records.get(i), i, loadedAt));
    }
    return citations;
  }

  private Citation toCitation(Map<String, Object> raw, int index, Instant loadedAt) {
    Map<String, Object> record = raw != null ? raw : Map.of();
    String citeType = text(record, "cite_type", "citeType");
    boolean canonical = citeType != null && !citeType.isBlank();

    String questionKey = text(record, "question_key", "questionKey");
    if (!canonical) {
      citeType = legacyType(questionKey, text(record, "element_type", "elementType"));
    }

    String id = text(record, "id");
    if (id == null || id.isBlank()) {
      id = "legacy-" + (questionKey != null ? questionKey : "record") + "-" + index;
    }

    String answer = text(record, "answer");
    Object value = record.containsKey("value") ? record.get("value") : answer;
    Provenance provenance =
        canonical ? Provenance.fromWire(record.get("provenance")) : Provenance.LEGACY_MIGRATED;

    return new Citation(
        id,
        citeType,
        questionKey,
        answer,
        value,
        metadata(record.get("metadata")),
        timestamp(record.get("timestamp"), loadedAt),
        provenance);
  }

  static String legacyType(String questionKey, String elementType) {
    String key = questionKey != null ? questionKey.trim().toLowerCase(Locale.ROOT) : "";
    CiteType mapped = LEGACY_KEYS.get(key);
    if (mapped == null && elementType != null) {
      mapped = ELEMENT_TYPES.get(elementType.trim().toLowerCase(Locale.ROOT));
    }
    if (mapped != null) {
      return mapped.name();
    }
    String tag = key.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]+", "_");
    tag = tag.replaceAll("^_+|_+$", "");
    return tag.isEmpty() ? UNKNOWN_TYPE : tag;
  }

  private static String text(Map<String, Object> record, String... keys) {
    for (String key : keys) {
      Object raw = record.get(key);
      if (raw != null) {
        return raw.toString();
      }
    }
    return null;
  }

  private static Map<String, Object> metadata(Object raw) {
    if (raw instanceof Map<?, ?> map) {
      var copy = new LinkedHashMap<String, Object>();
      map.forEach((k, v) -> copy.put(String.valueOf(k), v));
      return copy;
    }
    return Map.of();
  }

  private static Instant timestamp(Object raw, Instant fallback) {
    if (raw instanceof Instant instant) {
      return instant;
    }
    if (raw instanceof Number epochMillis) {
      return Instant.ofEpochMilli(epochMillis.longValue());
    }
    if (raw != null) {
      try {
        return Instant.parse(raw.toString());
      } catch (DateTimeParseException e) {
        log.debug("Unparseable citation timestamp '{}', using load time", raw);
      }
    }
    return fallback;
  }
}
