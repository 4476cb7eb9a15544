package io.buildunion.factcore.citation.conflict;

import io.buildunion.factcore.citation.Citation;
import java.util.Collection;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Figures one analysis source reports in its citation metadata. Unknown or unparseable figures are
 * null.
 */
public record SourceEstimate(Double area, Double total, Integer materialCount) {

  private static final Logger log = LoggerFactory.getLogger(SourceEstimate.class);

  static final SourceEstimate NONE = new SourceEstimate(null, null, null);

  public static SourceEstimate from(Citation citation) {
    var metadata = citation.metadata();
    return new SourceEstimate(
        number(metadata, "area", "detected_area"),
        number(metadata, "total", "estimated_cost"),
        materialCount(metadata));
  }

  private static Double number(Map<String, Object> metadata, String key, String fallbackKey) {
    Object raw = metadata.get(key) != null ? metadata.get(key) : metadata.get(fallbackKey);
    if (raw instanceof Number number) {
      return number.doubleValue();
    }
    if (raw instanceof String text && !text.isBlank()) {
      try {
        return Double.parseDouble(text.trim());
      } catch (NumberFormatException e) {
        log.debug("Ignoring unparseable estimate figure {}={}", key, text);
      }
    }
    return null;
  }

  private static Integer materialCount(Map<String, Object> metadata) {
    if (metadata.get("materials") instanceof Collection<?> materials) {
      return materials.size();
    }
    Double count = number(metadata, "material_count", "materials_count");
    return count != null ? count.intValue() : null;
  }
}
