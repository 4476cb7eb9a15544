package io.buildunion.factcore.citation.synthesis;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/** Display labels for trade / work-type keys. */
public final class WorkTypeLabels {

  private static final Map<String, String> LABELS =
      Map.ofEntries(
          Map.entry("new_construction", "New Construction"),
          Map.entry("renovation", "Renovation"),
          Map.entry("addition", "Addition"),
          Map.entry("repair", "Repair"),
          Map.entry("demolition", "Demolition"),
          Map.entry("interior_finishing", "Interior Finishing"),
          Map.entry("exterior_finishing", "Exterior Finishing"),
          Map.entry("landscaping", "Landscaping"),
          Map.entry("electrical", "Electrical Work"),
          Map.entry("plumbing", "Plumbing"),
          Map.entry("hvac", "HVAC"),
          Map.entry("roofing", "Roofing"),
          Map.entry("foundation", "Foundation Work"),
          Map.entry("other", "Other"));

  private WorkTypeLabels() {}

  /** Known keys use their fixed label; anything else is title-cased word by word. */
  public static String label(String key) {
    if (key == null || key.isBlank()) {
      return "";
    }
    String normalized = key.trim().toLowerCase(Locale.ROOT);
    String known = LABELS.get(normalized);
    if (known != null) {
      return known;
    }
    return Arrays.stream(normalized.split("[_\\-\\s]+"))
        .filter(word -> !word.isEmpty())
        .map(word -> Character.toUpperCase(word.charAt(0)) + word.substring(1))
        .collect(Collectors.joining(" "));
  }
}
