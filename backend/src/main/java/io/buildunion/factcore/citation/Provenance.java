package io.buildunion.factcore.citation;

/** Origin marker of a citation, serialized with its wire value. */
public enum Provenance {
  USER_INPUT("user_input"),
  SYNTHETIC("synthetic"),
  LEGACY_MIGRATED("legacy_migrated");

  private final String wireValue;

  Provenance(String wireValue) {
    this.wireValue = wireValue;
  }

  public String wireValue() {
    return wireValue;
  }

  /** Unknown or missing values are treated as user input. */
  public static Provenance fromWire(Object value) {
    if (value != null) {
      for (var provenance : values()) {
        if (provenance.wireValue.equals(value.toString())) {
          return provenance;
        }
      }
    }
    return USER_INPUT;
  }
}
