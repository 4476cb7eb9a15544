package io.buildunion.factcore.citation.health;

/** Score bands, checked from the highest floor down. */
public enum HealthStatus {
  EXCELLENT("Excellent", 90),
  GOOD("Good", 70),
  NEEDS_ATTENTION("Needs Attention", 40),
  CRITICAL("Critical", 0);

  private final String label;
  private final int floor;

  HealthStatus(String label, int floor) {
    this.label = label;
    this.floor = floor;
  }

  public String label() {
    return label;
  }

  public static HealthStatus of(int score) {
    for (var status : values()) {
      if (score >= status.floor) {
        return status;
      }
    }
    return CRITICAL;
  }
}
