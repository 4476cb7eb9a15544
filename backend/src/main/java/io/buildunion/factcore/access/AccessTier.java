package io.buildunion.factcore.access;

/** Ordered visibility level: PUBLIC &lt; WORKER &lt; FOREMAN &lt; OWNER. */
public enum AccessTier {
  PUBLIC(1),
  WORKER(2),
  FOREMAN(3),
  OWNER(4);

  private final int rank;

  AccessTier(int rank) {
    this.rank = rank;
  }

  public int rank() {
    return rank;
  }

  public boolean covers(AccessTier required) {
    return rank >= required.rank;
  }
}
