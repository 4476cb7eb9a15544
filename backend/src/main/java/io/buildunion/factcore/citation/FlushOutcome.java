package io.buildunion.factcore.citation;

import java.util.List;

/**
 * Result of one background flush. {@code written} holds the citations that reached the store;
 * candidates found already persisted are silently dropped and counted in {@code skipped}.
 */
public record FlushOutcome(
    String rule, List<Citation> written, int skipped, int attempts, boolean failed) {

  static FlushOutcome failed(String rule, int attempts) {
    return new FlushOutcome(rule, List.of(), 0, attempts, true);
  }
}
