package io.buildunion.factcore.integration.ai;

import java.util.List;
import java.util.Map;

/**
 * Structured analysis result. {@code degraded} is set when only one of the analysis engines
 * answered; the payload is still usable.
 */
public record AnalysisInsight(
    boolean success,
    Map<String, Object> payload,
    List<String> engines,
    boolean degraded,
    String errorMessage) {

  public AnalysisInsight {
    payload = payload != null ? payload : Map.of();
    engines = engines != null ? List.copyOf(engines) : List.of();
  }
}
