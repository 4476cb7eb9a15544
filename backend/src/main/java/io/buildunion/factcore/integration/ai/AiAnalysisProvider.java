package io.buildunion.factcore.integration.ai;

/** Port for the external project analysis service. */
public interface AiAnalysisProvider {

  /** Provider identifier (e.g., "gateway", "noop"). */
  String providerId();

  /** Runs one analysis. May block for as long as the upstream service takes. */
  AnalysisInsight invoke(AnalysisRequest request);
}
