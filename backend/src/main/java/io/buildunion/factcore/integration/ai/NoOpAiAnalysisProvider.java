package io.buildunion.factcore.integration.ai;

import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class NoOpAiAnalysisProvider implements AiAnalysisProvider {

  private static final Logger log = LoggerFactory.getLogger(NoOpAiAnalysisProvider.class);

  @Override
  public String providerId() {
    return "noop";
  }

  @Override
  public AnalysisInsight invoke(AnalysisRequest request) {
    log.info(
        "NoOp AI: would run {} analysis for project {} at tier {}",
        request.analysisType(),
        request.projectId(),
        request.tier());
    return new AnalysisInsight(true, Map.of(), List.of(), false, null);
  }
}
