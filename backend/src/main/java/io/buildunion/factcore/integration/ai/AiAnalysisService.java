package io.buildunion.factcore.integration.ai;

import io.buildunion.factcore.access.AccessTier;
import io.buildunion.factcore.access.ProjectAccessService;
import io.buildunion.factcore.exception.ExternalServiceDegradedException;
import io.buildunion.factcore.exception.ForbiddenException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class AiAnalysisService {

  private static final Logger log = LoggerFactory.getLogger(AiAnalysisService.class);

  private final AiAnalysisProvider aiAnalysisProvider;
  private final ProjectAccessService projectAccessService;

  public AiAnalysisService(
      AiAnalysisProvider aiAnalysisProvider, ProjectAccessService projectAccessService) {
    this.aiAnalysisProvider = aiAnalysisProvider;
    this.projectAccessService = projectAccessService;
  }

  /**
   * Runs an analysis at the caller's tier. Degraded single-engine results are returned as they
   * are; a failed call is reported as a degraded external service and never touches the ledger.
   */
  public AnalysisInsight analyze(UUID projectId, String analysisType, UUID memberId) {
    var access = projectAccessService.resolve(projectId, memberId);
    if (!access.tier().covers(AccessTier.FOREMAN)) {
      throw new ForbiddenException(
          "Analysis not available", "Project analysis requires foreman access or higher");
    }

    AnalysisInsight insight;
    try {
      insight =
          aiAnalysisProvider.invoke(new AnalysisRequest(projectId, analysisType, access.tier()));
    } catch (RuntimeException e) {
      throw new ExternalServiceDegradedException(
          "AI analysis", "Analysis via " + aiAnalysisProvider.providerId() + " failed", e);
    }
    if (insight == null || !insight.success()) {
      throw new ExternalServiceDegradedException(
          "AI analysis",
          insight != null && insight.errorMessage() != null
              ? insight.errorMessage()
              : "Analysis returned no result",
          null);
    }
    if (insight.degraded()) {
      log.info(
          "Analysis {} for project {} degraded to engines {}",
          analysisType,
          projectId,
          insight.engines());
    }
    return insight;
  }
}
