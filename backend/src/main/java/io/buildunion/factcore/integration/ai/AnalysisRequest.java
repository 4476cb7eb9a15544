package io.buildunion.factcore.integration.ai;

import io.buildunion.factcore.access.AccessTier;
import java.util.UUID;

public record AnalysisRequest(UUID projectId, String analysisType, AccessTier tier) {}
