package io.buildunion.factcore.integration.ai;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.buildunion.factcore.access.AccessTier;
import io.buildunion.factcore.access.AccessTierResolver;
import io.buildunion.factcore.access.ProjectAccess;
import io.buildunion.factcore.access.ProjectAccessService;
import io.buildunion.factcore.exception.ExternalServiceDegradedException;
import io.buildunion.factcore.exception.ForbiddenException;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.ResourceAccessException;

@ExtendWith(MockitoExtension.class)
class AiAnalysisServiceTest {

  private static final UUID PROJECT_ID = UUID.randomUUID();
  private static final UUID MEMBER_ID = UUID.randomUUID();

  @Mock private AiAnalysisProvider aiAnalysisProvider;
  @Mock private ProjectAccessService projectAccessService;
  @InjectMocks private AiAnalysisService service;

  @BeforeEach
  void setUp() {
    lenient().when(aiAnalysisProvider.providerId()).thenReturn("gateway");
  }

  @Test
  void degradedResultIsReturned() {
    grant("foreman");
    var insight =
        new AnalysisInsight(true, Map.of("risk", "low"), List.of("primary"), true, null);
    when(aiAnalysisProvider.invoke(new AnalysisRequest(PROJECT_ID, "risk", AccessTier.FOREMAN)))
        .thenReturn(insight);

    assertThat(service.analyze(PROJECT_ID, "risk", MEMBER_ID)).isSameAs(insight);
  }

  @Test
  void workerIsRefused() {
    grant("worker");

    assertThatThrownBy(() -> service.analyze(PROJECT_ID, "risk", MEMBER_ID))
        .isInstanceOf(ForbiddenException.class);
    verify(aiAnalysisProvider, never()).invoke(any());
  }

  @Test
  void providerTimeoutIsReportedAsDegradedService() {
    grant("owner");
    when(aiAnalysisProvider.invoke(any())).thenThrow(new ResourceAccessException("timed out"));

    assertThatThrownBy(() -> service.analyze(PROJECT_ID, "risk", MEMBER_ID))
        .isInstanceOf(ExternalServiceDegradedException.class)
        .hasCauseInstanceOf(ResourceAccessException.class);
  }

  @Test
  void unsuccessfulInsightIsReportedAsDegradedService() {
    grant("owner");
    when(aiAnalysisProvider.invoke(any()))
        .thenReturn(new AnalysisInsight(false, null, null, false, "both engines failed"));

    assertThatThrownBy(() -> service.analyze(PROJECT_ID, "risk", MEMBER_ID))
        .isInstanceOf(ExternalServiceDegradedException.class);
  }

  private void grant(String role) {
    when(projectAccessService.resolve(PROJECT_ID, MEMBER_ID))
        .thenReturn(
            new ProjectAccess(
                PROJECT_ID, MEMBER_ID, role, AccessTierResolver.tierOf(role), false));
  }
}
