package io.buildunion.factcore.integration.ai;

import io.buildunion.factcore.context.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AiAnalysisController {

  private final AiAnalysisService aiAnalysisService;

  public AiAnalysisController(AiAnalysisService aiAnalysisService) {
    this.aiAnalysisService = aiAnalysisService;
  }

  @PostMapping("/api/projects/{projectId}/analysis")
  public ResponseEntity<AnalysisInsight> analyze(
      @PathVariable UUID projectId, @Valid @RequestBody AnalysisCommand request) {
    UUID memberId = RequestScopes.requireMemberId();
    return ResponseEntity.ok(
        aiAnalysisService.analyze(projectId, request.analysisType(), memberId));
  }

  public record AnalysisCommand(
      @NotBlank(message = "analysisType is required") @Size(max = 50) String analysisType) {}
}
