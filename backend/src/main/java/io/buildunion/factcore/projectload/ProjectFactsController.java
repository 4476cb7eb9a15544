package io.buildunion.factcore.projectload;

import io.buildunion.factcore.context.RequestScopes;
import io.buildunion.factcore.pendingchange.PendingChangeView;
import io.buildunion.factcore.project.ProjectService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ProjectFactsController {

  private final ProjectLoadService projectLoadService;
  private final CitationEditService citationEditService;
  private final ProjectService projectService;

  public ProjectFactsController(
      ProjectLoadService projectLoadService,
      CitationEditService citationEditService,
      ProjectService projectService) {
    this.projectLoadService = projectLoadService;
    this.citationEditService = citationEditService;
    this.projectService = projectService;
  }

  @PostMapping("/api/projects/{projectId}/facts/load")
  public ResponseEntity<ProjectFactsView> loadFacts(@PathVariable UUID projectId) {
    UUID memberId = RequestScopes.requireMemberId();
    return ResponseEntity.ok(projectLoadService.load(projectId, memberId));
  }

  @GetMapping("/api/facts/sessions/{sessionId}")
  public ResponseEntity<ProjectFactsView> getSession(@PathVariable UUID sessionId) {
    UUID memberId = RequestScopes.requireMemberId();
    return ResponseEntity.ok(projectLoadService.view(sessionId, memberId));
  }

  @GetMapping("/api/facts/sessions/{sessionId}/sections")
  public ResponseEntity<SectionView> getSection(
      @PathVariable UUID sessionId, @RequestParam("key") String sectionKey) {
    UUID memberId = RequestScopes.requireMemberId();
    return ResponseEntity.ok(projectLoadService.section(sessionId, memberId, sectionKey));
  }

  @PostMapping("/api/facts/sessions/{sessionId}/arrivals")
  public ResponseEntity<List<PendingChangeView>> drainArrivals(@PathVariable UUID sessionId) {
    UUID memberId = RequestScopes.requireMemberId();
    return ResponseEntity.ok(projectLoadService.drainArrivals(sessionId, memberId));
  }

  @PutMapping("/api/projects/{projectId}/facts/{citationId}")
  public ResponseEntity<CitationView> saveCitation(
      @PathVariable UUID projectId,
      @PathVariable String citationId,
      @Valid @RequestBody SaveCitationRequest request) {
    UUID memberId = RequestScopes.requireMemberId();
    var edited =
        citationEditService.save(
            projectId, citationId, request.answer(), request.value(), memberId);
    return ResponseEntity.ok(CitationView.of(edited, FactsProjection.visibility(edited)));
  }

  @PutMapping("/api/projects/{projectId}/edit-mode")
  public ResponseEntity<EditModeResponse> setEditMode(
      @PathVariable UUID projectId, @Valid @RequestBody EditModeRequest request) {
    UUID memberId = RequestScopes.requireMemberId();
    var project = projectService.setEditMode(projectId, memberId, request.enabled());
    return ResponseEntity.ok(
        new EditModeResponse(project.getId(), project.isEditModeEnabled()));
  }

  // --- DTOs ---

  public record SaveCitationRequest(
      @NotNull(message = "answer is required") @Size(max = 5000) String answer, Object value) {}

  public record EditModeRequest(@NotNull(message = "enabled is required") Boolean enabled) {}

  public record EditModeResponse(UUID projectId, boolean editModeEnabled) {}
}
