package io.buildunion.factcore.pendingchange;

import io.buildunion.factcore.context.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class PendingChangeController {

  private final PendingChangeService pendingChangeService;

  public PendingChangeController(PendingChangeService pendingChangeService) {
    this.pendingChangeService = pendingChangeService;
  }

  @GetMapping("/api/projects/{projectId}/pending-changes")
  public ResponseEntity<List<PendingChangeView>> listPendingChanges(@PathVariable UUID projectId) {
    UUID memberId = RequestScopes.requireMemberId();
    return ResponseEntity.ok(pendingChangeService.list(projectId, memberId));
  }

  @PostMapping("/api/projects/{projectId}/pending-changes")
  public ResponseEntity<PendingChangeView> createPendingChange(
      @PathVariable UUID projectId, @Valid @RequestBody CreatePendingChangeRequest request) {
    UUID memberId = RequestScopes.requireMemberId();
    var change =
        pendingChangeService.create(
            projectId,
            request.itemType(),
            request.itemId(),
            request.itemName(),
            request.originalQuantity(),
            request.newQuantity(),
            request.changeReason(),
            memberId);
    return ResponseEntity.created(
            URI.create("/api/projects/" + projectId + "/pending-changes/" + change.id()))
        .body(change);
  }

  @PostMapping("/api/projects/{projectId}/pending-changes/{changeId}/approve")
  public ResponseEntity<ApprovalOutcome> approvePendingChange(
      @PathVariable UUID projectId,
      @PathVariable UUID changeId,
      @Valid @RequestBody(required = false) ReviewRequest request) {
    UUID memberId = RequestScopes.requireMemberId();
    return ResponseEntity.ok(
        pendingChangeService.approve(projectId, changeId, memberId, notes(request)));
  }

  @PostMapping("/api/projects/{projectId}/pending-changes/{changeId}/reject")
  public ResponseEntity<PendingChangeView> rejectPendingChange(
      @PathVariable UUID projectId,
      @PathVariable UUID changeId,
      @Valid @RequestBody(required = false) ReviewRequest request) {
    UUID memberId = RequestScopes.requireMemberId();
    return ResponseEntity.ok(
        pendingChangeService.reject(projectId, changeId, memberId, notes(request)));
  }

  @PostMapping("/api/projects/{projectId}/pending-changes/{changeId}/cancel")
  public ResponseEntity<PendingChangeView> cancelPendingChange(
      @PathVariable UUID projectId, @PathVariable UUID changeId) {
    UUID memberId = RequestScopes.requireMemberId();
    return ResponseEntity.ok(pendingChangeService.cancel(projectId, changeId, memberId));
  }

  private static String notes(ReviewRequest request) {
    return request != null ? request.reviewNotes() : null;
  }

  // --- DTOs ---

  public record CreatePendingChangeRequest(
      @NotNull(message = "itemType is required") PendingItemType itemType,
      @NotBlank(message = "itemId is required") @Size(max = 255) String itemId,
      @NotBlank(message = "itemName is required") @Size(max = 255) String itemName,
      BigDecimal originalQuantity,
      @NotNull(message = "newQuantity is required") BigDecimal newQuantity,
      @Size(max = 2000) String changeReason) {}

  public record ReviewRequest(@Size(max = 2000) String reviewNotes) {}
}
