package io.buildunion.factcore.pendingchange;

import io.buildunion.factcore.access.AccessTierResolver;
import io.buildunion.factcore.access.ProjectAccessService;
import io.buildunion.factcore.event.PendingChangeCreatedEvent;
import io.buildunion.factcore.event.PendingChangeResolvedEvent;
import io.buildunion.factcore.exception.ForbiddenException;
import io.buildunion.factcore.exception.ResourceConflictException;
import io.buildunion.factcore.exception.ResourceNotFoundException;
import io.buildunion.factcore.project.ProjectRepository;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Two-actor approval of quantity edits. Foremen and subcontractors propose, the owner approves or
 * rejects, and the requester may withdraw while the change is still pending. At most one change per
 * item can be pending at a time.
 */
@Service
public class PendingChangeService {

  private static final Logger log = LoggerFactory.getLogger(PendingChangeService.class);

  static final String ENTITY_TYPE = "pending_change";

  private final PendingChangeRepository pendingChangeRepository;
  private final ProjectRepository projectRepository;
  private final ProjectAccessService projectAccessService;
  private final ApplicationEventPublisher eventPublisher;

  public PendingChangeService(
      PendingChangeRepository pendingChangeRepository,
      ProjectRepository projectRepository,
      ProjectAccessService projectAccessService,
      ApplicationEventPublisher eventPublisher) {
    this.pendingChangeRepository = pendingChangeRepository;
    this.projectRepository = projectRepository;
    this.projectAccessService = projectAccessService;
    this.eventPublisher = eventPublisher;
  }

  @Transactional
  public PendingChangeView create(
      UUID projectId,
      PendingItemType itemType,
      String itemId,
      String itemName,
      BigDecimal originalQuantity,
      BigDecimal newQuantity,
      String changeReason,
      UUID requesterId) {
    var project =
        projectRepository
            .findById(projectId)
            .orElseThrow(() -> new ResourceNotFoundException("Project", projectId));
    var access = projectAccessService.resolve(project, requesterId);
    if (!AccessTierResolver.canRequestChange(access.role())) {
      throw new ForbiddenException(
          "Cannot request change",
          "Only foremen and subcontractors can propose quantity changes");
    }
    if (pendingChangeRepository.existsPending(projectId, itemType, itemId)) {
      throw singleFlightConflict(itemType, itemId);
    }

    PendingChange saved;
    try {
      saved =
          pendingChangeRepository.saveAndFlush(
              new PendingChange(
                  projectId,
                  itemType,
                  itemId,
                  itemName,
                  originalQuantity,
                  newQuantity,
                  changeReason,
                  requesterId));
    } catch (DataIntegrityViolationException e) {
      // a concurrent request won the partial unique index
      throw singleFlightConflict(itemType, itemId);
    }

    var view = PendingChangeView.from(saved);
    log.info(
        "Pending change {} created for {} {} in project {} by {}",
        saved.getId(),
        itemType,
        itemId,
        projectId,
        requesterId);
    eventPublisher.publishEvent(
        new PendingChangeCreatedEvent(
            "pending_change.created",
            ENTITY_TYPE,
            saved.getId(),
            projectId,
            requesterId,
            Instant.now(),
            details(view),
            view,
            project.getOwnerId(),
            project.getOwnerEmail()));
    return view;
  }

  /** Owner approval. Returns the quantity the caller must apply to the item. */
  @Transactional
  public ApprovalOutcome approve(UUID projectId, UUID changeId, UUID ownerId, String notes) {
    projectAccessService.requireOwner(projectId, ownerId);
    var change = requireChange(projectId, changeId);
    change.approve(ownerId, notes);
    var view = resolved(change, ownerId, "pending_change.approved");
    return new ApprovalOutcome(view, change.getNewQuantity());
  }

  @Transactional
  public PendingChangeView reject(UUID projectId, UUID changeId, UUID ownerId, String notes) {
    projectAccessService.requireOwner(projectId, ownerId);
    var change = requireChange(projectId, changeId);
    change.reject(ownerId, notes);
    return resolved(change, ownerId, "pending_change.rejected");
  }

  @Transactional
  public PendingChangeView cancel(UUID projectId, UUID changeId, UUID requesterId) {
    var change = requireChange(projectId, changeId);
    if (!change.isRequestedBy(requesterId)) {
      throw new ForbiddenException(
          "Cannot cancel change", "Only the requester can cancel a pending change");
    }
    change.cancel(requesterId);
    return resolved(change, requesterId, "pending_change.cancelled");
  }

  /** The owner sees every change of the project; anyone else sees their own requests. */
  @Transactional(readOnly = true)
  public List<PendingChangeView> list(UUID projectId, UUID memberId) {
    var access = projectAccessService.resolve(projectId, memberId);
    var changes =
        access.isOwner()
            ? pendingChangeRepository.findByProjectId(projectId)
            : pendingChangeRepository.findByProjectIdAndRequestedBy(projectId, memberId);
    return changes.stream().map(PendingChangeView::from).toList();
  }

  private PendingChange requireChange(UUID projectId, UUID changeId) {
    return pendingChangeRepository
        .findById(changeId)
        .filter(change -> change.getProjectId().equals(projectId))
        .orElseThrow(() -> new ResourceNotFoundException("PendingChange", changeId));
  }

  private PendingChangeView resolved(PendingChange change, UUID actorId, String eventType) {
    var saved = pendingChangeRepository.save(change);
    var view = PendingChangeView.from(saved);
    log.info(
        "Pending change {} for {} {} is now {} (by {})",
        saved.getId(),
        saved.getItemType(),
        saved.getItemId(),
        saved.getStatus(),
        actorId);
    eventPublisher.publishEvent(
        new PendingChangeResolvedEvent(
            eventType,
            ENTITY_TYPE,
            saved.getId(),
            saved.getProjectId(),
            actorId,
            Instant.now(),
            details(view),
            view));
    return view;
  }

  private static Map<String, Object> details(PendingChangeView view) {
    return Map.of(
        "item_type", view.itemType().name(),
        "item_id", view.itemId(),
        "item_name", view.itemName(),
        "status", view.status().name());
  }

  private static ResourceConflictException singleFlightConflict(
      PendingItemType itemType, String itemId) {
    return ResourceConflictException.alreadyPending(itemType.name(), itemId);
  }
}
