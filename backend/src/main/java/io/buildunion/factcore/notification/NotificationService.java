package io.buildunion.factcore.notification;

import io.buildunion.factcore.event.PendingChangeCreatedEvent;
import io.buildunion.factcore.event.PendingChangeResolvedEvent;
import io.buildunion.factcore.exception.ResourceNotFoundException;
import io.buildunion.factcore.pendingchange.PendingChangeStatus;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * In-app notifications for the pending change workflow. Each notification is keyed by recipient,
 * type and change id, so a redelivered event never notifies twice.
 */
@Service
public class NotificationService {

  private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

  static final String PENDING_CHANGE_CREATED = "PENDING_CHANGE_CREATED";
  static final String PENDING_CHANGE_RESOLVED = "PENDING_CHANGE_RESOLVED";
  static final String REFERENCE_TYPE = "PENDING_CHANGE";

  private final NotificationRepository notificationRepository;

  public NotificationService(NotificationRepository notificationRepository) {
    this.notificationRepository = notificationRepository;
  }

  /** Notifies the project owner of a new pending change. Empty if already notified. */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public Optional<Notification> handlePendingChangeCreated(PendingChangeCreatedEvent event) {
    var change = event.change();
    if (event.ownerMemberId() == null) {
      return Optional.empty();
    }
    return createOnce(
        event.ownerMemberId(),
        PENDING_CHANGE_CREATED,
        "New change request for " + change.itemName(),
        "Quantity change from "
            + change.originalQuantity()
            + " to "
            + change.newQuantity()
            + (change.changeReason() != null ? ": " + change.changeReason() : ""),
        change.id(),
        change.projectId());
  }

  /** Tells the requester how the owner decided. Cancellations by the requester are not echoed. */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public Optional<Notification> handlePendingChangeResolved(PendingChangeResolvedEvent event) {
    var change = event.change();
    if (change.status() == PendingChangeStatus.CANCELLED) {
      return Optional.empty();
    }
    String outcome = change.status().name().toLowerCase(Locale.ROOT);
    return createOnce(
        change.requestedBy(),
        PENDING_CHANGE_RESOLVED,
        "Change request for " + change.itemName() + " " + outcome,
        change.reviewNotes(),
        change.id(),
        change.projectId());
  }

  @Transactional(readOnly = true)
  public List<Notification> listNotifications(UUID memberId) {
    return notificationRepository.findByRecipientMemberId(memberId);
  }

  @Transactional
  public void markAsRead(UUID notificationId, UUID memberId) {
    var notification =
        notificationRepository
            .findById(notificationId)
            .filter(n -> n.getRecipientMemberId().equals(memberId))
            .orElseThrow(() -> new ResourceNotFoundException("Notification", notificationId));
    notification.markAsRead();
  }

  private Optional<Notification> createOnce(
      UUID recipient, String type, String title, String body, UUID changeId, UUID projectId) {
    if (notificationRepository.existsByRecipientMemberIdAndTypeAndReferenceEntityId(
        recipient, type, changeId)) {
      log.debug("Notification {} for change {} already exists", type, changeId);
      return Optional.empty();
    }
    try {
      return Optional.of(
          notificationRepository.saveAndFlush(
              new Notification(recipient, type, title, body, REFERENCE_TYPE, changeId, projectId)));
    } catch (DataIntegrityViolationException e) {
      log.debug("Notification {} for change {} created concurrently", type, changeId);
      return Optional.empty();
    }
  }
}
