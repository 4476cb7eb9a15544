package io.buildunion.factcore.notification;

import io.buildunion.factcore.event.PendingChangeCreatedEvent;
import io.buildunion.factcore.event.PendingChangeResolvedEvent;
import io.buildunion.factcore.integration.email.EmailTemplateData;
import io.buildunion.factcore.integration.email.NotificationEmailService;
import java.util.LinkedHashMap;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Creates notifications for committed pending change events. The owner email goes out only when
 * the in-app notification was newly created, so each arrival is announced once.
 */
@Component
public class NotificationEventHandler {

  private static final Logger log = LoggerFactory.getLogger(NotificationEventHandler.class);

  private final NotificationService notificationService;
  private final NotificationEmailService notificationEmailService;

  public NotificationEventHandler(
      NotificationService notificationService, NotificationEmailService notificationEmailService) {
    this.notificationService = notificationService;
    this.notificationEmailService = notificationEmailService;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onPendingChangeCreated(PendingChangeCreatedEvent event) {
    try {
      var created = notificationService.handlePendingChangeCreated(event);
      if (created.isPresent() && event.ownerEmail() != null) {
        var change = event.change();
        var variables = new LinkedHashMap<String, Object>();
        variables.put("item", change.itemName());
        variables.put("originalQuantity", change.originalQuantity());
        variables.put("newQuantity", change.newQuantity());
        if (change.changeReason() != null) {
          variables.put("reason", change.changeReason());
        }
        notificationEmailService.send(
            List.of(event.ownerEmail()),
            new EmailTemplateData(
                "pending-change-created", "New change request awaiting approval", variables));
      }
    } catch (Exception e) {
      log.warn(
          "Failed to create notifications for pending_change.created event={}",
          event.entityId(),
          e);
    }
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onPendingChangeResolved(PendingChangeResolvedEvent event) {
    try {
      notificationService.handlePendingChangeResolved(event);
    } catch (Exception e) {
      log.warn(
          "Failed to create notifications for {} event={}", event.eventType(), event.entityId(), e);
    }
  }
}
