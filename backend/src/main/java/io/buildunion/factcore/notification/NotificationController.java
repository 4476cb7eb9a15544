package io.buildunion.factcore.notification;

import io.buildunion.factcore.context.RequestScopes;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class NotificationController {

  private final NotificationService notificationService;

  public NotificationController(NotificationService notificationService) {
    this.notificationService = notificationService;
  }

  @GetMapping("/api/notifications")
  public ResponseEntity<List<NotificationResponse>> listNotifications() {
    UUID memberId = RequestScopes.requireMemberId();
    return ResponseEntity.ok(
        notificationService.listNotifications(memberId).stream()
            .map(NotificationResponse::from)
            .toList());
  }

  @PutMapping("/api/notifications/{id}/read")
  public ResponseEntity<Void> markAsRead(@PathVariable UUID id) {
    UUID memberId = RequestScopes.requireMemberId();
    notificationService.markAsRead(id, memberId);
    return ResponseEntity.noContent().build();
  }

  public record NotificationResponse(
      UUID id,
      String type,
      String title,
      String body,
      String referenceEntityType,
      UUID referenceEntityId,
      UUID referenceProjectId,
      boolean isRead,
      Instant createdAt) {

    public static NotificationResponse from(Notification notification) {
      return new NotificationResponse(
          notification.getId(),
          notification.getType(),
          notification.getTitle(),
          notification.getBody(),
          notification.getReferenceEntityType(),
          notification.getReferenceEntityId(),
          notification.getReferenceProjectId(),
          notification.isRead(),
          notification.getCreatedAt());
    }
  }
}
