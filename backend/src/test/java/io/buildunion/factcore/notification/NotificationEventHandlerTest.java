package io.buildunion.factcore.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.buildunion.factcore.event.PendingChangeCreatedEvent;
import io.buildunion.factcore.integration.email.EmailTemplateData;
import io.buildunion.factcore.integration.email.NotificationEmailService;
import io.buildunion.factcore.pendingchange.PendingChangeStatus;
import io.buildunion.factcore.pendingchange.PendingChangeView;
import io.buildunion.factcore.pendingchange.PendingItemType;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationEventHandlerTest {

  private static final UUID OWNER_ID = UUID.randomUUID();

  @Mock private NotificationService notificationService;
  @Mock private NotificationEmailService notificationEmailService;
  @InjectMocks private NotificationEventHandler handler;

  @Test
  void ownerIsEmailedForNewArrival() {
    var event = event();
    when(notificationService.handlePendingChangeCreated(event))
        .thenReturn(
            Optional.of(
                new Notification(
                    OWNER_ID, "PENDING_CHANGE_CREATED", "t", null, "PENDING_CHANGE", null, null)));

    handler.onPendingChangeCreated(event);

    var template = ArgumentCaptor.forClass(EmailTemplateData.class);
    verify(notificationEmailService).send(any(), template.capture());
    assertThat(template.getValue().variables())
        .containsEntry("item", "Drywall")
        .containsEntry("reason", "Extra wall");
  }

  @Test
  void noEmailWhenAlreadyNotified() {
    var event = event();
    when(notificationService.handlePendingChangeCreated(event)).thenReturn(Optional.empty());

    handler.onPendingChangeCreated(event);

    verify(notificationEmailService, never()).send(anyList(), any());
  }

  @Test
  void notificationFailureIsContained() {
    var event = event();
    when(notificationService.handlePendingChangeCreated(event))
        .thenThrow(new IllegalStateException("db down"));

    handler.onPendingChangeCreated(event);

    verify(notificationEmailService, never()).send(anyList(), any());
  }

  private static PendingChangeCreatedEvent event() {
    var change =
        new PendingChangeView(
            UUID.randomUUID(),
            UUID.randomUUID(),
            PendingItemType.MATERIAL,
            "drywall",
            "Drywall",
            new BigDecimal("40"),
            new BigDecimal("55"),
            "Extra wall",
            UUID.randomUUID(),
            PendingChangeStatus.PENDING,
            null,
            Instant.now(),
            null,
            null);
    return new PendingChangeCreatedEvent(
        "pending_change.created",
        "pending_change",
        change.id(),
        change.projectId(),
        change.requestedBy(),
        Instant.now(),
        Map.of(),
        change,
        OWNER_ID,
        "owner@example.com");
  }
}
