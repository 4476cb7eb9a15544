package io.buildunion.factcore.pendingchange;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.buildunion.factcore.exception.InvalidStateException;
import java.math.BigDecimal;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class PendingChangeTest {

  private static final UUID REQUESTER = UUID.randomUUID();
  private static final UUID OWNER = UUID.randomUUID();

  @Test
  void approveRecordsResolution() {
    var change = change();

    change.approve(OWNER, "Looks right");

    assertThat(change.getStatus()).isEqualTo(PendingChangeStatus.APPROVED);
    assertThat(change.getResolvedBy()).isEqualTo(OWNER);
    assertThat(change.getResolvedAt()).isNotNull();
    assertThat(change.getReviewNotes()).isEqualTo("Looks right");
  }

  @Test
  void blankNotesAreNotStored() {
    var change = change();

    change.reject(OWNER, "  ");

    assertThat(change.getStatus()).isEqualTo(PendingChangeStatus.REJECTED);
    assertThat(change.getReviewNotes()).isNull();
  }

  @Test
  void terminalStateCannotBeLeft() {
    var change = change();
    change.cancel(REQUESTER);

    assertThatThrownBy(() -> change.approve(OWNER, null))
        .isInstanceOf(InvalidStateException.class);
    assertThatThrownBy(() -> change.reject(OWNER, null))
        .isInstanceOf(InvalidStateException.class);
    assertThat(change.getStatus()).isEqualTo(PendingChangeStatus.CANCELLED);
  }

  @Test
  void terminalStateProblemNamesCurrentStatus() {
    var change = change();
    change.approve(OWNER, null);

    assertThatThrownBy(() -> change.cancel(REQUESTER))
        .isInstanceOfSatisfying(
            InvalidStateException.class,
            ex -> {
              assertThat(ex.getBody().getDetail())
                  .isEqualTo("Cannot cancel pending change in status APPROVED");
              assertThat(ex.getBody().getProperties()).containsEntry("currentStatus", "APPROVED");
              assertThat(ex.getStatusCode().value()).isEqualTo(400);
            });
  }

  @ParameterizedTest
  @EnumSource(
      value = PendingChangeStatus.class,
      names = {"PENDING"},
      mode = EnumSource.Mode.EXCLUDE)
  void everyNonPendingStatusIsTerminal(PendingChangeStatus status) {
    assertThat(status.isTerminal()).isTrue();
    assertThat(status.allowedTransitions()).isEmpty();
    assertThat(PendingChangeStatus.PENDING.canTransitionTo(status)).isTrue();
  }

  private static PendingChange change() {
    return new PendingChange(
        UUID.randomUUID(),
        PendingItemType.MATERIAL,
        "drywall-1/2",
        "Drywall 1/2\"",
        new BigDecimal("40"),
        new BigDecimal("55"),
        "Extra wall in basement",
        REQUESTER);
  }
}
