package io.buildunion.factcore.projectload;

import static org.assertj.core.api.Assertions.assertThat;

import io.buildunion.factcore.pendingchange.PendingChangeStatus;
import io.buildunion.factcore.pendingchange.PendingChangeView;
import io.buildunion.factcore.pendingchange.PendingItemType;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class PendingChangeMirrorTest {

  private static final UUID PROJECT_ID = UUID.randomUUID();

  @Test
  void arrivalIsReportedOnceDespiteRedelivery() {
    var mirror = new PendingChangeMirror(List.of());
    var change = view(UUID.randomUUID(), PendingChangeStatus.PENDING, Instant.now());

    assertThat(mirror.apply(change)).isTrue();
    assertThat(mirror.apply(change)).isFalse();
    assertThat(mirror.drainArrivals()).containsExactly(change);
    assertThat(mirror.drainArrivals()).isEmpty();
    assertThat(mirror.all()).hasSize(1);
  }

  @Test
  void changesPresentAtLoadAreNotArrivals() {
    var existing = view(UUID.randomUUID(), PendingChangeStatus.PENDING, Instant.now());
    var mirror = new PendingChangeMirror(List.of(existing));

    assertThat(mirror.apply(existing)).isFalse();
    assertThat(mirror.drainArrivals()).isEmpty();
    assertThat(mirror.pending()).containsExactly(existing);
  }

  @Test
  void resolutionReplacesEntryAndClearsUnacknowledgedArrival() {
    var id = UUID.randomUUID();
    var created = Instant.now();
    var mirror = new PendingChangeMirror(List.of());
    mirror.apply(view(id, PendingChangeStatus.PENDING, created));

    assertThat(mirror.apply(view(id, PendingChangeStatus.CANCELLED, created))).isFalse();

    assertThat(mirror.drainArrivals()).isEmpty();
    assertThat(mirror.pending()).isEmpty();
    assertThat(mirror.all())
        .singleElement()
        .extracting(PendingChangeView::status)
        .isEqualTo(PendingChangeStatus.CANCELLED);
  }

  @Test
  void allIsNewestFirst() {
    var older =
        view(UUID.randomUUID(), PendingChangeStatus.PENDING, Instant.now().minusSeconds(60));
    var newer = view(UUID.randomUUID(), PendingChangeStatus.APPROVED, Instant.now());
    var mirror = new PendingChangeMirror(List.of(older, newer));

    assertThat(mirror.all()).containsExactly(newer, older);
  }

  private static PendingChangeView view(UUID id, PendingChangeStatus status, Instant createdAt) {
    return new PendingChangeView(
        id,
        PROJECT_ID,
        PendingItemType.MATERIAL,
        "drywall",
        "Drywall",
        BigDecimal.TEN,
        new BigDecimal("12"),
        null,
        UUID.randomUUID(),
        status,
        null,
        createdAt,
        null,
        null);
  }
}
