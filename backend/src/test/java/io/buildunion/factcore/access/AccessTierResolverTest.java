package io.buildunion.factcore.access;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

class AccessTierResolverTest {

  @ParameterizedTest
  @CsvSource({
    "owner, OWNER",
    "foreman, FOREMAN",
    "worker, WORKER",
    "inspector, WORKER",
    "subcontractor, WORKER",
    "member, PUBLIC",
    "Foreman, FOREMAN",
    "architect, PUBLIC"
  })
  void tierOfRole(String role, AccessTier expected) {
    assertThat(AccessTierResolver.tierOf(role)).isEqualTo(expected);
  }

  @Test
  void nullRoleIsPublic() {
    assertThat(AccessTierResolver.tierOf(null)).isEqualTo(AccessTier.PUBLIC);
    assertThat(AccessTierResolver.hasAccess(null, AccessTier.WORKER)).isFalse();
  }

  @ParameterizedTest
  @EnumSource(AccessTier.class)
  void tierChecksAreHierarchical(AccessTier required) {
    for (var role : new String[] {"owner", "foreman", "worker", "member"}) {
      var tier = AccessTierResolver.tierOf(role);
      assertThat(AccessTierResolver.hasAccess(role, required))
          .isEqualTo(tier.rank() >= required.rank());
    }
  }

  @Nested
  class Capabilities {

    private final UUID caller = UUID.randomUUID();

    @Test
    void ownerEditsOnlyInEditMode() {
      assertThat(AccessTierResolver.canEdit("owner", false)).isFalse();
      assertThat(AccessTierResolver.canEdit("owner", true)).isTrue();
    }

    @Test
    void foremanAlwaysEdits() {
      assertThat(AccessTierResolver.canEdit("foreman", false)).isTrue();
    }

    @Test
    void othersNeverEdit() {
      assertThat(AccessTierResolver.canEdit("worker", true)).isFalse();
      assertThat(AccessTierResolver.canEdit(null, true)).isFalse();
    }

    @Test
    void onlyOwnerSeesFinancials() {
      assertThat(AccessTierResolver.canViewFinancials("owner")).isTrue();
      assertThat(AccessTierResolver.canViewFinancials("foreman")).isFalse();
      assertThat(AccessTierResolver.canViewFinancials(null)).isFalse();
    }

    @Test
    void workerTogglesOnlyOwnTasks() {
      assertThat(AccessTierResolver.canToggleTask("worker", caller, caller)).isTrue();
      assertThat(AccessTierResolver.canToggleTask("worker", UUID.randomUUID(), caller)).isFalse();
      assertThat(AccessTierResolver.canToggleTask("worker", null, caller)).isFalse();
      assertThat(AccessTierResolver.canToggleTask("subcontractor", caller, caller)).isTrue();
    }

    @Test
    void ownerAndForemanToggleAnyTask() {
      assertThat(AccessTierResolver.canToggleTask("owner", null, caller)).isTrue();
      assertThat(AccessTierResolver.canToggleTask("foreman", UUID.randomUUID(), caller)).isTrue();
    }

    @Test
    void memberNeverToggles() {
      assertThat(AccessTierResolver.canToggleTask("member", caller, caller)).isFalse();
    }

    @Test
    void foremanAndSubcontractorRequestChanges() {
      assertThat(AccessTierResolver.canRequestChange("foreman")).isTrue();
      assertThat(AccessTierResolver.canRequestChange("subcontractor")).isTrue();
      assertThat(AccessTierResolver.canRequestChange("worker")).isFalse();
      assertThat(AccessTierResolver.canRequestChange("owner")).isFalse();
    }
  }
}
