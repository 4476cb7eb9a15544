package io.buildunion.factcore.access;

import io.buildunion.factcore.citation.Citation;
import io.buildunion.factcore.citation.CiteType;
import java.util.UUID;

/** The caller's standing on one project, resolved once per request. */
public record ProjectAccess(
    UUID projectId, UUID memberId, String role, AccessTier tier, boolean editModeEnabled) {

  public boolean canEdit() {
    return AccessTierResolver.canEdit(role, editModeEnabled);
  }

  public boolean canViewFinancials() {
    return AccessTierResolver.canViewFinancials(role);
  }

  public boolean isOwner() {
    return ProjectRoles.OWNER.equals(role);
  }

  /**
   * A citation is readable when a visible review section contains it, or when it belongs to no
   * section and is not financial. Financial cite types always require the financial-view
   * capability.
   */
  public boolean canRead(Citation citation) {
    var type = CiteType.find(citation.citeType());
    if (type.isPresent() && type.get().isFinancial() && !canViewFinancials()) {
      return false;
    }
    boolean inAnySection = false;
    for (var section : ReviewSection.values()) {
      if (section.includes(citation)) {
        if (section.isVisibleTo(role)) {
          return true;
        }
        inAnySection = true;
      }
    }
    return !inAnySection;
  }
}
