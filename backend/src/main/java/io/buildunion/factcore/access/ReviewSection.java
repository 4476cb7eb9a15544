package io.buildunion.factcore.access;

import io.buildunion.factcore.citation.Citation;
import io.buildunion.factcore.citation.CiteType;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Fixed groupings of citations shown on the project review screen, each with the tier needed to
 * see it. The financial section also requires the financial-view capability.
 */
public enum ReviewSection {
  BASIC_INFORMATION(
      "Basic Information",
      AccessTier.PUBLIC,
      false,
      EnumSet.of(CiteType.PROJECT_NAME, CiteType.LOCATION, CiteType.WORK_TYPE)),
  AREA_LOCK(
      "Area Lock",
      AccessTier.FOREMAN,
      false,
      EnumSet.of(CiteType.GFA_LOCK, CiteType.BLUEPRINT_UPLOAD)),
  TRADE_AND_TEMPLATE(
      "Trade & Template",
      AccessTier.FOREMAN,
      false,
      EnumSet.of(CiteType.TRADE_SELECTION, CiteType.TEMPLATE_LOCK)),
  EXECUTION_FLOW(
      "Execution Flow",
      AccessTier.FOREMAN,
      false,
      EnumSet.of(
          CiteType.EXECUTION_MODE,
          CiteType.SITE_CONDITION,
          CiteType.DEMOLITION_PRICE,
          CiteType.TEAM_SIZE,
          CiteType.TIMELINE,
          CiteType.END_DATE)),
  VISUAL_INTELLIGENCE(
      "Visual Intelligence",
      AccessTier.WORKER,
      false,
      EnumSet.of(CiteType.BLUEPRINT_UPLOAD, CiteType.SITE_PHOTO, CiteType.VISUAL_VERIFICATION)),
  TEAM_ARCHITECTURE(
      "Team Architecture",
      AccessTier.FOREMAN,
      false,
      EnumSet.of(
          CiteType.TEAM_STRUCTURE, CiteType.TEAM_MEMBER_INVITE, CiteType.TEAM_PERMISSION_SET)),
  EXECUTION_TIMELINE(
      "Execution Timeline",
      AccessTier.WORKER,
      false,
      EnumSet.of(CiteType.TIMELINE, CiteType.END_DATE, CiteType.DNA_FINALIZED)),
  FINANCIAL_SUMMARY(
      "Financial Summary",
      AccessTier.OWNER,
      true,
      EnumSet.of(CiteType.BUDGET, CiteType.MATERIAL, CiteType.DEMOLITION_PRICE));

  private final String title;
  private final AccessTier requiredTier;
  private final boolean financial;
  private final Set<CiteType> citeTypes;

  ReviewSection(String title, AccessTier requiredTier, boolean financial, Set<CiteType> citeTypes) {
    this.title = title;
    this.requiredTier = requiredTier;
    this.financial = financial;
    this.citeTypes = citeTypes;
  }

  public String title() {
    return title;
  }

  public AccessTier requiredTier() {
    return requiredTier;
  }

  public boolean isFinancial() {
    return financial;
  }

  public Set<CiteType> citeTypes() {
    return citeTypes;
  }

  public boolean includes(Citation citation) {
    return citeTypes.stream().anyMatch(citation::is);
  }

  public boolean isVisibleTo(String role) {
    if (!AccessTierResolver.hasAccess(role, requiredTier)) {
      return false;
    }
    return !financial || AccessTierResolver.canViewFinancials(role);
  }

  public static Optional<ReviewSection> find(String name) {
    if (name == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(s -> s.name().equalsIgnoreCase(name)).findFirst();
  }
}
