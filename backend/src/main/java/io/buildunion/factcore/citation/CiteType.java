package io.buildunion.factcore.citation;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed vocabulary of verified project facts. Multi-instance types carry one citation per distinct
 * identifier stored under {@link #instanceKey()} in the citation metadata.
 */
public enum CiteType {
  PROJECT_NAME,
  LOCATION,
  WORK_TYPE,
  GFA_LOCK,
  BLUEPRINT_UPLOAD,
  TRADE_SELECTION,
  TEMPLATE_LOCK,
  EXECUTION_MODE,
  SITE_CONDITION,
  DEMOLITION_PRICE,
  TEAM_SIZE,
  TIMELINE,
  END_DATE,
  SITE_PHOTO,
  VISUAL_VERIFICATION,
  TEAM_STRUCTURE,
  TEAM_MEMBER_INVITE("member_id"),
  TEAM_PERMISSION_SET,
  DNA_FINALIZED,
  BUDGET,
  BUDGET_APPROVAL,
  MATERIAL,
  CONTRACT("contract_id"),
  WEATHER_ALERT;

  private final String instanceKey;

  CiteType() {
    this(null);
  }

  CiteType(String instanceKey) {
    this.instanceKey = instanceKey;
  }

  /** Metadata key identifying one instance of a multi-instance type, or null. */
  public String instanceKey() {
    return instanceKey;
  }

  public boolean isMultiInstance() {
    return instanceKey != null;
  }

  /** Financial facts are readable and editable only with the financial-view capability. */
  public boolean isFinancial() {
    return this == BUDGET
        || this == BUDGET_APPROVAL
        || this == MATERIAL
        || this == DEMOLITION_PRICE;
  }

  public static Optional<CiteType> find(String tag) {
    if (tag == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(t -> t.name().equals(tag)).findFirst();
  }
}
