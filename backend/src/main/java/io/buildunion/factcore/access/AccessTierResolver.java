package io.buildunion.factcore.access;

import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Role based gating of project data. Tier checks are hierarchical; the edit, financial-view and
 * task-toggle capabilities are separate, stricter predicates that the hierarchy does not imply.
 */
public final class AccessTierResolver {

  private static final Map<String, AccessTier> ROLE_TIERS =
      Map.of(
          ProjectRoles.OWNER, AccessTier.OWNER,
          ProjectRoles.FOREMAN, AccessTier.FOREMAN,
          ProjectRoles.WORKER, AccessTier.WORKER,
          ProjectRoles.INSPECTOR, AccessTier.WORKER,
          ProjectRoles.SUBCONTRACTOR, AccessTier.WORKER,
          ProjectRoles.MEMBER, AccessTier.PUBLIC);

  private AccessTierResolver() {}

  /** Total mapping; null and unknown roles resolve to {@link AccessTier#PUBLIC}. */
  public static AccessTier tierOf(String role) {
    if (role == null) {
      return AccessTier.PUBLIC;
    }
    return ROLE_TIERS.getOrDefault(role.trim().toLowerCase(Locale.ROOT), AccessTier.PUBLIC);
  }

  public static boolean hasAccess(String role, AccessTier required) {
    return tierOf(role).covers(required);
  }

  /** Foremen always edit; owners only while edit mode is switched on. */
  public static boolean canEdit(String role, boolean editModeEnabled) {
    String normalized = normalize(role);
    if (ProjectRoles.FOREMAN.equals(normalized)) {
      return true;
    }
    return ProjectRoles.OWNER.equals(normalized) && editModeEnabled;
  }

  public static boolean canViewFinancials(String role) {
    return ProjectRoles.OWNER.equals(normalize(role));
  }

  public static boolean canToggleTask(String role, UUID assignee, UUID caller) {
    String normalized = normalize(role);
    if (ProjectRoles.OWNER.equals(normalized) || ProjectRoles.FOREMAN.equals(normalized)) {
      return true;
    }
    return isWorkerClass(normalized) && assignee != null && assignee.equals(caller);
  }

  /** Roles allowed to propose quantity changes for owner approval. */
  public static boolean canRequestChange(String role) {
    String normalized = normalize(role);
    return ProjectRoles.FOREMAN.equals(normalized)
        || ProjectRoles.SUBCONTRACTOR.equals(normalized);
  }

  private static boolean isWorkerClass(String normalized) {
    return ProjectRoles.WORKER.equals(normalized)
        || ProjectRoles.INSPECTOR.equals(normalized)
        || ProjectRoles.SUBCONTRACTOR.equals(normalized);
  }

  private static String normalize(String role) {
    return role != null ? role.trim().toLowerCase(Locale.ROOT) : null;
  }
}
