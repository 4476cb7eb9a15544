package io.buildunion.factcore.citation.conflict;

import io.buildunion.factcore.citation.CiteType;
import io.buildunion.factcore.citation.LedgerSnapshot;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Compares the photo estimate (the {@code VISUAL_VERIFICATION} citation) with the blueprint
 * analysis (the {@code BLUEPRINT_UPLOAD} citation). Differences are measured relative to the photo
 * figure. A missing or zero figure on either side is never a conflict.
 */
public final class SourceConflictDetector {

  private SourceConflictDetector() {}

  public static List<SourceConflict> detect(UUID projectId, LedgerSnapshot ledger) {
    var photo =
        ledger
            .findFirst(CiteType.VISUAL_VERIFICATION)
            .map(SourceEstimate::from)
            .orElse(SourceEstimate.NONE);
    var blueprint =
        ledger
            .findFirst(CiteType.BLUEPRINT_UPLOAD)
            .map(SourceEstimate::from)
            .orElse(SourceEstimate.NONE);
    return compare(projectId, photo, blueprint);
  }

  public static List<SourceConflict> compare(
      UUID projectId, SourceEstimate photo, SourceEstimate blueprint) {
    var conflicts = new ArrayList<SourceConflict>();

    if (present(photo.area()) && present(blueprint.area())) {
      double diff = percentDiff(photo.area(), blueprint.area());
      if (diff > 10) {
        var severity =
            diff > 30
                ? ConflictSeverity.HIGH
                : diff > 20 ? ConflictSeverity.MEDIUM : ConflictSeverity.LOW;
        conflicts.add(
            new SourceConflict(
                "area-" + projectId,
                ConflictType.AREA,
                severity,
                String.format(Locale.ROOT, "%.0f sq ft", photo.area()),
                String.format(Locale.ROOT, "%.0f sq ft", blueprint.area()),
                (int) Math.round(diff),
                "Area measurement differs by " + Math.round(diff) + "%"));
      }
    }

    if (present(photo.total()) && present(blueprint.total())) {
      double diff = percentDiff(photo.total(), blueprint.total());
      if (diff > 20) {
        conflicts.add(
            new SourceConflict(
                "cost-" + projectId,
                ConflictType.COST,
                diff > 40 ? ConflictSeverity.HIGH : ConflictSeverity.MEDIUM,
                String.format(Locale.ROOT, "$%.2f", photo.total()),
                String.format(Locale.ROOT, "$%.2f", blueprint.total()),
                (int) Math.round(diff),
                "Cost estimate differs by " + Math.round(diff) + "%"));
      }
    }

    Integer photoItems = photo.materialCount();
    Integer blueprintItems = blueprint.materialCount();
    if (photoItems != null && blueprintItems != null && photoItems > 0 && blueprintItems > 0) {
      int diff = Math.abs(photoItems - blueprintItems);
      double percent = diff * 100.0 / photoItems;
      if (diff > 3 || percent > 30) {
        conflicts.add(
            new SourceConflict(
                "materials-" + projectId,
                ConflictType.MATERIALS,
                diff > 5 ? ConflictSeverity.MEDIUM : ConflictSeverity.LOW,
                photoItems + " items",
                blueprintItems + " items",
                (int) Math.round(percent),
                "Material count differs by " + diff + " items"));
      }
    }
    return conflicts;
  }

  private static boolean present(Double figure) {
    return figure != null && figure != 0;
  }

  private static double percentDiff(double photo, double blueprint) {
    return Math.abs(photo - blueprint) / photo * 100;
  }
}
