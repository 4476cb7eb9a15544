package io.buildunion.factcore.citation.conflict;

import static org.assertj.core.api.Assertions.assertThat;

import io.buildunion.factcore.citation.Citation;
import io.buildunion.factcore.citation.CiteType;
import io.buildunion.factcore.citation.LedgerSnapshot;
import io.buildunion.factcore.citation.Provenance;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class SourceConflictDetectorTest {

  private static final UUID PROJECT_ID = UUID.fromString("7f6e3b4a-1111-4c3b-9a55-0e2f4b8d9c01");
  private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

  @Test
  void areaDisagreementAboveThirtyPercentIsHigh() {
    var ledger = ledger(Map.of("area", 1000), Map.of("area", 1350));

    var conflicts = SourceConflictDetector.detect(PROJECT_ID, ledger);

    assertThat(conflicts)
        .singleElement()
        .satisfies(
            conflict -> {
              assertThat(conflict.id()).isEqualTo("area-" + PROJECT_ID);
              assertThat(conflict.type()).isEqualTo(ConflictType.AREA);
              assertThat(conflict.severity()).isEqualTo(ConflictSeverity.HIGH);
              assertThat(conflict.photoValue()).isEqualTo("1000 sq ft");
              assertThat(conflict.blueprintValue()).isEqualTo("1350 sq ft");
              assertThat(conflict.percentDiff()).isEqualTo(35);
              assertThat(conflict.description()).isEqualTo("Area measurement differs by 35%");
            });
  }

  @Test
  void areaSeverityFollowsBands() {
    assertThat(areaSeverity(1150)).isEqualTo(ConflictSeverity.LOW);
    assertThat(areaSeverity(1250)).isEqualTo(ConflictSeverity.MEDIUM);
    assertThat(areaSeverity(700)).isEqualTo(ConflictSeverity.MEDIUM);
  }

  @Test
  void smallAreaDifferenceIsNotAConflict() {
    var ledger = ledger(Map.of("area", 1000), Map.of("area", 1080));

    assertThat(SourceConflictDetector.detect(PROJECT_ID, ledger)).isEmpty();
  }

  @Test
  void costDisagreementIsMeasuredAgainstPhotoEstimate() {
    var medium = ledger(Map.of("total", 10000), Map.of("estimated_cost", "13000"));
    var high = ledger(Map.of("total", 10000), Map.of("total", 15000.5));

    assertThat(SourceConflictDetector.detect(PROJECT_ID, medium))
        .singleElement()
        .satisfies(
            conflict -> {
              assertThat(conflict.type()).isEqualTo(ConflictType.COST);
              assertThat(conflict.severity()).isEqualTo(ConflictSeverity.MEDIUM);
              assertThat(conflict.photoValue()).isEqualTo("$10000.00");
              assertThat(conflict.blueprintValue()).isEqualTo("$13000.00");
            });
    assertThat(SourceConflictDetector.detect(PROJECT_ID, high))
        .extracting(SourceConflict::severity)
        .containsExactly(ConflictSeverity.HIGH);
  }

  @Test
  void materialCountGapOfMoreThanThreeItemsIsReported() {
    var ledger =
        ledger(
            Map.of("materials", List.of("drywall", "studs", "screws", "tape")),
            Map.of("material_count", 9));

    var conflicts = SourceConflictDetector.detect(PROJECT_ID, ledger);

    assertThat(conflicts)
        .singleElement()
        .satisfies(
            conflict -> {
              assertThat(conflict.type()).isEqualTo(ConflictType.MATERIALS);
              assertThat(conflict.severity()).isEqualTo(ConflictSeverity.LOW);
              assertThat(conflict.description()).isEqualTo("Material count differs by 5 items");
            });
  }

  @Test
  void closeMaterialCountsAgree() {
    var ledger = ledger(Map.of("material_count", 10), Map.of("material_count", 12));

    assertThat(SourceConflictDetector.detect(PROJECT_ID, ledger)).isEmpty();
  }

  @Test
  void missingOrZeroFiguresAreNeverConflicts() {
    var noBlueprint =
        LedgerSnapshot.of(List.of(citation(CiteType.VISUAL_VERIFICATION, Map.of("area", 1000))));
    var zeroPhoto = ledger(Map.of("area", 0), Map.of("area", 1200));
    var unparseable = ledger(Map.of("area", "about 1000"), Map.of("area", 1500));

    assertThat(SourceConflictDetector.detect(PROJECT_ID, noBlueprint)).isEmpty();
    assertThat(SourceConflictDetector.detect(PROJECT_ID, zeroPhoto)).isEmpty();
    assertThat(SourceConflictDetector.detect(PROJECT_ID, unparseable)).isEmpty();
    assertThat(SourceConflictDetector.detect(PROJECT_ID, LedgerSnapshot.empty())).isEmpty();
  }

  @Test
  void detectedAreaIsUsedWhenAreaIsAbsent() {
    var ledger = ledger(Map.of("detected_area", 800), Map.of("area", 1200));

    assertThat(SourceConflictDetector.detect(PROJECT_ID, ledger))
        .extracting(SourceConflict::type)
        .containsExactly(ConflictType.AREA);
  }

  private static ConflictSeverity areaSeverity(int blueprintArea) {
    var conflicts =
        SourceConflictDetector.detect(
            PROJECT_ID, ledger(Map.of("area", 1000), Map.of("area", blueprintArea)));
    assertThat(conflicts).hasSize(1);
    return conflicts.get(0).severity();
  }

  private static LedgerSnapshot ledger(Map<String, Object> photo, Map<String, Object> blueprint) {
    return LedgerSnapshot.of(
        List.of(
            citation(CiteType.VISUAL_VERIFICATION, photo),
            citation(CiteType.BLUEPRINT_UPLOAD, blueprint)));
  }

  private static Citation citation(CiteType type, Map<String, Object> metadata) {
    return new Citation(
        "c-" + type.name(), type.name(), null, "x", "x", metadata, NOW, Provenance.USER_INPUT);
  }
}
