package io.buildunion.factcore.task.schedule;

import io.buildunion.factcore.citation.Citation;
import io.buildunion.factcore.citation.CiteType;
import io.buildunion.factcore.citation.LedgerSnapshot;
import io.buildunion.factcore.project.ProjectFinancialSummary;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Start, end and demolition flag for task generation. Dates come from the TIMELINE and END_DATE
 * citations, falling back to the financial summary's project dates.
 */
public record ScheduleInputs(LocalDate start, LocalDate end, boolean hasDemolition) {

  static final String DEMOLITION = "demolition";

  /** Returns empty unless both a start and an end date can be resolved. */
  public static Optional<ScheduleInputs> resolve(
      LedgerSnapshot snapshot, ProjectFinancialSummary financial) {
    var timeline = snapshot.findFirst(CiteType.TIMELINE);
    var endDate = snapshot.findFirst(CiteType.END_DATE);

    LocalDate start =
        timeline
            .flatMap(c -> firstDate(c.metadata().get("start_date"), c.value(), c.answer()))
            .orElseGet(() -> financial != null ? financial.getProjectStartDate() : null);
    LocalDate end =
        endDate
            .flatMap(c -> firstDate(c.value(), c.answer(), c.metadata().get("end_date")))
            .or(() -> timeline.flatMap(c -> firstDate(c.metadata().get("end_date"))))
            .orElseGet(() -> financial != null ? financial.getProjectEndDate() : null);

    if (start == null || end == null) {
      return Optional.empty();
    }
    return Optional.of(new ScheduleInputs(start, end, hasDemolition(snapshot)));
  }

  static boolean hasDemolition(LedgerSnapshot snapshot) {
    return snapshot
        .findFirst(CiteType.SITE_CONDITION)
        .map(ScheduleInputs::isDemolition)
        .orElse(false);
  }

  private static boolean isDemolition(Citation siteCondition) {
    Object value = siteCondition.value();
    return (value != null && DEMOLITION.equalsIgnoreCase(value.toString().trim()))
        || (siteCondition.answer() != null
            && DEMOLITION.equalsIgnoreCase(siteCondition.answer().trim()));
  }

  private static Optional<LocalDate> firstDate(Object... candidates) {
    return Stream.of(candidates)
        .map(ScheduleInputs::parseDate)
        .flatMap(Optional::stream)
        .findFirst();
  }

  // Accepts ISO dates and ISO date-times; only the date part is used.
  private static Optional<LocalDate> parseDate(Object raw) {
    if (raw == null) {
      return Optional.empty();
    }
    String text = raw.toString().trim();
    if (text.length() < 10) {
      return Optional.empty();
    }
    try {
      return Optional.of(LocalDate.parse(text.substring(0, 10)));
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }
}
