package io.buildunion.factcore.citation.synthesis;

import io.buildunion.factcore.citation.Citation;
import io.buildunion.factcore.citation.CiteType;
import io.buildunion.factcore.citation.LedgerSnapshot;
import io.buildunion.factcore.task.Task;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Derives one project date from the due dates of non-archived tasks: TIMELINE from the earliest,
 * END_DATE from the latest. The two dates are separate rules so that each is only filled when that
 * specific citation is missing.
 */
final class TaskTimelineRule implements SynthesisRule {

  private final CiteType target;
  private final String metadataKey;
  private final Comparator<LocalDate> order;

  private TaskTimelineRule(CiteType target, String metadataKey, Comparator<LocalDate> order) {
    this.target = target;
    this.metadataKey = metadataKey;
    this.order = order;
  }

  static TaskTimelineRule start() {
    return new TaskTimelineRule(CiteType.TIMELINE, "start_date", Comparator.naturalOrder());
  }

  static TaskTimelineRule end() {
    return new TaskTimelineRule(CiteType.END_DATE, "end_date", Comparator.reverseOrder());
  }

  @Override
  public String name() {
    return target == CiteType.TIMELINE ? "task-timeline-start" : "task-timeline-end";
  }

  @Override
  public List<Citation> candidates(LedgerSnapshot snapshot, SynthesisContext context) {
    Optional<LocalDate> date =
        context.tasks().stream()
            .filter(task -> !task.isArchived())
            .map(Task::getDueDate)
            .filter(Objects::nonNull)
            .min(order);
    if (date.isEmpty()) {
      return List.of();
    }
    String iso = date.get().toString();
    return List.of(
        SyntheticCitations.create(
            target,
            "tasks",
            iso,
            iso,
            Map.of("source", "tasks", metadataKey, iso),
            context.now()));
  }
}
