package io.buildunion.factcore.task.schedule;

import static org.assertj.core.api.Assertions.assertThat;

import io.buildunion.factcore.task.Task;
import io.buildunion.factcore.task.TaskPriority;
import io.buildunion.factcore.task.TaskStatus;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class TaskPhaseSchedulerTest {

  private static final UUID PROJECT_ID = UUID.randomUUID();

  private final TaskPhaseScheduler scheduler = new TaskPhaseScheduler();

  @Test
  void weightsAreRenormalizedWithoutDemolition() {
    var start = LocalDate.of(2025, 5, 1);
    var windows = scheduler.plan(new ScheduleInputs(start, start.plusDays(30), false));

    assertThat(windows)
        .extracting(PhaseWindow::phase)
        .containsExactly(
            ConstructionPhase.PREPARATION,
            ConstructionPhase.INSTALLATION,
            ConstructionPhase.FINISHING);
    assertThat(windows).extracting(PhaseWindow::days).containsExactly(9, 16, 5);
  }

  @Test
  void phasesAreContiguousFromStart() {
    var start = LocalDate.of(2025, 1, 1);
    var windows = scheduler.plan(new ScheduleInputs(start, start.plusDays(100), true));

    assertThat(windows).hasSize(4);
    assertThat(windows).extracting(PhaseWindow::days).containsExactly(15, 25, 45, 15);
    assertThat(windows.get(0).start()).isEqualTo(start);
    for (int i = 1; i < windows.size(); i++) {
      assertThat(windows.get(i).start()).isEqualTo(windows.get(i - 1).end());
    }
    for (var window : windows) {
      assertThat(ChronoUnit.DAYS.between(window.start(), window.end())).isEqualTo(window.days());
    }
    assertThat(windows.get(3).end()).isEqualTo(LocalDate.of(2025, 4, 11));
  }

  @Test
  void everyPhaseGetsAtLeastOneDay() {
    var day = LocalDate.of(2025, 5, 1);
    var windows = scheduler.plan(new ScheduleInputs(day, day, true));

    assertThat(windows).extracting(PhaseWindow::days).containsOnly(1);
    assertThat(windows.get(3).end()).isEqualTo(day.plusDays(4));
  }

  @Test
  void endBeforeStartStillSchedules() {
    var start = LocalDate.of(2025, 5, 10);
    var windows = scheduler.plan(new ScheduleInputs(start, start.minusDays(5), false));

    assertThat(windows).hasSize(3).allSatisfy(w -> assertThat(w.days()).isEqualTo(1));
  }

  @Test
  void twoTasksPerPhaseDueAtPhaseEnd() {
    var start = LocalDate.of(2025, 5, 1);
    var windows = scheduler.plan(new ScheduleInputs(start, start.plusDays(30), false));

    var tasks = scheduler.generateTasks(PROJECT_ID, windows);

    assertThat(tasks).hasSize(6);
    assertThat(tasks)
        .extracting(Task::getTitle)
        .containsExactly(
            "Preparation Work",
            "Verification: Prep Complete Checklist",
            "Installation Work",
            "Verification: Progress Photos",
            "Finishing & QC Work",
            "Verification: Final Inspection (OBC)");
    assertThat(tasks).allSatisfy(t -> assertThat(t.getStatus()).isEqualTo(TaskStatus.PENDING));
    assertThat(tasks.get(0).getDueDate()).isEqualTo(windows.get(0).end());
    assertThat(tasks.get(1).getDueDate()).isEqualTo(windows.get(0).end());
    assertThat(tasks.get(5).getDueDate()).isEqualTo(start.plusDays(30));
  }

  @Test
  void verificationTasksAreCriticalWithChecklist() {
    var start = LocalDate.of(2025, 1, 1);
    var windows = scheduler.plan(new ScheduleInputs(start, start.plusDays(100), true));

    var tasks = scheduler.generateTasks(PROJECT_ID, windows);

    var demolitionWork = tasks.get(0);
    assertThat(demolitionWork.getPriority()).isEqualTo(TaskPriority.CRITICAL);
    assertThat(demolitionWork.getPhase()).isEqualTo("DEMOLITION");
    assertThat(demolitionWork.getDescription()).isEqualTo("Phase: Demolition");

    var siteClear = tasks.get(1);
    assertThat(siteClear.getTitle()).isEqualTo("Verification: Site Clear Photo");
    assertThat(siteClear.getPriority()).isEqualTo(TaskPriority.CRITICAL);
    assertThat(siteClear.getChecklist())
        .containsExactly(Map.of("label", "Site Clear Photo", "done", false));

    assertThat(tasks.get(6).getPriority()).isEqualTo(TaskPriority.MEDIUM);
    assertThat(tasks.get(7).getPriority()).isEqualTo(TaskPriority.CRITICAL);
  }

  @Test
  void noWindowsNoTasks() {
    assertThat(scheduler.generateTasks(PROJECT_ID, List.of())).isEmpty();
  }
}
