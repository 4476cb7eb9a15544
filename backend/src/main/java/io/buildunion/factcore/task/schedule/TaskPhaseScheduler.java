package io.buildunion.factcore.task.schedule;

import io.buildunion.factcore.task.Task;
import io.buildunion.factcore.task.TaskPriority;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Lays out the initial schedule of a project: weighted phases placed back to back from the start
 * date, each yielding a work task and a verification task due at the phase end.
 */
@Component
public class TaskPhaseScheduler {

  /**
   * Splits the project span across the active phases. Demolition is dropped when the site needs
   * none, and the remaining weights are renormalized. Every phase gets at least one day.
   */
  public List<PhaseWindow> plan(ScheduleInputs inputs) {
    var phases = new ArrayList<ConstructionPhase>();
    for (var phase : ConstructionPhase.values()) {
      if (phase != ConstructionPhase.DEMOLITION || inputs.hasDemolition()) {
        phases.add(phase);
      }
    }
    int totalWeight = phases.stream().mapToInt(ConstructionPhase::weight).sum();
    long totalDays = Math.max(1, ChronoUnit.DAYS.between(inputs.start(), inputs.end()));

    var windows = new ArrayList<PhaseWindow>(phases.size());
    LocalDate cursor = inputs.start();
    for (var phase : phases) {
      double share = (double) phase.weight() / totalWeight;
      int days = (int) Math.max(1, Math.round(share * totalDays));
      LocalDate phaseEnd = cursor.plusDays(days);
      windows.add(new PhaseWindow(phase, cursor, phaseEnd, days));
      cursor = phaseEnd;
    }
    return windows;
  }

  /** Two tasks per phase: the phase work and its verification checkpoint. */
  public List<Task> generateTasks(UUID projectId, List<PhaseWindow> windows) {
    var tasks = new ArrayList<Task>(windows.size() * 2);
    for (var window : windows) {
      var phase = window.phase();
      tasks.add(
          new Task(
              projectId,
              phase.label() + " Work",
              "Phase: " + phase.label(),
              phase.workPriority(),
              phase.name(),
              null,
              window.end()));

      var verification =
          new Task(
              projectId,
              "Verification: " + phase.verificationLabel(),
              "Verification checkpoint: " + phase.verificationLabel(),
              TaskPriority.CRITICAL,
              phase.name(),
              null,
              window.end());
      verification.setChecklist(
          List.of(Map.of("label", phase.verificationLabel(), "done", false)));
      tasks.add(verification);
    }
    return tasks;
  }
}
