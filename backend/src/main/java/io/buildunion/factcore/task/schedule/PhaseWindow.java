package io.buildunion.factcore.task.schedule;

import java.time.LocalDate;

/** One phase laid out on the calendar: it starts at {@code start} and is due at {@code end}. */
public record PhaseWindow(ConstructionPhase phase, LocalDate start, LocalDate end, int days) {}
