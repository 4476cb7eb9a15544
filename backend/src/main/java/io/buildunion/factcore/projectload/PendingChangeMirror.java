package io.buildunion.factcore.projectload;

import io.buildunion.factcore.pendingchange.PendingChangeStatus;
import io.buildunion.factcore.pendingchange.PendingChangeView;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Session-local copy of a project's pending changes, reconciled by upsert on id. Each distinct
 * arrival of a new pending change is reported exactly once, however often it is redelivered.
 */
public class PendingChangeMirror {

  private final Map<UUID, PendingChangeView> changes = new LinkedHashMap<>();
  private final Set<UUID> seenArrivals = new HashSet<>();
  private final List<PendingChangeView> unacknowledged = new ArrayList<>();

  public PendingChangeMirror(List<PendingChangeView> initial) {
    for (var change : initial) {
      changes.put(change.id(), change);
      seenArrivals.add(change.id());
    }
  }

  /**
   * Applies an incoming change. Returns true when it is a pending change this mirror has never seen
   * before, i.e. a new arrival.
   */
  public synchronized boolean apply(PendingChangeView change) {
    changes.put(change.id(), change);
    if (change.status() == PendingChangeStatus.PENDING && seenArrivals.add(change.id())) {
      unacknowledged.add(change);
      return true;
    }
    if (change.status().isTerminal()) {
      unacknowledged.removeIf(c -> c.id().equals(change.id()));
    }
    return false;
  }

  /** Returns arrivals not yet surfaced to the user and clears them. */
  public synchronized List<PendingChangeView> drainArrivals() {
    var drained = List.copyOf(unacknowledged);
    unacknowledged.clear();
    return drained;
  }

  public synchronized List<PendingChangeView> all() {
    return changes.values().stream()
        .sorted(Comparator.comparing(PendingChangeView::createdAt).reversed())
        .toList();
  }

  public synchronized List<PendingChangeView> pending() {
    return all().stream().filter(c -> c.status() == PendingChangeStatus.PENDING).toList();
  }
}
