package io.buildunion.factcore.citation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Immutable, ordered view of a project's citations. Every mutator returns a new snapshot; the
 * receiver is never changed.
 */
public final class LedgerSnapshot {

  private static final LedgerSnapshot EMPTY = new LedgerSnapshot(List.of());

  private final List<Citation> citations;

  private LedgerSnapshot(List<Citation> citations) {
    this.citations = citations;
  }

  public static LedgerSnapshot empty() {
    return EMPTY;
  }

  public static LedgerSnapshot of(List<Citation> citations) {
    return new LedgerSnapshot(Collections.unmodifiableList(new ArrayList<>(citations)));
  }

  public List<Citation> all() {
    return citations;
  }

  public int size() {
    return citations.size();
  }

  public boolean isEmpty() {
    return citations.isEmpty();
  }

  public Optional<Citation> find(String citationId) {
    return citations.stream().filter(c -> c.id().equals(citationId)).findFirst();
  }

  public Optional<Citation> findFirst(CiteType type) {
    return citations.stream().filter(c -> c.is(type)).findFirst();
  }

  public List<Citation> ofType(CiteType type) {
    return citations.stream().filter(c -> c.is(type)).toList();
  }

  public boolean contains(CitationKey key) {
    return citations.stream().anyMatch(c -> CitationKey.of(c).equals(key));
  }

  /** Replaces the citation with the same id, else the one with the same key, else appends. */
  public LedgerSnapshot withUpserted(Citation citation) {
    var next = new ArrayList<>(citations);
    int index = indexOfId(citation.id());
    if (index < 0) {
      var key = CitationKey.of(citation);
      for (int i = 0; i < next.size(); i++) {
        if (CitationKey.of(next.get(i)).equals(key)) {
          index = i;
          break;
        }
      }
    }
    if (index >= 0) {
      next.set(index, citation);
    } else {
      next.add(citation);
    }
    return new LedgerSnapshot(Collections.unmodifiableList(next));
  }

  public LedgerSnapshot withAdded(List<Citation> added) {
    if (added.isEmpty()) {
      return this;
    }
    var next = new ArrayList<>(citations);
    next.addAll(added);
    return new LedgerSnapshot(Collections.unmodifiableList(next));
  }

  private int indexOfId(String citationId) {
    for (int i = 0; i < citations.size(); i++) {
      if (citations.get(i).id().equals(citationId)) {
        return i;
      }
    }
    return -1;
  }
}
