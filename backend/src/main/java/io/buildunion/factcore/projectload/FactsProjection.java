package io.buildunion.factcore.projectload;

import io.buildunion.factcore.access.AccessTier;
import io.buildunion.factcore.access.ProjectAccess;
import io.buildunion.factcore.access.ReviewSection;
import io.buildunion.factcore.citation.Citation;
import io.buildunion.factcore.citation.CiteType;
import io.buildunion.factcore.citation.LedgerSnapshot;
import io.buildunion.factcore.citation.conflict.SourceConflict;
import io.buildunion.factcore.citation.conflict.SourceConflictDetector;
import io.buildunion.factcore.citation.health.ProjectHealthScorer;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Component;

/** Builds read projections of a session for one caller. */
@Component
public class FactsProjection {

  public ProjectFactsView view(
      ProjectSession session, ProjectAccess access, ProjectFactsView.LoadSummary load) {
    var ledger = session.ledger().snapshot();
    return new ProjectFactsView(
        session.sessionId(),
        session.projectId(),
        access.role(),
        access.tier(),
        access.canEdit(),
        access.canViewFinancials(),
        citations(session.ledger().all(), access),
        sections(session.ledger().all(), access),
        session.tasks().all(),
        session.pendingChanges().all(),
        ProjectHealthScorer.score(ledger),
        conflicts(session.projectId(), ledger, access),
        load);
  }

  public List<CitationView> citations(List<Citation> citations, ProjectAccess access) {
    return citations.stream()
        .filter(access::canRead)
        .map(c -> CitationView.of(c, visibility(c)))
        .toList();
  }

  /** The review sections the caller may see, each with its readable citations. */
  public List<SectionView> sections(List<Citation> citations, ProjectAccess access) {
    var sections = new ArrayList<SectionView>();
    for (var section : ReviewSection.values()) {
      if (!section.isVisibleTo(access.role())) {
        continue;
      }
      sections.add(section(section, citations, access));
    }
    return sections;
  }

  public SectionView section(
      ReviewSection section, List<Citation> citations, ProjectAccess access) {
    var members =
        citations.stream()
            .filter(section::includes)
            .filter(access::canRead)
            .map(c -> CitationView.of(c, visibility(c)))
            .toList();
    return new SectionView(section.name(), section.title(), section.requiredTier(), members);
  }

  /**
   * Conflicts between the photo estimate and the blueprint analysis. Only callers who can read both
   * sources see them, and cost conflicts need the financial-view capability.
   */
  public List<SourceConflict> conflicts(
      UUID projectId, LedgerSnapshot ledger, ProjectAccess access) {
    boolean sourcesReadable =
        ledger.ofType(CiteType.VISUAL_VERIFICATION).stream().allMatch(access::canRead)
            && ledger.ofType(CiteType.BLUEPRINT_UPLOAD).stream().allMatch(access::canRead);
    if (!sourcesReadable) {
      return List.of();
    }
    return SourceConflictDetector.detect(projectId, ledger).stream()
        .filter(c -> !c.type().isFinancial() || access.canViewFinancials())
        .toList();
  }

  /** Lowest tier able to read the citation. */
  static AccessTier visibility(Citation citation) {
    var type = CiteType.find(citation.citeType());
    if (type.isPresent() && type.get().isFinancial()) {
      return AccessTier.OWNER;
    }
    AccessTier lowest = null;
    for (var section : ReviewSection.values()) {
      if (section.includes(citation)
          && (lowest == null || section.requiredTier().rank() < lowest.rank())) {
        lowest = section.requiredTier();
      }
    }
    return lowest != null ? lowest : AccessTier.PUBLIC;
  }
}
