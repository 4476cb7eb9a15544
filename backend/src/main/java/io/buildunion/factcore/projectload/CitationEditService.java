package io.buildunion.factcore.projectload;

import io.buildunion.factcore.access.ProjectAccessService;
import io.buildunion.factcore.citation.Citation;
import io.buildunion.factcore.citation.CitationNormalizer;
import io.buildunion.factcore.citation.CiteType;
import io.buildunion.factcore.citation.FactSnapshotCache;
import io.buildunion.factcore.citation.LedgerSnapshot;
import io.buildunion.factcore.citation.ProjectFactsStore;
import io.buildunion.factcore.exception.ForbiddenException;
import io.buildunion.factcore.exception.ResourceNotFoundException;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Saves a user edit of one citation. The edit keeps the citation id, replaces answer and value and
 * marks the citation as user input, so later synthesis never overwrites it.
 */
@Service
public class CitationEditService {

  private static final Logger log = LoggerFactory.getLogger(CitationEditService.class);

  private final ProjectAccessService projectAccessService;
  private final ProjectFactsStore factsStore;
  private final CitationNormalizer normalizer;
  private final FactSnapshotCache snapshotCache;
  private final ProjectSessionRegistry sessionRegistry;

  public CitationEditService(
      ProjectAccessService projectAccessService,
      ProjectFactsStore factsStore,
      CitationNormalizer normalizer,
      FactSnapshotCache snapshotCache,
      ProjectSessionRegistry sessionRegistry) {
    this.projectAccessService = projectAccessService;
    this.factsStore = factsStore;
    this.normalizer = normalizer;
    this.snapshotCache = snapshotCache;
    this.sessionRegistry = sessionRegistry;
  }

  /**
   * Applies the edit and persists it with a version-guarded write. A concurrent write surfaces as
   * an optimistic locking failure for the caller to retry.
   */
  public Citation save(
      UUID projectId, String citationId, String answer, Object value, UUID memberId) {
    var access = projectAccessService.requireEditAccess(projectId, memberId);

    var current =
        findInSessions(projectId, citationId)
            .or(() -> findStored(projectId, citationId))
            .orElseThrow(() -> new ResourceNotFoundException("Citation", citationId));

    boolean financial = CiteType.find(current.citeType()).map(CiteType::isFinancial).orElse(false);
    if (financial && !access.canViewFinancials()) {
      throw new ForbiddenException(
          "Cannot edit financial facts", "Only the project owner can edit " + current.citeType());
    }

    var edited = current.withEdit(answer, value, Instant.now());
    factsStore.upsert(projectId, edited);

    for (var session : sessionRegistry.forProject(projectId)) {
      session.ledger().upsert(edited);
    }
    snapshotCache.evict(projectId);

    log.info(
        "Citation {} ({}) of project {} edited by {}",
        citationId,
        edited.citeType(),
        projectId,
        memberId);
    return edited;
  }

  private Optional<Citation> findInSessions(UUID projectId, String citationId) {
    return sessionRegistry.forProject(projectId).stream()
        .map(session -> session.ledger().get(citationId))
        .flatMap(Optional::stream)
        .findFirst();
  }

  private Optional<Citation> findStored(UUID projectId, String citationId) {
    var stored = factsStore.read(projectId);
    return LedgerSnapshot.of(normalizer.normalize(stored.records())).find(citationId);
  }
}
