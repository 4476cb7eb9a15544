package io.buildunion.factcore.citation;

import io.buildunion.factcore.exception.SourceUnavailableException;
import io.buildunion.factcore.project.ProjectFinancialSummaryRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Primary store adapter for project facts. Every write is a read-modify-write of the whole
 * collection, rejected by the version column when another writer committed in between.
 */
@Service
public class ProjectFactsStore {

  private static final Logger log = LoggerFactory.getLogger(ProjectFactsStore.class);

  private final ProjectFactsRepository projectFactsRepository;
  private final ProjectFinancialSummaryRepository financialSummaryRepository;
  private final CitationNormalizer normalizer;

  public ProjectFactsStore(
      ProjectFactsRepository projectFactsRepository,
      ProjectFinancialSummaryRepository financialSummaryRepository,
      CitationNormalizer normalizer) {
    this.projectFactsRepository = projectFactsRepository;
    this.financialSummaryRepository = financialSummaryRepository;
    this.normalizer = normalizer;
  }

  /**
   * Reads the stored records and financial fields of a project.
   *
   * @throws SourceUnavailableException if the database cannot be reached
   */
  @Transactional(readOnly = true)
  public StoredFacts read(UUID projectId) {
    try {
      var stored = projectFactsRepository.findByProjectId(projectId);
      var financial = financialSummaryRepository.findByProjectId(projectId).orElse(null);
      return new StoredFacts(
          projectId,
          stored.map(ProjectFacts::getFacts).orElse(List.of()),
          financial,
          stored.map(ProjectFacts::getVersion).orElse(0));
    } catch (DataAccessException e) {
      throw new SourceUnavailableException(projectId, "read", e);
    }
  }

  /**
   * Appends the candidates whose key is still absent from the persisted collection. Absence is
   * judged against the collection as read inside this transaction, so a candidate that a concurrent
   * writer already stored is dropped rather than duplicated.
   *
   * @return the candidates that were actually written
   */
  @Transactional
  public List<Citation> mergeAbsent(UUID projectId, List<Citation> candidates) {
    var row =
        projectFactsRepository
            .findByProjectId(projectId)
            .orElseGet(() -> new ProjectFacts(projectId));
    var current = LedgerSnapshot.of(normalizer.normalize(row.getFacts(), row.getUpdatedAt()));

    var accepted = new ArrayList<Citation>();
    for (var candidate : candidates) {
      var key = CitationKey.of(candidate);
      if (current.contains(key)) {
        log.debug(
            "Skipping {} for project {}: key already persisted", candidate.citeType(), projectId);
        continue;
      }
      current = current.withAdded(List.of(candidate));
      accepted.add(candidate);
    }

    if (!accepted.isEmpty()) {
      row.replaceFacts(toRecords(current));
      projectFactsRepository.save(row);
    }
    return accepted;
  }

  /**
   * Writes one citation into the persisted collection, replacing the entry with the same id (or, if
   * none, the same key) and appending otherwise.
   */
  @Transactional
  public Citation upsert(UUID projectId, Citation citation) {
    var row =
        projectFactsRepository
            .findByProjectId(projectId)
            .orElseGet(() -> new ProjectFacts(projectId));
    var current = LedgerSnapshot.of(normalizer.normalize(row.getFacts(), row.getUpdatedAt()));
    row.replaceFacts(toRecords(current.withUpserted(citation)));
    projectFactsRepository.save(row);
    log.info(
        "Stored citation {} ({}) for project {}", citation.id(), citation.citeType(), projectId);
    return citation;
  }

  private static List<Map<String, Object>> toRecords(LedgerSnapshot snapshot) {
    return snapshot.all().stream().map(Citation::toRecord).toList();
  }
}
