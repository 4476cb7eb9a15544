package io.buildunion.factcore.projectload;

import io.buildunion.factcore.access.ProjectAccess;
import io.buildunion.factcore.access.ProjectAccessService;
import io.buildunion.factcore.access.ReviewSection;
import io.buildunion.factcore.citation.Citation;
import io.buildunion.factcore.citation.CitationLedger;
import io.buildunion.factcore.citation.CitationNormalizer;
import io.buildunion.factcore.citation.FactFlushService;
import io.buildunion.factcore.citation.FactSnapshotCache;
import io.buildunion.factcore.citation.LedgerSnapshot;
import io.buildunion.factcore.citation.ProjectFactsStore;
import io.buildunion.factcore.citation.synthesis.FactSynthesizer;
import io.buildunion.factcore.citation.synthesis.SynthesisContext;
import io.buildunion.factcore.contract.ContractRepository;
import io.buildunion.factcore.exception.ForbiddenException;
import io.buildunion.factcore.exception.ResourceNotFoundException;
import io.buildunion.factcore.exception.SourceUnavailableException;
import io.buildunion.factcore.integration.weather.WeatherService;
import io.buildunion.factcore.member.InvitationStatus;
import io.buildunion.factcore.member.TeamInvitationRepository;
import io.buildunion.factcore.member.TeamMemberRepository;
import io.buildunion.factcore.pendingchange.PendingChangeRepository;
import io.buildunion.factcore.pendingchange.PendingChangeView;
import io.buildunion.factcore.project.Project;
import io.buildunion.factcore.project.ProjectFinancialSummary;
import io.buildunion.factcore.project.ProjectRepository;
import io.buildunion.factcore.task.Task;
import io.buildunion.factcore.task.TaskRepository;
import io.buildunion.factcore.task.TaskView;
import io.buildunion.factcore.task.schedule.TaskBootstrapService;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Explicit project load: primary read with cache fallback, normalization, synthesis, initial task
 * generation, and finally a new session whose ledger and mirrors back all further reads.
 */
@Service
public class ProjectLoadService {

  private static final Logger log = LoggerFactory.getLogger(ProjectLoadService.class);

  private final ProjectRepository projectRepository;
  private final ProjectAccessService projectAccessService;
  private final ProjectFactsStore factsStore;
  private final FactSnapshotCache snapshotCache;
  private final CitationNormalizer normalizer;
  private final FactSynthesizer synthesizer;
  private final FactFlushService flushService;
  private final TaskRepository taskRepository;
  private final TaskBootstrapService taskBootstrapService;
  private final TeamMemberRepository teamMemberRepository;
  private final TeamInvitationRepository teamInvitationRepository;
  private final ContractRepository contractRepository;
  private final PendingChangeRepository pendingChangeRepository;
  private final WeatherService weatherService;
  private final ProjectSessionRegistry sessionRegistry;
  private final FactsProjection projection;

  public ProjectLoadService(
      ProjectRepository projectRepository,
      ProjectAccessService projectAccessService,
      ProjectFactsStore factsStore,
      FactSnapshotCache snapshotCache,
      CitationNormalizer normalizer,
      FactSynthesizer synthesizer,
      FactFlushService flushService,
      TaskRepository taskRepository,
      TaskBootstrapService taskBootstrapService,
      TeamMemberRepository teamMemberRepository,
      TeamInvitationRepository teamInvitationRepository,
      ContractRepository contractRepository,
      PendingChangeRepository pendingChangeRepository,
      WeatherService weatherService,
      ProjectSessionRegistry sessionRegistry,
      FactsProjection projection) {
    this.projectRepository = projectRepository;
    this.projectAccessService = projectAccessService;
    this.factsStore = factsStore;
    this.snapshotCache = snapshotCache;
    this.normalizer = normalizer;
    this.synthesizer = synthesizer;
    this.flushService = flushService;
    this.taskRepository = taskRepository;
    this.taskBootstrapService = taskBootstrapService;
    this.teamMemberRepository = teamMemberRepository;
    this.teamInvitationRepository = teamInvitationRepository;
    this.contractRepository = contractRepository;
    this.pendingChangeRepository = pendingChangeRepository;
    this.weatherService = weatherService;
    this.sessionRegistry = sessionRegistry;
    this.projection = projection;
  }

  public ProjectFactsView load(UUID projectId, UUID memberId) {
    var project =
        projectRepository
            .findById(projectId)
            .orElseThrow(() -> new ResourceNotFoundException("Project", projectId));
    var access = projectAccessService.resolve(project, memberId);
    var now = Instant.now();

    var source = readRecords(projectId);
    var snapshot = LedgerSnapshot.of(normalizer.normalize(source.records(), now));

    var activeTasks = readActiveTasks(projectId);
    var tasks = activeTasks.orElse(List.of());
    var context =
        SynthesisContext.builder(projectId)
            .projectTrade(project.getTrade())
            .projectAddress(project.getAddress())
            .tasks(tasks)
            .members(
                safeList(() -> teamMemberRepository.findByProjectId(projectId), "team", projectId))
            .invitations(
                safeList(
                    () ->
                        teamInvitationRepository.findByProjectIdAndStatus(
                            projectId, InvitationStatus.PENDING),
                    "invitations",
                    projectId))
            .financialTotal(financialTotal(source.financial()))
            .contracts(
                safeList(
                    () -> contractRepository.findByProjectId(projectId), "contracts", projectId))
            .weather(weatherService::tryFetch)
            .now(now)
            .build();

    var result = synthesizer.synthesize(snapshot, context);
    result
        .pendingWrites()
        .forEach(write -> flushService.flush(projectId, write.rule(), write.citations()));

    if (!source.fromCache() && !source.failed()) {
      snapshotCache.put(projectId, toRecords(result.snapshot()));
    }

    // A failed task read is not an empty task list.
    var generated =
        activeTasks.isPresent()
            ? taskBootstrapService.bootstrapIfEmpty(
                projectId, tasks, result.snapshot(), source.financial())
            : List.<Task>of();
    var allTasks = new ArrayList<Task>(tasks);
    allTasks.addAll(generated);

    var session =
        new ProjectSession(
            UUID.randomUUID(),
            projectId,
            memberId,
            access.isOwner(),
            new CitationLedger(result.snapshot()),
            new TaskMirror(allTasks.stream().map(TaskView::from).toList()),
            new PendingChangeMirror(visiblePendingChanges(project, access)),
            now);
    sessionRegistry.register(session);

    log.info(
        "Loaded project {} for member {} (role={}): {} citation(s), {} synthesized, {} task(s)"
            + " generated, fromCache={}",
        projectId,
        memberId,
        access.role(),
        result.snapshot().size(),
        result.synthesized().size(),
        generated.size(),
        source.fromCache());

    return projection.view(
        session,
        access,
        new ProjectFactsView.LoadSummary(
            source.fromCache(), result.synthesized().size(), generated.size()));
  }

  /** Re-projects an open session, e.g. after change-feed updates, without reloading. */
  public ProjectFactsView view(UUID sessionId, UUID memberId) {
    var session = requireSession(sessionId, memberId);
    var access = projectAccessService.resolve(session.projectId(), memberId);
    return projection.view(session, access, null);
  }

  /**
   * One review section of an open session.
   *
   * @throws ForbiddenException if the caller's role cannot see the section
   */
  public SectionView section(UUID sessionId, UUID memberId, String sectionKey) {
    var section =
        ReviewSection.find(sectionKey)
            .orElseThrow(() -> new ResourceNotFoundException("Section", sectionKey));
    var session = requireSession(sessionId, memberId);
    var access = projectAccessService.resolve(session.projectId(), memberId);
    if (!section.isVisibleTo(access.role())) {
      throw new ForbiddenException(
          "Section not visible",
          "Section '" + section.title() + "' requires " + section.requiredTier() + " access",
          section.requiredTier());
    }
    return projection.section(section, session.ledger().all(), access);
  }

  /** New pending changes that arrived since the last call, for the owner's notification badge. */
  public List<PendingChangeView> drainArrivals(UUID sessionId, UUID memberId) {
    var session = requireSession(sessionId, memberId);
    return session.owner() ? session.pendingChanges().drainArrivals() : List.of();
  }

  private ProjectSession requireSession(UUID sessionId, UUID memberId) {
    return sessionRegistry
        .find(sessionId)
        .filter(s -> s.memberId().equals(memberId))
        .orElseThrow(() -> new ResourceNotFoundException("Session", sessionId));
  }

  private LoadedRecords readRecords(UUID projectId) {
    try {
      var stored = factsStore.read(projectId);
      if (!stored.isEmpty()) {
        return new LoadedRecords(stored.records(), stored.financial(), false, false);
      }
      var cached = snapshotCache.get(projectId);
      if (cached.isPresent() && !cached.get().isEmpty()) {
        log.info("Primary store has no facts for project {}, using cached snapshot", projectId);
        return new LoadedRecords(cached.get(), stored.financial(), true, false);
      }
      return new LoadedRecords(List.of(), stored.financial(), false, false);
    } catch (SourceUnavailableException e) {
      log.warn("Primary facts read failed for project {}, falling back to cache", projectId, e);
      var cached = snapshotCache.get(projectId);
      return new LoadedRecords(cached.orElse(List.of()), null, cached.isPresent(), true);
    }
  }

  private List<PendingChangeView> visiblePendingChanges(Project project, ProjectAccess access) {
    var changes =
        safeList(
            () ->
                access.isOwner()
                    ? pendingChangeRepository.findByProjectId(project.getId())
                    : pendingChangeRepository.findByProjectIdAndRequestedBy(
                        project.getId(), access.memberId()),
            "pending changes",
            project.getId());
    return changes.stream().map(PendingChangeView::from).toList();
  }

  private Optional<List<Task>> readActiveTasks(UUID projectId) {
    try {
      return Optional.of(taskRepository.findActiveByProjectId(projectId));
    } catch (RuntimeException e) {
      log.warn(
          "Could not read tasks for project {}, skipping task generation for this load",
          projectId,
          e);
      return Optional.empty();
    }
  }

  private static <T> List<T> safeList(Supplier<List<T>> query, String what, UUID projectId) {
    try {
      return query.get();
    } catch (RuntimeException e) {
      log.warn("Could not read {} for project {}, continuing without them", what, projectId, e);
      return List.of();
    }
  }

  private static BigDecimal financialTotal(ProjectFinancialSummary financial) {
    return financial != null ? financial.getTotalCost() : null;
  }

  private static List<Map<String, Object>> toRecords(LedgerSnapshot snapshot) {
    return snapshot.all().stream().map(Citation::toRecord).toList();
  }

  private record LoadedRecords(
      List<Map<String, Object>> records,
      ProjectFinancialSummary financial,
      boolean fromCache,
      boolean failed) {}
}
