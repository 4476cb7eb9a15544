package io.buildunion.factcore.project;

import io.buildunion.factcore.access.ProjectAccessService;
import io.buildunion.factcore.exception.ResourceNotFoundException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ProjectService {

  private static final Logger log = LoggerFactory.getLogger(ProjectService.class);

  private final ProjectRepository projectRepository;
  private final ProjectAccessService projectAccessService;

  public ProjectService(
      ProjectRepository projectRepository, ProjectAccessService projectAccessService) {
    this.projectRepository = projectRepository;
    this.projectAccessService = projectAccessService;
  }

  /** Owner-only switch granting the owner write access to project facts. */
  @Transactional
  public Project setEditMode(UUID projectId, UUID memberId, boolean enabled) {
    projectAccessService.requireOwner(projectId, memberId);
    var project =
        projectRepository
            .findById(projectId)
            .orElseThrow(() -> new ResourceNotFoundException("Project", projectId));
    project.setEditModeEnabled(enabled);
    var saved = projectRepository.save(project);
    log.info("Edit mode {} for project {}", enabled ? "enabled" : "disabled", projectId);
    return saved;
  }
}
