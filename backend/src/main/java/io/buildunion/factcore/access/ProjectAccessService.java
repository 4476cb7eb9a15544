package io.buildunion.factcore.access;

import io.buildunion.factcore.exception.ForbiddenException;
import io.buildunion.factcore.exception.ResourceNotFoundException;
import io.buildunion.factcore.member.TeamMember;
import io.buildunion.factcore.member.TeamMemberRepository;
import io.buildunion.factcore.project.Project;
import io.buildunion.factcore.project.ProjectRepository;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ProjectAccessService {

  private final ProjectRepository projectRepository;
  private final TeamMemberRepository teamMemberRepository;

  public ProjectAccessService(
      ProjectRepository projectRepository, TeamMemberRepository teamMemberRepository) {
    this.projectRepository = projectRepository;
    this.teamMemberRepository = teamMemberRepository;
  }

  /**
   * Resolves the caller's project role: {@code owner} for the project owner, otherwise the roster
   * role, or null (public tier) for non-members.
   */
  @Transactional(readOnly = true)
  public ProjectAccess resolve(UUID projectId, UUID memberId) {
    var project =
        projectRepository
            .findById(projectId)
            .orElseThrow(() -> new ResourceNotFoundException("Project", projectId));
    return resolve(project, memberId);
  }

  @Transactional(readOnly = true)
  public ProjectAccess resolve(Project project, UUID memberId) {
    String role;
    if (project.isOwnedBy(memberId)) {
      role = ProjectRoles.OWNER;
    } else {
      role =
          teamMemberRepository
              .findByProjectIdAndUserId(project.getId(), memberId)
              .map(TeamMember::getRole)
              .orElse(null);
    }
    return new ProjectAccess(
        project.getId(),
        memberId,
        role,
        AccessTierResolver.tierOf(role),
        project.isEditModeEnabled());
  }

  /** Resolves access and throws if the caller may not edit project facts. */
  @Transactional(readOnly = true)
  public ProjectAccess requireEditAccess(UUID projectId, UUID memberId) {
    var access = resolve(projectId, memberId);
    if (!access.canEdit()) {
      throw new ForbiddenException(
          "Cannot edit project facts",
          "Role '" + access.role() + "' cannot edit facts of project " + projectId);
    }
    return access;
  }

  @Transactional(readOnly = true)
  public ProjectAccess requireOwner(UUID projectId, UUID memberId) {
    var access = resolve(projectId, memberId);
    if (!access.isOwner()) {
      throw new ForbiddenException(
          "Owner access required", "Only the project owner can perform this action");
    }
    return access;
  }
}
