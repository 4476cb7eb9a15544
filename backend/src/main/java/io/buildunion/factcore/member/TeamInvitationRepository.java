package io.buildunion.factcore.member;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TeamInvitationRepository extends JpaRepository<TeamInvitation, UUID> {

  List<TeamInvitation> findByProjectIdAndStatus(UUID projectId, InvitationStatus status);
}
