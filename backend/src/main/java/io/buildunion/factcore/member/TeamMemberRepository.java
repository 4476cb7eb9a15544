package io.buildunion.factcore.member;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TeamMemberRepository extends JpaRepository<TeamMember, UUID> {

  @Query("SELECT m FROM TeamMember m WHERE m.projectId = :projectId ORDER BY m.createdAt ASC")
  List<TeamMember> findByProjectId(@Param("projectId") UUID projectId);

  Optional<TeamMember> findByProjectIdAndUserId(UUID projectId, UUID userId);
}
