package io.buildunion.factcore.citation;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProjectFactsRepository extends JpaRepository<ProjectFacts, UUID> {

  Optional<ProjectFacts> findByProjectId(UUID projectId);
}
