package io.buildunion.factcore.project;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProjectFinancialSummaryRepository
    extends JpaRepository<ProjectFinancialSummary, UUID> {

  Optional<ProjectFinancialSummary> findByProjectId(UUID projectId);
}
