package io.buildunion.factcore.contract;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ContractRepository extends JpaRepository<Contract, UUID> {

  @Query("SELECT c FROM Contract c WHERE c.projectId = :projectId ORDER BY c.createdAt ASC")
  List<Contract> findByProjectId(@Param("projectId") UUID projectId);
}
