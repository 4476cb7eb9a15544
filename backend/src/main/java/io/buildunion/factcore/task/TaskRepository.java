package io.buildunion.factcore.task;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TaskRepository extends JpaRepository<Task, UUID> {

  @Query(
      """
      SELECT t FROM Task t
      WHERE t.projectId = :projectId AND t.archivedAt IS NULL
      ORDER BY t.dueDate ASC NULLS LAST, t.createdAt ASC
      """)
  List<Task> findActiveByProjectId(@Param("projectId") UUID projectId);

  @Query("SELECT COUNT(t) FROM Task t WHERE t.projectId = :projectId AND t.archivedAt IS NULL")
  long countActiveByProjectId(@Param("projectId") UUID projectId);
}
