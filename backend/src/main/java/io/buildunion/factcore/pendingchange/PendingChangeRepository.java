package io.buildunion.factcore.pendingchange;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PendingChangeRepository extends JpaRepository<PendingChange, UUID> {

  @Query(
      """
      SELECT COUNT(pc) > 0 FROM PendingChange pc
      WHERE pc.projectId = :projectId
        AND pc.itemType = :itemType
        AND pc.itemId = :itemId
        AND pc.status = io.buildunion.factcore.pendingchange.PendingChangeStatus.PENDING
      """)
  boolean existsPending(
      @Param("projectId") UUID projectId,
      @Param("itemType") PendingItemType itemType,
      @Param("itemId") String itemId);

  @Query(
      "SELECT pc FROM PendingChange pc WHERE pc.projectId = :projectId ORDER BY pc.createdAt DESC")
  List<PendingChange> findByProjectId(@Param("projectId") UUID projectId);

  @Query(
      """
      SELECT pc FROM PendingChange pc
      WHERE pc.projectId = :projectId AND pc.requestedBy = :requestedBy
      ORDER BY pc.createdAt DESC
      """)
  List<PendingChange> findByProjectIdAndRequestedBy(
      @Param("projectId") UUID projectId, @Param("requestedBy") UUID requestedBy);
}
