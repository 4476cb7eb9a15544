package io.buildunion.factcore.notification;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface NotificationRepository extends JpaRepository<Notification, UUID> {

  @Query(
      """
      SELECT n FROM Notification n
      WHERE n.recipientMemberId = :memberId
      ORDER BY n.createdAt DESC
      """)
  List<Notification> findByRecipientMemberId(@Param("memberId") UUID memberId);

  boolean existsByRecipientMemberIdAndTypeAndReferenceEntityId(
      UUID recipientMemberId, String type, UUID referenceEntityId);
}
