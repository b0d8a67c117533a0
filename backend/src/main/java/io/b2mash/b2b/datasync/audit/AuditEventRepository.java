package io.b2mash.b2b.datasync.audit;

import java.time.Instant;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AuditEventRepository extends JpaRepository<AuditEvent, UUID> {

  /** Nullable filters use {@code (:param IS NULL OR e.field = :param)}; event type is a prefix. */
  @Query(
      """
      SELECT e FROM AuditEvent e
      WHERE e.tenantId = :tenantId
        AND (CAST(:resourceType AS string) IS NULL OR e.resourceType = :resourceType)
        AND (:resourceId IS NULL OR e.resourceId = :resourceId)
        AND (CAST(:actorId AS string) IS NULL OR e.actorId = :actorId)
        AND (CAST(:eventTypePrefix AS string) IS NULL OR e.eventType LIKE CONCAT(CAST(:eventTypePrefix AS string), '%'))
        AND (CAST(:from AS timestamp) IS NULL OR e.occurredAt >= :from)
        AND (CAST(:to AS timestamp) IS NULL OR e.occurredAt < :to)
      ORDER BY e.occurredAt DESC
      """)
  Page<AuditEvent> findByFilter(
      @Param("tenantId") UUID tenantId,
      @Param("resourceType") String resourceType,
      @Param("resourceId") UUID resourceId,
      @Param("actorId") String actorId,
      @Param("eventTypePrefix") String eventTypePrefix,
      @Param("from") Instant from,
      @Param("to") Instant to,
      Pageable pageable);

  long countByTenantIdAndResourceId(UUID tenantId, UUID resourceId);
}
