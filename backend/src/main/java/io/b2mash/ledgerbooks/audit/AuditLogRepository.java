package io.b2mash.ledgerbooks.audit;

import java.time.Instant;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AuditLogRepository extends JpaRepository<AuditLogEntry, UUID> {

  /**
   * Organization-scoped query with nullable filters, each of the form {@code (:param IS NULL OR
   * e.field = :param)}. Both date bounds are inclusive. Newest first.
   */
  @Query(
      """
      SELECT e FROM AuditLogEntry e
      WHERE e.organizationId = :organizationId
        AND (:action IS NULL OR e.action = :action)
        AND (CAST(:tableName AS string) IS NULL OR e.tableName = CAST(:tableName AS string))
        AND (:userId IS NULL OR e.userId = :userId)
        AND (CAST(:startDate AS timestamp) IS NULL OR e.createdAt >= :startDate)
        AND (CAST(:endDate AS timestamp) IS NULL OR e.createdAt <= :endDate)
      ORDER BY e.createdAt DESC
      """)
  Page<AuditLogEntry> findByFilter(
      @Param("organizationId") UUID organizationId,
      @Param("action") AuditAction action,
      @Param("tableName") String tableName,
      @Param("userId") UUID userId,
      @Param("startDate") Instant startDate,
      @Param("endDate") Instant endDate,
      Pageable pageable);
}
