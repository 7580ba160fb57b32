package io.b2mash.ledgerbooks.invitation;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface InvitationRepository extends JpaRepository<Invitation, UUID> {

  boolean existsByCode(String code);

  Optional<Invitation> findByCode(String code);

  List<Invitation> findByOrganizationIdOrderByCreatedAtDesc(UUID organizationId);

  @Query(
      """
      SELECT COUNT(i) > 0 FROM Invitation i
      WHERE i.organizationId = :organizationId
        AND LOWER(i.email) = LOWER(:email)
        AND i.usedAt IS NULL
        AND i.expiresAt > :now
      """)
  boolean existsPending(
      @Param("organizationId") UUID organizationId,
      @Param("email") String email,
      @Param("now") Instant now);

  /**
   * Claims an invitation. Returns 1 when this call set {@code usedAt}, 0 when another request got
   * there first.
   */
  @Modifying
  @Query("UPDATE Invitation i SET i.usedAt = :now WHERE i.id = :id AND i.usedAt IS NULL")
  int markUsed(@Param("id") UUID id, @Param("now") Instant now);

  /** Deletes unused invitations that expired before {@code cutoff}. Used ones are kept. */
  @Modifying
  @Query("DELETE FROM Invitation i WHERE i.usedAt IS NULL AND i.expiresAt < :cutoff")
  int deleteExpiredUnused(@Param("cutoff") Instant cutoff);

  @Query(
      "SELECT COUNT(i) FROM Invitation i"
          + " WHERE (:organizationId IS NULL OR i.organizationId = :organizationId)")
  long countAll(@Param("organizationId") UUID organizationId);

  @Query(
      "SELECT COUNT(i) FROM Invitation i WHERE i.usedAt IS NOT NULL"
          + " AND (:organizationId IS NULL OR i.organizationId = :organizationId)")
  long countAccepted(@Param("organizationId") UUID organizationId);

  @Query(
      "SELECT COUNT(i) FROM Invitation i WHERE i.usedAt IS NULL AND i.expiresAt > :now"
          + " AND (:organizationId IS NULL OR i.organizationId = :organizationId)")
  long countPending(@Param("organizationId") UUID organizationId, @Param("now") Instant now);

  @Query(
      "SELECT COUNT(i) FROM Invitation i WHERE i.usedAt IS NULL AND i.expiresAt <= :now"
          + " AND (:organizationId IS NULL OR i.organizationId = :organizationId)")
  long countExpired(@Param("organizationId") UUID organizationId, @Param("now") Instant now);
}
