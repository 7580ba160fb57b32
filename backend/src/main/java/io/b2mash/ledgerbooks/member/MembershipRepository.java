package io.b2mash.ledgerbooks.member;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MembershipRepository extends JpaRepository<Membership, UUID> {

  Optional<Membership> findByOrganizationIdAndUserId(UUID organizationId, UUID userId);

  List<Membership> findByOrganizationIdOrderByCreatedAtAsc(UUID organizationId);

  List<Membership> findByUserIdOrderByCreatedAtAsc(UUID userId);

  @Query(
      "SELECT COUNT(m) > 0 FROM Membership m"
          + " WHERE m.organizationId = :organizationId AND LOWER(m.email) = LOWER(:email)")
  boolean existsByOrganizationIdAndEmail(
      @Param("organizationId") UUID organizationId, @Param("email") String email);
}
