package io.b2mash.ledgerbooks.organization;

import jakarta.persistence.LockModeType;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface OrganizationRepository extends JpaRepository<Organization, UUID> {

  @Query("SELECT COUNT(o) > 0 FROM Organization o WHERE LOWER(o.name) = LOWER(:name)")
  boolean existsByNameIgnoreCase(@Param("name") String name);

  /** Row-locks the organization so invitation inserts for it are serialized. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT o FROM Organization o WHERE o.id = :id")
  Optional<Organization> findByIdForUpdate(@Param("id") UUID id);
}
