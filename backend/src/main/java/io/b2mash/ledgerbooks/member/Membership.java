package io.b2mash.ledgerbooks.member;

import io.b2mash.ledgerbooks.security.OrgRole;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "memberships")
public class Membership {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "organization_id", nullable = false, updatable = false)
  private UUID organizationId;

  @Column(name = "user_id", nullable = false, updatable = false)
  private UUID userId;

  @Column(name = "email", length = 255)
  private String email;

  @Column(name = "role", nullable = false, length = 20)
  private OrgRole role;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Membership() {}

  public Membership(UUID organizationId, UUID userId, String email, OrgRole role) {
    this.organizationId = organizationId;
    this.userId = userId;
    this.email = email != null ? email.toLowerCase(Locale.ROOT) : null;
    this.role = role;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getOrganizationId() {
    return organizationId;
  }

  public UUID getUserId() {
    return userId;
  }

  public String getEmail() {
    return email;
  }

  public OrgRole getRole() {
    return role;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public void changeRole(OrgRole role) {
    this.role = role;
  }

  /** Column snapshot recorded in audit entries. */
  public Map<String, Object> snapshot() {
    var values = new LinkedHashMap<String, Object>();
    values.put("id", id);
    values.put("organization_id", organizationId);
    values.put("user_id", userId);
    values.put("email", email);
    values.put("role", role != null ? role.value() : null);
    return values;
  }
}
