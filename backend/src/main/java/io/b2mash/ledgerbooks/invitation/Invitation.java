package io.b2mash.ledgerbooks.invitation;

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
@Table(name = "invitations")
public class Invitation {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "organization_id", nullable = false, updatable = false)
  private UUID organizationId;

  @Column(name = "email", nullable = false, length = 255)
  private String email;

  @Column(name = "role", nullable = false, length = 20)
  private OrgRole role;

  @Column(name = "code", nullable = false, unique = true, length = 50, updatable = false)
  private String code;

  @Column(name = "expires_at", nullable = false)
  private Instant expiresAt;

  @Column(name = "used_at")
  private Instant usedAt;

  @Column(name = "created_by", nullable = false, updatable = false)
  private UUID createdBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Invitation() {}

  public Invitation(
      UUID organizationId,
      String email,
      OrgRole role,
      String code,
      Instant expiresAt,
      UUID createdBy) {
    this.organizationId = organizationId;
    this.email = email.trim().toLowerCase(Locale.ROOT);
    this.role = role;
    this.code = code;
    this.expiresAt = expiresAt;
    this.createdBy = createdBy;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getOrganizationId() {
    return organizationId;
  }

  public String getEmail() {
    return email;
  }

  public OrgRole getRole() {
    return role;
  }

  public String getCode() {
    return code;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }

  public Instant getUsedAt() {
    return usedAt;
  }

  public UUID getCreatedBy() {
    return createdBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public boolean isUsed() {
    return usedAt != null;
  }

  public boolean isExpired(Instant now) {
    return !expiresAt.isAfter(now);
  }

  public InvitationStatus statusAt(Instant now) {
    if (isUsed()) {
      return InvitationStatus.ACCEPTED;
    }
    return isExpired(now) ? InvitationStatus.EXPIRED : InvitationStatus.PENDING;
  }

  public void changeRole(OrgRole role) {
    this.role = role;
  }

  /** Column snapshot recorded in audit entries. The code is left out. */
  public Map<String, Object> snapshot() {
    var values = new LinkedHashMap<String, Object>();
    values.put("id", id);
    values.put("organization_id", organizationId);
    values.put("email", email);
    values.put("role", role != null ? role.value() : null);
    values.put("expires_at", expiresAt != null ? expiresAt.toString() : null);
    values.put("used_at", usedAt != null ? usedAt.toString() : null);
    return values;
  }
}
