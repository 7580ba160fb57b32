package io.b2mash.ledgerbooks.audit;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Row of the {@code audit_logs} table. Entries are never updated or deleted (enforced by a
 * database trigger), so the entity has no setters.
 */
@Entity
@Table(name = "audit_logs")
public class AuditLogEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "organization_id")
  private UUID organizationId;

  @Column(name = "user_id")
  private UUID userId;

  @Column(name = "action", nullable = false, length = 50)
  private AuditAction action;

  @Column(name = "table_name", nullable = false, length = 100)
  private String tableName;

  @Column(name = "record_id")
  private UUID recordId;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "old_values", columnDefinition = "jsonb")
  private Map<String, Object> oldValues;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "new_values", columnDefinition = "jsonb")
  private Map<String, Object> newValues;

  @Column(name = "ip_address", length = 45)
  private String ipAddress;

  @Column(name = "user_agent", length = 500)
  private String userAgent;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected AuditLogEntry() {}

  public AuditLogEntry(AuditEvent event) {
    this.organizationId = event.organizationId();
    this.userId = event.userId();
    this.action = event.action();
    this.tableName = event.tableName();
    this.recordId = event.recordId();
    this.oldValues = event.oldValues();
    this.newValues = event.newValues();
    this.ipAddress = event.ipAddress();
    this.userAgent = event.userAgent();
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

  public AuditAction getAction() {
    return action;
  }

  public String getTableName() {
    return tableName;
  }

  public UUID getRecordId() {
    return recordId;
  }

  public Map<String, Object> getOldValues() {
    return oldValues;
  }

  public Map<String, Object> getNewValues() {
    return newValues;
  }

  public String getIpAddress() {
    return ipAddress;
  }

  public String getUserAgent() {
    return userAgent;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
