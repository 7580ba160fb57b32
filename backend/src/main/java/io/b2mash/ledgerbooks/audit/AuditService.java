package io.b2mash.ledgerbooks.audit;

import io.b2mash.ledgerbooks.identity.Actor;
import java.util.Map;
import java.util.UUID;

/** Appends to and reads from the organization audit trail. */
public interface AuditService {

  int DEFAULT_LIMIT = 20;
  int MAX_LIMIT = 100;

  /**
   * Appends an event in its own transaction. Never throws: a failed write is logged at ERROR and
   * dropped, so the action that produced the event is unaffected.
   */
  void record(AuditEvent event);

  /**
   * Returns entries of one organization matching the filter, newest first. The actor must be a
   * member of the organization.
   *
   * @param page 1-based page number
   * @param limit page size, 1..100
   */
  AuditLogPage<AuditLogEntry> query(
      UUID organizationId, AuditLogFilter filter, int page, int limit, Actor actor);

  /**
   * Records an action reported by a client (login, logout, invite_sent, role_changed). Permission
   * rules depend on the action; {@code metadata} is stored as the entry's new values.
   */
  void recordManual(
      UUID organizationId,
      AuditAction action,
      String tableName,
      UUID recordId,
      Map<String, Object> metadata,
      Actor actor);
}
