package io.b2mash.ledgerbooks.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Immutable description of a privileged action. Published through Spring's {@code
 * ApplicationEventPublisher} and appended to the audit log by {@link AuditEventListener}.
 *
 * @param organizationId organization the action happened in
 * @param userId acting user, null for system actions
 * @param action what happened
 * @param tableName kind of record affected (e.g. "memberships")
 * @param recordId affected record, null when the action has no record (login, logout)
 * @param oldValues snapshot before the change, nullable
 * @param newValues snapshot after the change, nullable
 * @param ipAddress client IP when the action came from an HTTP request
 * @param userAgent client user agent, truncated to 500 characters
 * @see AuditEventBuilder
 */
public record AuditEvent(
    UUID organizationId,
    UUID userId,
    AuditAction action,
    String tableName,
    UUID recordId,
    Map<String, Object> oldValues,
    Map<String, Object> newValues,
    String ipAddress,
    String userAgent) {}
