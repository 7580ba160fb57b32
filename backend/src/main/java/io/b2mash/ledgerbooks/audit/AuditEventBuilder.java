package io.b2mash.ledgerbooks.audit;

import io.b2mash.ledgerbooks.identity.RequestScopes;
import io.b2mash.ledgerbooks.security.ClientIpResolver;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import java.util.UUID;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Builder that constructs an {@link AuditEvent}. Auto-populates the acting user, IP address and
 * user agent from the current request when available.
 *
 * <p>Usage:
 *
 * <pre>{@code
 * AuditEvent event = AuditEventBuilder.builder()
 *     .organizationId(membership.getOrganizationId())
 *     .action(AuditAction.ROLE_CHANGED)
 *     .tableName("memberships")
 *     .recordId(membership.getId())
 *     .oldValues(Map.of("role", "member"))
 *     .newValues(Map.of("role", "admin"))
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  private static final int MAX_USER_AGENT_LENGTH = 500;
  private static final int MAX_IP_ADDRESS_LENGTH = 45;

  private UUID organizationId;
  private UUID userId;
  private AuditAction action;
  private String tableName;
  private UUID recordId;
  private Map<String, Object> oldValues;
  private Map<String, Object> newValues;

  private boolean userIdExplicitlySet;

  private AuditEventBuilder() {}

  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder organizationId(UUID organizationId) {
    this.organizationId = organizationId;
    return this;
  }

  public AuditEventBuilder userId(UUID userId) {
    this.userId = userId;
    this.userIdExplicitlySet = true;
    return this;
  }

  public AuditEventBuilder action(AuditAction action) {
    this.action = action;
    return this;
  }

  public AuditEventBuilder tableName(String tableName) {
    this.tableName = tableName;
    return this;
  }

  public AuditEventBuilder recordId(UUID recordId) {
    this.recordId = recordId;
    return this;
  }

  public AuditEventBuilder oldValues(Map<String, Object> oldValues) {
    this.oldValues = oldValues;
    return this;
  }

  public AuditEventBuilder newValues(Map<String, Object> newValues) {
    this.newValues = newValues;
    return this;
  }

  /**
   * Builds the {@link AuditEvent}. Where not set explicitly, {@code userId} comes from {@link
   * RequestScopes}; {@code ipAddress} and {@code userAgent} come from the current HTTP request.
   */
  public AuditEvent build() {
    if (action == null) {
      throw new IllegalStateException("Audit action is required");
    }

    UUID resolvedUserId = userIdExplicitlySet ? userId : RequestScopes.getUserIdOrNull();

    String ipAddress = null;
    String userAgent = null;
    HttpServletRequest request = resolveHttpRequest();
    if (request != null) {
      ipAddress = truncate(ClientIpResolver.resolve(request), MAX_IP_ADDRESS_LENGTH);
      userAgent = truncate(request.getHeader("User-Agent"), MAX_USER_AGENT_LENGTH);
    }

    return new AuditEvent(
        organizationId,
        resolvedUserId,
        action,
        tableName,
        recordId,
        oldValues,
        newValues,
        ipAddress,
        userAgent);
  }

  /** Client-supplied headers are cut to their column width so the insert cannot fail on them. */
  private static String truncate(String value, int maxLength) {
    if (value == null || value.length() <= maxLength) {
      return value;
    }
    return value.substring(0, maxLength);
  }

  private static HttpServletRequest resolveHttpRequest() {
    var attrs = RequestContextHolder.getRequestAttributes();
    if (attrs instanceof ServletRequestAttributes servletAttrs) {
      return servletAttrs.getRequest();
    }
    return null;
  }
}
