package io.b2mash.ledgerbooks.audit;

import java.time.Instant;
import java.util.UUID;

/**
 * Query filter for {@link AuditService#query}. All fields are nullable: null means "no filter on
 * this field".
 *
 * @param action filter by action
 * @param tableName filter by affected record kind
 * @param userId filter by acting user
 * @param startDate start of time range (inclusive)
 * @param endDate end of time range (inclusive)
 */
public record AuditLogFilter(
    AuditAction action, String tableName, UUID userId, Instant startDate, Instant endDate) {

  public static AuditLogFilter none() {
    return new AuditLogFilter(null, null, null, null, null);
  }
}
