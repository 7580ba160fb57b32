package io.b2mash.ledgerbooks.audit;

import java.util.List;
import java.util.function.Function;

/** One page of audit results with 1-based pagination metadata. */
public record AuditLogPage<T>(List<T> data, Pagination pagination) {

  public <R> AuditLogPage<R> map(Function<T, R> mapper) {
    return new AuditLogPage<>(data.stream().map(mapper).toList(), pagination);
  }

  public record Pagination(
      int page, int limit, long total, int totalPages, boolean hasNext, boolean hasPrev) {

    public static Pagination of(int page, int limit, long total) {
      int totalPages = (int) ((total + limit - 1) / limit);
      return new Pagination(page, limit, total, totalPages, page < totalPages, page > 1);
    }
  }
}
