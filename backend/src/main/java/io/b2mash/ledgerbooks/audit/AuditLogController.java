package io.b2mash.ledgerbooks.audit;

import io.b2mash.ledgerbooks.exception.InvalidStateException;
import io.b2mash.ledgerbooks.identity.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/audit-logs")
public class AuditLogController {

  private final AuditService auditService;

  public AuditLogController(AuditService auditService) {
    this.auditService = auditService;
  }

  @GetMapping
  public ResponseEntity<AuditLogPage<AuditLogResponse>> listAuditLogs(
      @RequestParam UUID organizationId,
      @RequestParam(required = false) String action,
      @RequestParam(required = false) String tableName,
      @RequestParam(required = false) UUID userId,
      @RequestParam(required = false) Instant startDate,
      @RequestParam(required = false) Instant endDate,
      @RequestParam(defaultValue = "1") int page,
      @RequestParam(defaultValue = "" + AuditService.DEFAULT_LIMIT) int limit) {
    var filter =
        new AuditLogFilter(parseAction(action), tableName, userId, startDate, endDate);
    var result =
        auditService.query(organizationId, filter, page, limit, RequestScopes.requireActor());
    return ResponseEntity.ok(result.map(AuditLogResponse::from));
  }

  @PostMapping("/manual")
  public ResponseEntity<Map<String, Object>> recordManual(
      @Valid @RequestBody ManualAuditRequest request) {
    auditService.recordManual(
        request.organizationId(),
        parseAction(request.action()),
        request.tableName(),
        request.recordId(),
        request.metadata(),
        RequestScopes.requireActor());
    return ResponseEntity.ok(Map.of("success", true));
  }

  private static AuditAction parseAction(String action) {
    if (action == null || action.isBlank()) {
      return null;
    }
    try {
      return AuditAction.fromValue(action);
    } catch (IllegalArgumentException e) {
      throw new InvalidStateException("Invalid action", "Unknown audit action: " + action);
    }
  }

  // --- DTOs ---

  public record ManualAuditRequest(
      @NotNull(message = "organizationId is required") UUID organizationId,
      @NotBlank(message = "action is required") String action,
      @NotBlank(message = "tableName is required") @Size(max = 100) String tableName,
      UUID recordId,
      Map<String, Object> metadata) {}

  public record AuditLogResponse(
      UUID id,
      UUID organizationId,
      UUID userId,
      AuditAction action,
      String tableName,
      UUID recordId,
      Map<String, Object> oldValues,
      Map<String, Object> newValues,
      String ipAddress,
      String userAgent,
      Instant createdAt) {

    public static AuditLogResponse from(AuditLogEntry entry) {
      return new AuditLogResponse(
          entry.getId(),
          entry.getOrganizationId(),
          entry.getUserId(),
          entry.getAction(),
          entry.getTableName(),
          entry.getRecordId(),
          entry.getOldValues(),
          entry.getNewValues(),
          entry.getIpAddress(),
          entry.getUserAgent(),
          entry.getCreatedAt());
    }
  }
}
