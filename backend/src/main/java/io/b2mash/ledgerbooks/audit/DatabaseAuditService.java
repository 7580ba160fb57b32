package io.b2mash.ledgerbooks.audit;

import io.b2mash.ledgerbooks.exception.InvalidStateException;
import io.b2mash.ledgerbooks.identity.Actor;
import io.b2mash.ledgerbooks.member.MembershipService;
import io.b2mash.ledgerbooks.security.OrgPermission;
import io.b2mash.ledgerbooks.security.OrgRole;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Database-backed implementation of {@link AuditService}.
 *
 * <p>Transaction semantics: {@code record()} always runs in a new transaction (REQUIRES_NEW) and
 * never throws. An audit write that fails does not roll back the action it describes.
 */
@Service
public class DatabaseAuditService implements AuditService {

  private static final Logger log = LoggerFactory.getLogger(DatabaseAuditService.class);

  private static final Set<AuditAction> MANUAL_ACTIONS =
      Set.of(
          AuditAction.LOGIN, AuditAction.LOGOUT, AuditAction.INVITE_SENT, AuditAction.ROLE_CHANGED);

  private final AuditLogRepository auditLogRepository;
  private final MembershipService membershipService;
  private final TransactionTemplate requiresNewTemplate;

  public DatabaseAuditService(
      AuditLogRepository auditLogRepository,
      MembershipService membershipService,
      PlatformTransactionManager transactionManager) {
    this.auditLogRepository = auditLogRepository;
    this.membershipService = membershipService;
    this.requiresNewTemplate = new TransactionTemplate(transactionManager);
    this.requiresNewTemplate.setPropagationBehavior(
        TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  @Override
  public void record(AuditEvent event) {
    try {
      requiresNewTemplate.executeWithoutResult(
          status -> auditLogRepository.save(new AuditLogEntry(event)));
      log.debug(
          "Recorded audit entry: action={}, table={}, record={}, org={}, user={}",
          event.action().value(),
          event.tableName(),
          event.recordId(),
          event.organizationId(),
          event.userId());
    } catch (RuntimeException e) {
      log.error(
          "Failed to record audit entry: action={}, table={}, record={}, org={}",
          event.action() != null ? event.action().value() : null,
          event.tableName(),
          event.recordId(),
          event.organizationId(),
          e);
    }
  }

  @Override
  @Transactional(readOnly = true)
  public AuditLogPage<AuditLogEntry> query(
      UUID organizationId, AuditLogFilter filter, int page, int limit, Actor actor) {
    if (page < 1) {
      throw new InvalidStateException("Invalid page", "page must be 1 or greater");
    }
    if (limit < 1 || limit > MAX_LIMIT) {
      throw new InvalidStateException(
          "Invalid limit", "limit must be between 1 and " + MAX_LIMIT);
    }
    membershipService.requirePermission(organizationId, actor, OrgPermission.VIEW_AUDIT_LOGS);

    var effective = filter != null ? filter : AuditLogFilter.none();
    var result =
        auditLogRepository.findByFilter(
            organizationId,
            effective.action(),
            effective.tableName(),
            effective.userId(),
            effective.startDate(),
            effective.endDate(),
            PageRequest.of(page - 1, limit));

    return new AuditLogPage<>(
        result.getContent(),
        AuditLogPage.Pagination.of(page, limit, result.getTotalElements()));
  }

  @Override
  @Transactional
  public void recordManual(
      UUID organizationId,
      AuditAction action,
      String tableName,
      UUID recordId,
      Map<String, Object> metadata,
      Actor actor) {
    if (!MANUAL_ACTIONS.contains(action)) {
      throw new InvalidStateException(
          "Invalid action", "Action '" + action.value() + "' cannot be recorded manually");
    }
    membershipService.requireRole(organizationId, actor.userId(), OrgRole.MEMBER);
    if (action == AuditAction.INVITE_SENT) {
      membershipService.requirePermission(organizationId, actor, OrgPermission.INVITE_USERS);
    } else if (action == AuditAction.ROLE_CHANGED) {
      membershipService.requirePermission(organizationId, actor, OrgPermission.CHANGE_ROLES);
    }

    var event =
        AuditEventBuilder.builder()
            .organizationId(organizationId)
            .userId(actor.userId())
            .action(action)
            .tableName(tableName)
            .recordId(recordId)
            .newValues(metadata)
            .build();
    auditLogRepository.save(new AuditLogEntry(event));
    log.info(
        "Recorded manual audit entry: action={}, table={}, org={}",
        action.value(),
        tableName,
        organizationId);
  }
}
