package io.b2mash.ledgerbooks.invitation;

import io.b2mash.ledgerbooks.audit.AuditAction;
import io.b2mash.ledgerbooks.audit.AuditEventBuilder;
import io.b2mash.ledgerbooks.exception.ForbiddenException;
import io.b2mash.ledgerbooks.exception.InvalidStateException;
import io.b2mash.ledgerbooks.exception.ResourceConflictException;
import io.b2mash.ledgerbooks.exception.ResourceGoneException;
import io.b2mash.ledgerbooks.exception.ResourceNotFoundException;
import io.b2mash.ledgerbooks.identity.Actor;
import io.b2mash.ledgerbooks.member.Membership;
import io.b2mash.ledgerbooks.member.MembershipService;
import io.b2mash.ledgerbooks.organization.Organization;
import io.b2mash.ledgerbooks.organization.OrganizationRepository;
import io.b2mash.ledgerbooks.security.ManagementAction;
import io.b2mash.ledgerbooks.security.OrgRole;
import io.b2mash.ledgerbooks.security.PermissionEvaluator;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Invitation workflow: create, accept, re-role, cancel, cleanup and statistics.
 *
 * <p>Lifecycle is derived from timestamps: pending while {@code usedAt} is null and {@code
 * expiresAt} is in the future, accepted once {@code usedAt} is set, expired otherwise. Cancelling
 * deletes the row.
 */
@Service
public class InvitationService {

  static final String TABLE_NAME = "invitations";

  private static final Logger log = LoggerFactory.getLogger(InvitationService.class);

  private final InvitationRepository invitationRepository;
  private final OrganizationRepository organizationRepository;
  private final MembershipService membershipService;
  private final PermissionEvaluator permissionEvaluator;
  private final InvitationCodeGenerator codeGenerator;
  private final InvitationProperties properties;
  private final ApplicationEventPublisher eventPublisher;
  private final TransactionTemplate requiresNewTemplate;

  public InvitationService(
      InvitationRepository invitationRepository,
      OrganizationRepository organizationRepository,
      MembershipService membershipService,
      PermissionEvaluator permissionEvaluator,
      InvitationCodeGenerator codeGenerator,
      InvitationProperties properties,
      ApplicationEventPublisher eventPublisher,
      PlatformTransactionManager transactionManager) {
    this.invitationRepository = invitationRepository;
    this.organizationRepository = organizationRepository;
    this.membershipService = membershipService;
    this.permissionEvaluator = permissionEvaluator;
    this.codeGenerator = codeGenerator;
    this.properties = properties;
    this.eventPublisher = eventPublisher;
    this.requiresNewTemplate = new TransactionTemplate(transactionManager);
    this.requiresNewTemplate.setPropagationBehavior(
        TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  /**
   * Creates a pending invitation. Each code attempt runs in its own transaction so that a unique
   * constraint violation on the code can be retried with a fresh code.
   */
  public Invitation create(UUID organizationId, String email, OrgRole role, Actor actor) {
    var actorMembership =
        membershipService.requireRole(organizationId, actor.userId(), OrgRole.ADMIN);
    OrgRole actorRole = actorMembership.getRole();

    if (role == OrgRole.OWNER) {
      throw new InvalidStateException("Invalid role", "Invitations cannot grant the owner role");
    }
    if (!permissionEvaluator.canManage(actorRole, role, ManagementAction.INVITE, false)
        || !permissionEvaluator.canAssignRole(actorRole, role)) {
      throw new ForbiddenException(
          "Insufficient permissions",
          "Only an owner can invite with the " + role.value() + " role");
    }

    var organization =
        organizationRepository
            .findById(organizationId)
            .orElseThrow(() -> new ResourceNotFoundException("Organization", organizationId));
    String normalizedEmail = email.trim().toLowerCase(Locale.ROOT);

    if (membershipService.isMemberByEmail(organizationId, normalizedEmail)) {
      throw new ResourceConflictException(
          "Already a member", "This user is already a member of the organization");
    }
    Instant now = Instant.now();
    if (invitationRepository.existsPending(organizationId, normalizedEmail, now)) {
      throw new ResourceConflictException(
          "Invitation pending", "A pending invitation already exists for this email");
    }

    int maxAttempts = properties.maxCodeAttempts();
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      String code = codeGenerator.generate();
      if (invitationRepository.existsByCode(code)) {
        log.debug("Invitation code collision on attempt {}", attempt);
        continue;
      }
      try {
        return requiresNewTemplate.execute(
            status -> insert(organization, normalizedEmail, role, code, actor));
      } catch (DataIntegrityViolationException e) {
        if (!invitationRepository.existsByCode(code)) {
          throw e;
        }
        log.warn("Invitation code rejected by store on attempt {}, retrying", attempt);
      }
    }

    log.error(
        "Could not generate a unique invitation code after {} attempts for org {}",
        maxAttempts,
        organizationId);
    throw new InvitationCodeExhaustedException(maxAttempts);
  }

  /**
   * Inserts under a row lock on the organization. The pending check is repeated under the lock so
   * that concurrent invitations for the same email cannot both be inserted.
   */
  private Invitation insert(
      Organization organization, String email, OrgRole role, String code, Actor actor) {
    organizationRepository
        .findByIdForUpdate(organization.getId())
        .orElseThrow(() -> new ResourceNotFoundException("Organization", organization.getId()));
    if (invitationRepository.existsPending(organization.getId(), email, Instant.now())) {
      throw new ResourceConflictException(
          "Invitation pending", "A pending invitation already exists for this email");
    }

    Instant expiresAt = Instant.now().plus(properties.expiry());
    var invitation =
        invitationRepository.saveAndFlush(
            new Invitation(organization.getId(), email, role, code, expiresAt, actor.userId()));

    eventPublisher.publishEvent(
        AuditEventBuilder.builder()
            .organizationId(organization.getId())
            .userId(actor.userId())
            .action(AuditAction.INVITE_SENT)
            .tableName(TABLE_NAME)
            .recordId(invitation.getId())
            .newValues(invitation.snapshot())
            .build());
    eventPublisher.publishEvent(
        new InvitationCreatedEvent(
            invitation.getId(),
            organization.getId(),
            organization.getName(),
            invitation.getEmail(),
            role,
            code,
            expiresAt,
            actor.email()));

    log.info(
        "Created {} invitation {} for org {}, expires {}",
        role.value(),
        invitation.getId(),
        organization.getId(),
        expiresAt);
    return invitation;
  }

  /**
   * Accepts an invitation on behalf of the actor. The invitation is claimed with a conditional
   * update and the membership is inserted in the same transaction, so a concurrent accept of the
   * same code, or a duplicate membership, rolls the whole sequence back.
   */
  @Transactional
  public Membership accept(String code, Actor actor) {
    String normalizedCode = code.trim().toUpperCase(Locale.ROOT);
    var invitation =
        invitationRepository
            .findByCode(normalizedCode)
            .orElseThrow(
                () ->
                    ResourceNotFoundException.withDetail(
                        "Invitation not found", "No invitation matches this code"));

    Instant now = Instant.now();
    if (invitation.isUsed()) {
      throw new ResourceConflictException(
          "Invitation already used", "This invitation has already been accepted");
    }
    if (invitation.isExpired(now)) {
      throw new ResourceGoneException("Invitation expired", "This invitation has expired");
    }
    if (actor.email() == null || !invitation.getEmail().equalsIgnoreCase(actor.email().trim())) {
      throw new ForbiddenException(
          "Email mismatch", "This invitation was issued to a different email address");
    }

    var before = invitation.snapshot();
    if (invitationRepository.markUsed(invitation.getId(), now) == 0) {
      throw new ResourceConflictException(
          "Invitation already used", "This invitation has already been accepted");
    }
    var after = new LinkedHashMap<>(before);
    after.put("used_at", now.toString());
    eventPublisher.publishEvent(
        AuditEventBuilder.builder()
            .organizationId(invitation.getOrganizationId())
            .userId(actor.userId())
            .action(AuditAction.UPDATE)
            .tableName(TABLE_NAME)
            .recordId(invitation.getId())
            .oldValues(before)
            .newValues(after)
            .build());

    var existing =
        membershipService.findMembership(invitation.getOrganizationId(), actor.userId());
    if (existing.isPresent()) {
      log.info(
          "Invitation {} accepted by existing member {} of org {}",
          invitation.getId(),
          actor.userId(),
          invitation.getOrganizationId());
      return existing.get();
    }

    Membership membership;
    try {
      membership =
          membershipService.createMembership(
              invitation.getOrganizationId(), actor, invitation.getRole());
    } catch (DataIntegrityViolationException e) {
      throw new ResourceConflictException(
          "Already a member", "You are already a member of this organization");
    }

    log.info(
        "Invitation {} accepted by {}, joined org {} as {}",
        invitation.getId(),
        actor.userId(),
        invitation.getOrganizationId(),
        invitation.getRole().value());
    return membership;
  }

  @Transactional
  public Invitation updateRole(UUID invitationId, OrgRole newRole, Actor actor) {
    var invitation = findInvitation(invitationId);
    var actorMembership =
        membershipService.requireRole(
            invitation.getOrganizationId(), actor.userId(), OrgRole.ADMIN);
    if (invitation.isUsed()) {
      throw new ResourceConflictException(
          "Invitation already used", "An accepted invitation cannot be changed");
    }
    if (newRole == OrgRole.OWNER) {
      throw new InvalidStateException("Invalid role", "Invitations cannot grant the owner role");
    }
    if (!permissionEvaluator.canAssignRole(actorMembership.getRole(), newRole)) {
      throw new ForbiddenException(
          "Insufficient permissions",
          "Only an owner can invite with the " + newRole.value() + " role");
    }

    OrgRole oldRole = invitation.getRole();
    invitation.changeRole(newRole);
    var saved = invitationRepository.save(invitation);

    eventPublisher.publishEvent(
        AuditEventBuilder.builder()
            .organizationId(saved.getOrganizationId())
            .userId(actor.userId())
            .action(AuditAction.UPDATE)
            .tableName(TABLE_NAME)
            .recordId(saved.getId())
            .oldValues(Map.of("role", oldRole.value()))
            .newValues(Map.of("role", newRole.value()))
            .build());

    log.info(
        "Changed role of invitation {} from {} to {}",
        saved.getId(),
        oldRole.value(),
        newRole.value());
    return saved;
  }

  @Transactional
  public void cancel(UUID invitationId, Actor actor) {
    var invitation = findInvitation(invitationId);
    membershipService.requireRole(invitation.getOrganizationId(), actor.userId(), OrgRole.ADMIN);
    if (invitation.isUsed()) {
      throw new ResourceConflictException(
          "Invitation already used", "An accepted invitation cannot be cancelled");
    }

    var snapshot = invitation.snapshot();
    invitationRepository.delete(invitation);

    eventPublisher.publishEvent(
        AuditEventBuilder.builder()
            .organizationId(invitation.getOrganizationId())
            .userId(actor.userId())
            .action(AuditAction.DELETE)
            .tableName(TABLE_NAME)
            .recordId(invitation.getId())
            .oldValues(snapshot)
            .build());

    log.info(
        "Cancelled invitation {} in org {}", invitation.getId(), invitation.getOrganizationId());
  }

  /** Deletes unused invitations that expired more than {@code daysOld} days ago. */
  @Transactional
  public int cleanup(int daysOld) {
    if (daysOld < 0) {
      throw new InvalidStateException("Invalid retention", "daysOld must not be negative");
    }
    Instant cutoff = Instant.now().minus(Duration.ofDays(daysOld));
    int deleted = invitationRepository.deleteExpiredUnused(cutoff);
    log.info("Invitation cleanup deleted {} invitations expired before {}", deleted, cutoff);
    return deleted;
  }

  @Transactional
  public int cleanup() {
    return cleanup(properties.cleanupRetentionDays());
  }

  @Transactional(readOnly = true)
  public InvitationStats stats() {
    return computeStats(null);
  }

  @Transactional(readOnly = true)
  public InvitationStats stats(UUID organizationId) {
    return computeStats(organizationId);
  }

  @Transactional(readOnly = true)
  public Invitation findById(UUID invitationId, Actor actor) {
    var invitation = findInvitation(invitationId);
    membershipService.requireRole(invitation.getOrganizationId(), actor.userId(), OrgRole.ADMIN);
    return invitation;
  }

  @Transactional(readOnly = true)
  public List<Invitation> listForOrganization(UUID organizationId, Actor actor) {
    membershipService.requireRole(organizationId, actor.userId(), OrgRole.ADMIN);
    return invitationRepository.findByOrganizationIdOrderByCreatedAtDesc(organizationId);
  }

  /** Public lookup used by the invitee before signing in. */
  @Transactional(readOnly = true)
  public InvitationDetails findDetailsByCode(String code) {
    var invitation =
        invitationRepository
            .findByCode(code.trim().toUpperCase(Locale.ROOT))
            .orElseThrow(
                () ->
                    ResourceNotFoundException.withDetail(
                        "Invitation not found", "No invitation matches this code"));
    var organization =
        organizationRepository
            .findById(invitation.getOrganizationId())
            .orElseThrow(
                () ->
                    new ResourceNotFoundException(
                        "Organization", invitation.getOrganizationId()));
    return new InvitationDetails(
        invitation.getId(),
        organization.getId(),
        organization.getName(),
        organization.getCurrency(),
        invitation.getEmail(),
        invitation.getRole(),
        invitation.getExpiresAt(),
        invitation.statusAt(Instant.now()));
  }

  private Invitation findInvitation(UUID invitationId) {
    return invitationRepository
        .findById(invitationId)
        .orElseThrow(() -> new ResourceNotFoundException("Invitation", invitationId));
  }

  private InvitationStats computeStats(UUID organizationId) {
    Instant now = Instant.now();
    return InvitationStats.of(
        invitationRepository.countAll(organizationId),
        invitationRepository.countAccepted(organizationId),
        invitationRepository.countPending(organizationId, now),
        invitationRepository.countExpired(organizationId, now));
  }
}
