package io.b2mash.ledgerbooks.member;

import io.b2mash.ledgerbooks.audit.AuditAction;
import io.b2mash.ledgerbooks.audit.AuditEventBuilder;
import io.b2mash.ledgerbooks.exception.ForbiddenException;
import io.b2mash.ledgerbooks.exception.InvalidStateException;
import io.b2mash.ledgerbooks.exception.ResourceConflictException;
import io.b2mash.ledgerbooks.exception.ResourceNotFoundException;
import io.b2mash.ledgerbooks.identity.Actor;
import io.b2mash.ledgerbooks.organization.Organization;
import io.b2mash.ledgerbooks.organization.OrganizationRepository;
import io.b2mash.ledgerbooks.security.ManagementAction;
import io.b2mash.ledgerbooks.security.OrgPermission;
import io.b2mash.ledgerbooks.security.OrgRole;
import io.b2mash.ledgerbooks.security.PermissionEvaluator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Membership registry: who belongs to which organization, and with which role. */
@Service
public class MembershipService {

  static final String TABLE_NAME = "memberships";

  private static final Logger log = LoggerFactory.getLogger(MembershipService.class);

  private final MembershipRepository membershipRepository;
  private final OrganizationRepository organizationRepository;
  private final PermissionEvaluator permissionEvaluator;
  private final ApplicationEventPublisher eventPublisher;

  public MembershipService(
      MembershipRepository membershipRepository,
      OrganizationRepository organizationRepository,
      PermissionEvaluator permissionEvaluator,
      ApplicationEventPublisher eventPublisher) {
    this.membershipRepository = membershipRepository;
    this.organizationRepository = organizationRepository;
    this.permissionEvaluator = permissionEvaluator;
    this.eventPublisher = eventPublisher;
  }

  @Transactional(readOnly = true)
  public Optional<Membership> findMembership(UUID organizationId, UUID userId) {
    return membershipRepository.findByOrganizationIdAndUserId(organizationId, userId);
  }

  @Transactional(readOnly = true)
  public Optional<OrgRole> findRole(UUID organizationId, UUID userId) {
    return findMembership(organizationId, userId).map(Membership::getRole);
  }

  /**
   * Returns the user's membership in the organization, throwing {@link ForbiddenException} when the
   * user is not a member or holds a role below {@code requiredRole}.
   */
  @Transactional(readOnly = true)
  public Membership requireRole(UUID organizationId, UUID userId, OrgRole requiredRole) {
    var membership =
        membershipRepository
            .findByOrganizationIdAndUserId(organizationId, userId)
            .orElseThrow(
                () ->
                    new ForbiddenException(
                        "Not a member", "You are not a member of this organization"));
    if (!permissionEvaluator.hasRole(membership.getRole(), requiredRole)) {
      throw new ForbiddenException(
          "Insufficient role", "This action requires the " + requiredRole.value() + " role");
    }
    return membership;
  }

  /** Same as {@link #requireRole} but phrased as an organization-level permission. */
  @Transactional(readOnly = true)
  public Membership requirePermission(
      UUID organizationId, Actor actor, OrgPermission permission) {
    var membership =
        membershipRepository
            .findByOrganizationIdAndUserId(organizationId, actor.userId())
            .orElseThrow(
                () ->
                    new ForbiddenException(
                        "Not a member", "You are not a member of this organization"));
    if (!permissionEvaluator.isAllowed(membership.getRole(), permission)) {
      throw new ForbiddenException(
          "Insufficient permissions", "Missing permission " + permission.key());
    }
    return membership;
  }

  @Transactional(readOnly = true)
  public boolean isMemberByEmail(UUID organizationId, String email) {
    return membershipRepository.existsByOrganizationIdAndEmail(organizationId, email);
  }

  @Transactional(readOnly = true)
  public List<Membership> listForOrganization(UUID organizationId, Actor actor) {
    requireRole(organizationId, actor.userId(), OrgRole.MEMBER);
    return membershipRepository.findByOrganizationIdOrderByCreatedAtAsc(organizationId);
  }

  @Transactional(readOnly = true)
  public List<UserMembership> listForUser(Actor actor) {
    var memberships = membershipRepository.findByUserIdOrderByCreatedAtAsc(actor.userId());
    var organizations =
        organizationRepository
            .findAllById(memberships.stream().map(Membership::getOrganizationId).toList())
            .stream()
            .collect(Collectors.toMap(Organization::getId, Function.identity()));
    return memberships.stream()
        .map(m -> new UserMembership(m, organizations.get(m.getOrganizationId())))
        .toList();
  }

  /**
   * Changes a member's role. Checks run in a fixed order so that the most specific reason wins:
   * unknown membership, actor below admin, owner target, self target, management rule, role
   * assignment rule, owner requested.
   */
  @Transactional
  public Membership updateRole(UUID membershipId, OrgRole newRole, Actor actor) {
    var target =
        membershipRepository
            .findById(membershipId)
            .orElseThrow(() -> new ResourceNotFoundException("Membership", membershipId));
    var actorMembership = requireRole(target.getOrganizationId(), actor.userId(), OrgRole.ADMIN);

    checkManageable(actorMembership, target, ManagementAction.CHANGE_ROLE);
    if (newRole == OrgRole.OWNER) {
      throw new InvalidStateException(
          "Invalid role", "The owner role cannot be assigned to an existing member");
    }
    if (!permissionEvaluator.canAssignRole(actorMembership.getRole(), newRole)) {
      throw new ForbiddenException(
          "Insufficient permissions", "Only an owner can assign the " + newRole.value() + " role");
    }

    OrgRole oldRole = target.getRole();
    target.changeRole(newRole);
    var saved = membershipRepository.save(target);

    eventPublisher.publishEvent(
        AuditEventBuilder.builder()
            .organizationId(saved.getOrganizationId())
            .userId(actor.userId())
            .action(AuditAction.ROLE_CHANGED)
            .tableName(TABLE_NAME)
            .recordId(saved.getId())
            .oldValues(Map.of("role", oldRole.value()))
            .newValues(Map.of("role", newRole.value()))
            .build());

    log.info(
        "Changed role of membership {} in org {} from {} to {}",
        saved.getId(),
        saved.getOrganizationId(),
        oldRole.value(),
        newRole.value());
    return saved;
  }

  @Transactional
  public void remove(UUID membershipId, Actor actor) {
    var target =
        membershipRepository
            .findById(membershipId)
            .orElseThrow(() -> new ResourceNotFoundException("Membership", membershipId));
    var actorMembership = requireRole(target.getOrganizationId(), actor.userId(), OrgRole.ADMIN);

    checkManageable(actorMembership, target, ManagementAction.REMOVE);

    var snapshot = target.snapshot();
    membershipRepository.delete(target);

    eventPublisher.publishEvent(
        AuditEventBuilder.builder()
            .organizationId(target.getOrganizationId())
            .userId(actor.userId())
            .action(AuditAction.DELETE)
            .tableName(TABLE_NAME)
            .recordId(target.getId())
            .oldValues(snapshot)
            .build());

    log.info(
        "Removed membership {} (user {}) from org {}",
        target.getId(),
        target.getUserId(),
        target.getOrganizationId());
  }

  /** Creates the founder's owner membership. Runs inside the organization-creation transaction. */
  @Transactional
  public Membership createOwnerMembership(UUID organizationId, Actor founder) {
    return createMembership(organizationId, founder, OrgRole.OWNER);
  }

  /**
   * Inserts a membership and flushes so that a duplicate (organization, user) pair surfaces as a
   * {@code DataIntegrityViolationException} inside the caller's transaction.
   */
  @Transactional
  public Membership createMembership(UUID organizationId, Actor actor, OrgRole role) {
    var membership =
        membershipRepository.saveAndFlush(
            new Membership(organizationId, actor.userId(), actor.email(), role));

    eventPublisher.publishEvent(
        AuditEventBuilder.builder()
            .organizationId(organizationId)
            .userId(actor.userId())
            .action(AuditAction.CREATE)
            .tableName(TABLE_NAME)
            .recordId(membership.getId())
            .newValues(membership.snapshot())
            .build());

    log.info(
        "Created {} membership {} for user {} in org {}",
        role.value(),
        membership.getId(),
        actor.userId(),
        organizationId);
    return membership;
  }

  private void checkManageable(
      Membership actorMembership, Membership target, ManagementAction action) {
    if (target.getRole() == OrgRole.OWNER) {
      throw new ForbiddenException(
          "Insufficient permissions", "The organization owner cannot be modified or removed");
    }
    boolean selfTarget = target.getUserId().equals(actorMembership.getUserId());
    if (selfTarget) {
      throw new ResourceConflictException(
          "Self modification", "You cannot change or remove your own membership");
    }
    if (!permissionEvaluator.canManage(
        actorMembership.getRole(), target.getRole(), action, false)) {
      throw new ForbiddenException(
          "Insufficient permissions",
          "A "
              + actorMembership.getRole().value()
              + " cannot manage a "
              + target.getRole().value());
    }
  }

  /** A user's membership joined with the organization it belongs to. */
  public record UserMembership(Membership membership, Organization organization) {}
}
