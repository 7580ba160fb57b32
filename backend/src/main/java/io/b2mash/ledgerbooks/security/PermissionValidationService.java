package io.b2mash.ledgerbooks.security;

import io.b2mash.ledgerbooks.identity.Actor;
import io.b2mash.ledgerbooks.member.Membership;
import io.b2mash.ledgerbooks.member.MembershipService;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Answers "what may I do here?" for clients that adapt their UI to the caller's role. */
@Service
public class PermissionValidationService {

  private final MembershipService membershipService;
  private final PermissionEvaluator permissionEvaluator;

  public PermissionValidationService(
      MembershipService membershipService, PermissionEvaluator permissionEvaluator) {
    this.membershipService = membershipService;
    this.permissionEvaluator = permissionEvaluator;
  }

  /**
   * Evaluates the requested permission names for the actor. Names outside {@link OrgPermission}
   * only require membership. When both {@code targetUserId} and {@code action} are given, also
   * decides whether the actor may perform that action against the target.
   */
  @Transactional(readOnly = true)
  public PermissionReport validate(
      UUID organizationId,
      List<String> permissionNames,
      UUID targetUserId,
      ManagementAction action,
      Actor actor) {
    Membership actorMembership =
        membershipService.requireRole(organizationId, actor.userId(), OrgRole.MEMBER);
    OrgRole actorRole = actorMembership.getRole();

    var permissions = new LinkedHashMap<String, Boolean>();
    if (permissionNames != null) {
      for (String name : permissionNames) {
        boolean allowed =
            OrgPermission.fromKey(name)
                .map(permission -> permissionEvaluator.isAllowed(actorRole, permission))
                .orElse(true);
        permissions.put(name, allowed);
      }
    }

    Boolean canManageTarget = null;
    if (targetUserId != null && action != null) {
      canManageTarget = canManageTarget(organizationId, actorRole, actor, targetUserId, action);
      permissions.put("can_" + action.value() + "_" + targetUserId, canManageTarget);
    }

    return new PermissionReport(actorRole, permissions, canManageTarget);
  }

  private boolean canManageTarget(
      UUID organizationId,
      OrgRole actorRole,
      Actor actor,
      UUID targetUserId,
      ManagementAction action) {
    boolean selfTarget = targetUserId.equals(actor.userId());
    var targetRole = membershipService.findRole(organizationId, targetUserId);
    if (targetRole.isEmpty()) {
      return action == ManagementAction.INVITE
          && permissionEvaluator.canManage(actorRole, OrgRole.MEMBER, action, selfTarget);
    }
    return permissionEvaluator.canManage(actorRole, targetRole.get(), action, selfTarget);
  }

  public record PermissionReport(
      OrgRole userRole, Map<String, Boolean> permissions, Boolean canManageTarget) {}
}
