package io.b2mash.ledgerbooks.security;

import org.springframework.stereotype.Component;

/**
 * Pure authorization decisions over {@link OrgRole}. Never touches storage; callers resolve roles
 * first and translate a {@code false} into a 403.
 */
@Component
public class PermissionEvaluator {

  public boolean hasRole(OrgRole actorRole, OrgRole requiredRole) {
    return OrgRole.hasRole(actorRole, requiredRole);
  }

  /**
   * Decides whether an actor may perform {@code action} against a member holding {@code
   * targetRole}. For {@link ManagementAction#INVITE} the target role is the role the invitation
   * would grant; whether that role may be granted at all is {@link #canAssignRole}'s concern.
   */
  public boolean canManage(
      OrgRole actorRole, OrgRole targetRole, ManagementAction action, boolean selfTarget) {
    if (actorRole == null || action == null) {
      return false;
    }
    if (selfTarget && action != ManagementAction.INVITE) {
      return false;
    }

    return switch (actorRole) {
      case OWNER -> action == ManagementAction.INVITE || targetRole != OrgRole.OWNER;
      case ADMIN -> action == ManagementAction.INVITE || targetRole == OrgRole.MEMBER;
      case MEMBER -> false;
    };
  }

  /** Only an owner can produce an admin. Nobody can produce an owner here. */
  public boolean canAssignRole(OrgRole actorRole, OrgRole newRole) {
    if (actorRole == null || newRole == null || newRole == OrgRole.OWNER) {
      return false;
    }
    if (newRole == OrgRole.ADMIN) {
      return actorRole == OrgRole.OWNER;
    }
    return hasRole(actorRole, OrgRole.ADMIN);
  }

  public boolean isAllowed(OrgRole actorRole, OrgPermission permission) {
    return permission != null && hasRole(actorRole, permission.minimumRole());
  }
}
