package io.b2mash.ledgerbooks.security;

import java.util.Locale;
import java.util.Optional;

/** Static table of organization-level actions and the minimum role each requires. */
public enum OrgPermission {
  READ_ORGANIZATION(OrgRole.MEMBER),
  VIEW_AUDIT_LOGS(OrgRole.MEMBER),
  MANAGE_MEMBERS(OrgRole.ADMIN),
  INVITE_USERS(OrgRole.ADMIN),
  REMOVE_MEMBERS(OrgRole.ADMIN),
  CHANGE_ROLES(OrgRole.ADMIN),
  MANAGE_ADMINS(OrgRole.OWNER),
  MANAGE_ORGANIZATION(OrgRole.OWNER);

  private final OrgRole minimumRole;

  OrgPermission(OrgRole minimumRole) {
    this.minimumRole = minimumRole;
  }

  public OrgRole minimumRole() {
    return minimumRole;
  }

  public String key() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Looks up a permission by its snake_case key, e.g. {@code "invite_users"}. */
  public static Optional<OrgPermission> fromKey(String key) {
    if (key == null) {
      return Optional.empty();
    }
    for (OrgPermission permission : values()) {
      if (permission.key().equals(key.trim().toLowerCase(Locale.ROOT))) {
        return Optional.of(permission);
      }
    }
    return Optional.empty();
  }
}
