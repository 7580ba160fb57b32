package io.b2mash.ledgerbooks.security;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Organization roles on a strict ordinal scale: member &lt; admin &lt; owner. {@link #hasRole} is
 * the only place roles are compared.
 */
public enum OrgRole {
  MEMBER("member", 1),
  ADMIN("admin", 2),
  OWNER("owner", 3);

  private final String value;
  private final int level;

  OrgRole(String value, int level) {
    this.value = value;
    this.level = level;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /** True when {@code actorRole} is at least {@code requiredRole}. */
  public static boolean hasRole(OrgRole actorRole, OrgRole requiredRole) {
    if (actorRole == null || requiredRole == null) {
      return false;
    }
    return actorRole.level >= requiredRole.level;
  }

  @JsonCreator
  public static OrgRole fromValue(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Role must not be null");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (OrgRole role : values()) {
      if (role.value.equals(normalized)) {
        return role;
      }
    }
    throw new IllegalArgumentException("Unknown role: " + value);
  }
}
