package io.b2mash.ledgerbooks.security;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Actions one member performs against another member (or a future member, for invites). */
public enum ManagementAction {
  CHANGE_ROLE,
  REMOVE,
  INVITE;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static ManagementAction fromValue(String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
