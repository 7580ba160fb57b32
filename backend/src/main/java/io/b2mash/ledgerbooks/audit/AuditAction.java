package io.b2mash.ledgerbooks.audit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum AuditAction {
  CREATE,
  UPDATE,
  DELETE,
  LOGIN,
  LOGOUT,
  INVITE_SENT,
  ROLE_CHANGED;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static AuditAction fromValue(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Audit action must not be null");
    }
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
