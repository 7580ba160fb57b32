package io.b2mash.ledgerbooks.security;

import org.springframework.security.oauth2.jwt.Jwt;

/** Extracts the identity claims the access core relies on from the identity provider's JWT. */
public final class IdentityJwtUtils {

  private static final String EMAIL_CLAIM = "email";

  /** Extracts the {@code email} claim, or null when absent or not a string. */
  public static String extractEmail(Jwt jwt) {
    Object value = jwt.getClaim(EMAIL_CLAIM);
    if (value instanceof String str && !str.isBlank()) {
      return str;
    }
    return null;
  }

  private IdentityJwtUtils() {}
}
