package io.b2mash.ledgerbooks.invitation;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Derived from the invitation's timestamps; never stored. Cancelled invitations are deleted. */
public enum InvitationStatus {
  PENDING,
  ACCEPTED,
  EXPIRED;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
