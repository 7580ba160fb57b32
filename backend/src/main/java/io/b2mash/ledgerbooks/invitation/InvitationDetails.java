package io.b2mash.ledgerbooks.invitation;

import io.b2mash.ledgerbooks.security.OrgRole;
import java.time.Instant;
import java.util.UUID;

/** Public summary of an invitation, shown to the invitee before they sign in. */
public record InvitationDetails(
    UUID id,
    UUID organizationId,
    String organizationName,
    String currency,
    String email,
    OrgRole role,
    Instant expiresAt,
    InvitationStatus status) {}
