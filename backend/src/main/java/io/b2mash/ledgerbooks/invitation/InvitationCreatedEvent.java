package io.b2mash.ledgerbooks.invitation;

import io.b2mash.ledgerbooks.security.OrgRole;
import java.time.Instant;
import java.util.UUID;

/** Published when an invitation has been stored; drives email delivery after commit. */
public record InvitationCreatedEvent(
    UUID invitationId,
    UUID organizationId,
    String organizationName,
    String email,
    OrgRole role,
    String code,
    Instant expiresAt,
    String invitedByEmail) {}
