package io.b2mash.ledgerbooks.identity;

import java.util.UUID;

/**
 * The authenticated caller of a request, as asserted by the identity provider's token.
 *
 * @param userId identity provider subject
 * @param email email claim; may be null when the token carries none
 */
public record Actor(UUID userId, String email) {}
