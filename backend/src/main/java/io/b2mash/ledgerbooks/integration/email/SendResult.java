package io.b2mash.ledgerbooks.integration.email;

/**
 * Outcome of a send attempt.
 *
 * @param success whether the provider accepted the message
 * @param providerMessageId provider's message id, null on failure
 * @param errorMessage failure reason, null on success
 */
public record SendResult(boolean success, String providerMessageId, String errorMessage) {}
