package io.b2mash.ledgerbooks.integration.email;

/** Port for sending emails via an external provider. */
public interface EmailProvider {

  /** Provider identifier (e.g., "smtp", "noop"). */
  String providerId();

  /** Sends a message. Delivery failures are reported in the result, not thrown. */
  SendResult sendEmail(EmailMessage message);
}
