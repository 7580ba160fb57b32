package io.b2mash.ledgerbooks.integration.email;

import java.util.Objects;

/** Provider-agnostic email payload. */
public record EmailMessage(
    String to, String subject, String htmlBody, String plainTextBody, String replyTo) {

  public EmailMessage {
    Objects.requireNonNull(to, "to");
    Objects.requireNonNull(subject, "subject");
  }

  public static EmailMessage of(String to, RenderedEmail rendered) {
    return new EmailMessage(
        to, rendered.subject(), rendered.htmlBody(), rendered.plainTextBody(), null);
  }
}
