package io.b2mash.ledgerbooks.invitation;

import io.b2mash.ledgerbooks.integration.email.EmailMessage;
import io.b2mash.ledgerbooks.integration.email.EmailProvider;
import io.b2mash.ledgerbooks.integration.email.EmailTemplateRenderer;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Emails the invitee once the invitation row is committed. Delivery failures are logged and never
 * reach the caller that created the invitation.
 */
@Component
public class InvitationEmailListener {

  private static final Logger log = LoggerFactory.getLogger(InvitationEmailListener.class);

  private final EmailProvider emailProvider;
  private final EmailTemplateRenderer templateRenderer;
  private final InvitationProperties properties;

  public InvitationEmailListener(
      EmailProvider emailProvider,
      EmailTemplateRenderer templateRenderer,
      InvitationProperties properties) {
    this.emailProvider = emailProvider;
    this.templateRenderer = templateRenderer;
    this.properties = properties;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onInvitationCreated(InvitationCreatedEvent event) {
    try {
      var context = new HashMap<String, Object>();
      context.put("subject", "You're invited to join " + event.organizationName());
      context.put("organizationName", event.organizationName());
      context.put("role", event.role().value());
      context.put("code", event.code());
      context.put("expiresAt", event.expiresAt());
      context.put("invitedBy", event.invitedByEmail());
      context.put("acceptUrl", buildAcceptUrl(event.code()));

      var rendered = templateRenderer.render("invitation", context);
      var result = emailProvider.sendEmail(EmailMessage.of(event.email(), rendered));
      if (result.success()) {
        log.info(
            "Sent invitation email for invitation {} via {}",
            event.invitationId(),
            emailProvider.providerId());
      } else {
        log.error(
            "Invitation email for invitation {} was rejected: {}",
            event.invitationId(),
            result.errorMessage());
      }
    } catch (RuntimeException e) {
      log.error("Failed to send invitation email for invitation {}", event.invitationId(), e);
    }
  }

  private String buildAcceptUrl(String code) {
    String base = properties.acceptUrl();
    if (base == null || base.isBlank()) {
      return null;
    }
    String separator = base.contains("?") ? "&" : "?";
    return base + separator + "code=" + URLEncoder.encode(code, StandardCharsets.UTF_8);
  }
}
