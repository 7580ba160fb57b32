package io.b2mash.ledgerbooks.invitation;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration for the invitation workflow.
 *
 * @param expiry how long a new invitation stays acceptable
 * @param codeLength number of characters in a generated code
 * @param maxCodeAttempts attempts at generating an unused code before giving up
 * @param cleanupRetentionDays default age past expiry after which unused invitations are deleted
 * @param acceptUrl link embedded in invitation emails; the code is appended as {@code ?code=}
 * @param cleanupSecret shared secret for the cleanup trigger; blank rejects every call
 */
@ConfigurationProperties(prefix = "ledgerbooks.invitation")
public record InvitationProperties(
    Duration expiry,
    int codeLength,
    int maxCodeAttempts,
    int cleanupRetentionDays,
    String acceptUrl,
    String cleanupSecret) {

  public InvitationProperties {
    if (expiry == null) {
      expiry = Duration.ofDays(7);
    }
    if (codeLength <= 0) {
      codeLength = 12;
    }
    if (maxCodeAttempts <= 0) {
      maxCodeAttempts = 10;
    }
    if (cleanupRetentionDays <= 0) {
      cleanupRetentionDays = 30;
    }
  }
}
