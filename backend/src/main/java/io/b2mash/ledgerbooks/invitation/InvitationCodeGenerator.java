package io.b2mash.ledgerbooks.invitation;

import java.security.SecureRandom;
import org.springframework.stereotype.Component;

/**
 * Generates invitation codes from an alphabet without look-alike characters (no 0/O, 1/I). Codes
 * are random, not unique: uniqueness is the store's job.
 */
@Component
public class InvitationCodeGenerator {

  static final String ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";

  private final SecureRandom random = new SecureRandom();
  private final int length;

  public InvitationCodeGenerator(InvitationProperties properties) {
    this.length = properties.codeLength();
  }

  public String generate() {
    var code = new StringBuilder(length);
    for (int i = 0; i < length; i++) {
      code.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
    }
    return code.toString();
  }
}
