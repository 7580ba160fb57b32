package io.b2mash.ledgerbooks.invitation;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.HashSet;
import org.junit.jupiter.api.Test;

class InvitationCodeGeneratorTest {

  private final InvitationCodeGenerator generator =
      new InvitationCodeGenerator(
          new InvitationProperties(Duration.ofDays(7), 12, 10, 30, null, null));

  @Test
  void generatesTwelveCharactersFromUnambiguousAlphabet() {
    for (int i = 0; i < 200; i++) {
      String code = generator.generate();
      assertThat(code).hasSize(12).matches("^[ABCDEFGHJKLMNPQRSTUVWXYZ23456789]+$");
      assertThat(code).doesNotContain("0", "O", "1", "I");
    }
  }

  @Test
  void consecutiveCodesDiffer() {
    var codes = new HashSet<String>();
    for (int i = 0; i < 1000; i++) {
      codes.add(generator.generate());
    }
    assertThat(codes).hasSize(1000);
  }
}
