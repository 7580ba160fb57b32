package io.b2mash.ledgerbooks.integration.email;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class NoOpEmailProviderTest {

  private final NoOpEmailProvider provider = new NoOpEmailProvider();

  @Test
  void sendEmail_returns_success_with_noop_id() {
    var message =
        new EmailMessage("recipient@example.com", "Subject", "<h1>Hello</h1>", "Hello", null);

    var result = provider.sendEmail(message);

    assertThat(result.success()).isTrue();
    assertThat(result.providerMessageId()).startsWith("NOOP-");
    assertThat(result.errorMessage()).isNull();
    assertThat(provider.providerId()).isEqualTo("noop");
  }
}
