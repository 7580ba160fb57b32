package io.b2mash.ledgerbooks.invitation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.ledgerbooks.integration.email.EmailMessage;
import io.b2mash.ledgerbooks.integration.email.EmailProvider;
import io.b2mash.ledgerbooks.integration.email.EmailTemplateRenderer;
import io.b2mash.ledgerbooks.integration.email.SendResult;
import io.b2mash.ledgerbooks.security.OrgRole;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class InvitationEmailListenerTest {

  private EmailProvider emailProvider;
  private EmailTemplateRenderer renderer;
  private InvitationEmailListener listener;

  @BeforeEach
  void setUp() {
    emailProvider = mock(EmailProvider.class);
    renderer = new EmailTemplateRenderer();
    listener =
        new InvitationEmailListener(
            emailProvider,
            renderer,
            new InvitationProperties(
                Duration.ofDays(7), 12, 10, 30, "https://app.example.com/join?src=mail", ""));
  }

  @Test
  void sendsRenderedInvitationToInvitee() {
    when(emailProvider.sendEmail(any())).thenReturn(new SendResult(true, "id-1", null));

    listener.onInvitationCreated(event());

    var captor = ArgumentCaptor.forClass(EmailMessage.class);
    verify(emailProvider).sendEmail(captor.capture());
    assertThat(captor.getValue().to()).isEqualTo("new@acme.test");
    assertThat(captor.getValue().subject()).contains("Acme Books");
    assertThat(captor.getValue().htmlBody())
        .contains("https://app.example.com/join?src=mail&amp;code=ABCDEFGH2345");
  }

  @Test
  void providerFailureDoesNotPropagate() {
    when(emailProvider.sendEmail(any())).thenThrow(new IllegalStateException("smtp down"));

    assertThatCode(() -> listener.onInvitationCreated(event())).doesNotThrowAnyException();
  }

  @Test
  void renderingFailureSkipsSending() {
    var failingRenderer = mock(EmailTemplateRenderer.class);
    when(failingRenderer.render(eq("invitation"), anyMap()))
        .thenThrow(new IllegalStateException("template missing"));
    var failingListener =
        new InvitationEmailListener(
            emailProvider,
            failingRenderer,
            new InvitationProperties(null, 0, 0, 0, null, null));

    assertThatCode(() -> failingListener.onInvitationCreated(event()))
        .doesNotThrowAnyException();
    verify(emailProvider, never()).sendEmail(any());
  }

  @Test
  void providerRejectionIsNotThrown() {
    when(emailProvider.sendEmail(any())).thenReturn(new SendResult(false, null, "rejected"));

    assertThatCode(() -> listener.onInvitationCreated(event())).doesNotThrowAnyException();
  }

  private InvitationCreatedEvent event() {
    return new InvitationCreatedEvent(
        UUID.randomUUID(),
        UUID.randomUUID(),
        "Acme Books",
        "new@acme.test",
        OrgRole.MEMBER,
        "ABCDEFGH2345",
        Instant.parse("2026-01-08T00:00:00Z"),
        "owner@acme.test");
  }
}
