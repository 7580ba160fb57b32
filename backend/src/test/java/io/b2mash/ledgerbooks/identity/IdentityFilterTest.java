package io.b2mash.ledgerbooks.identity;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import java.io.IOException;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

class IdentityFilterTest {

  private final IdentityFilter filter = new IdentityFilter();
  private final AtomicReference<Actor> actorSeenByChain = new AtomicReference<>();
  private final FilterChain filterChain =
      (req, res) ->
          actorSeenByChain.set(RequestScopes.isBound() ? RequestScopes.requireActor() : null);

  private MockHttpServletRequest request;
  private MockHttpServletResponse response;

  @BeforeEach
  void setUp() {
    request = new MockHttpServletRequest("GET", "/api/memberships");
    response = new MockHttpServletResponse();
    SecurityContextHolder.clearContext();
  }

  @AfterEach
  void tearDown() {
    SecurityContextHolder.clearContext();
    RequestScopes.clear();
  }

  @Test
  void bindsActorFromJwtAndClearsAfterwards() throws ServletException, IOException {
    var userId = UUID.randomUUID();
    authenticate(userId.toString(), "Ana@Acme.test");

    filter.doFilterInternal(request, response, filterChain);

    assertThat(actorSeenByChain.get()).isEqualTo(new Actor(userId, "Ana@Acme.test"));
    assertThat(RequestScopes.isBound()).isFalse();
  }

  @Test
  void nonUuidSubject_continuesUnbound() throws ServletException, IOException {
    authenticate("user_2abc", "ana@acme.test");

    filter.doFilterInternal(request, response, filterChain);

    assertThat(actorSeenByChain.get()).isNull();
  }

  @Test
  void anonymousRequest_continuesUnbound() throws ServletException, IOException {
    filter.doFilterInternal(request, response, filterChain);

    assertThat(actorSeenByChain.get()).isNull();
  }

  private static void authenticate(String subject, String email) {
    var jwt =
        Jwt.withTokenValue("token")
            .header("alg", "RS256")
            .subject(subject)
            .claim("email", email)
            .issuedAt(Instant.now())
            .expiresAt(Instant.now().plusSeconds(300))
            .build();
    SecurityContextHolder.getContext().setAuthentication(new JwtAuthenticationToken(jwt));
  }
}
