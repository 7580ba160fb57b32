package io.b2mash.ledgerbooks.security;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.ledgerbooks.invitation.InvitationProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import java.io.IOException;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.context.SecurityContextHolder;

class CronSecretAuthFilterTest {

  private static final String SECRET = "test-cron-secret";

  private CronSecretAuthFilter filter;
  private MockHttpServletRequest request;
  private MockHttpServletResponse response;
  private boolean filterChainCalled;

  private final FilterChain filterChain =
      (req, res) -> {
        filterChainCalled = true;
      };

  @BeforeEach
  void setUp() {
    filter = new CronSecretAuthFilter(properties(SECRET));
    request = new MockHttpServletRequest("POST", CronSecretAuthFilter.CLEANUP_PATH);
    response = new MockHttpServletResponse();
    filterChainCalled = false;
    SecurityContextHolder.clearContext();
  }

  @AfterEach
  void tearDown() {
    SecurityContextHolder.clearContext();
  }

  @Test
  void validSecret_continuesFilterChainAsScheduler() throws ServletException, IOException {
    request.addHeader("Authorization", "Bearer " + SECRET);

    filter.doFilterInternal(request, response, filterChain);

    assertThat(filterChainCalled).isTrue();
    var auth = SecurityContextHolder.getContext().getAuthentication();
    assertThat(auth).isNotNull();
    assertThat(auth.isAuthenticated()).isTrue();
    assertThat(auth.getAuthorities())
        .extracting("authority")
        .containsExactly(CronSecretAuthFilter.AUTHORITY_SCHEDULER);
  }

  @Test
  void wrongSecret_returns401() throws ServletException, IOException {
    request.addHeader("Authorization", "Bearer not-the-secret");

    filter.doFilterInternal(request, response, filterChain);

    assertThat(filterChainCalled).isFalse();
    assertThat(response.getStatus()).isEqualTo(401);
  }

  @Test
  void missingHeader_returns401() throws ServletException, IOException {
    filter.doFilterInternal(request, response, filterChain);

    assertThat(filterChainCalled).isFalse();
    assertThat(response.getStatus()).isEqualTo(401);
  }

  @Test
  void nonBearerScheme_returns401() throws ServletException, IOException {
    request.addHeader("Authorization", "Basic " + SECRET);

    filter.doFilterInternal(request, response, filterChain);

    assertThat(filterChainCalled).isFalse();
    assertThat(response.getStatus()).isEqualTo(401);
  }

  @Test
  void blankConfiguredSecret_rejectsEveryCall() throws ServletException, IOException {
    filter = new CronSecretAuthFilter(properties(""));
    request.addHeader("Authorization", "Bearer ");

    filter.doFilterInternal(request, response, filterChain);

    assertThat(filterChainCalled).isFalse();
    assertThat(response.getStatus()).isEqualTo(401);
  }

  @Test
  void shouldNotFilter_otherPaths() {
    var other = new MockHttpServletRequest("GET", "/api/invitations/details");
    assertThat(filter.shouldNotFilter(other)).isTrue();
    assertThat(filter.shouldNotFilter(request)).isFalse();
  }

  private static InvitationProperties properties(String secret) {
    return new InvitationProperties(Duration.ofDays(7), 12, 10, 30, null, secret);
  }
}
