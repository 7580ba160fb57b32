package io.b2mash.ledgerbooks.security;

import io.b2mash.ledgerbooks.invitation.InvitationProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates the scheduled invitation cleanup trigger with a shared secret sent as {@code
 * Authorization: Bearer <secret>}. A blank configured secret rejects every call.
 */
@Component
public class CronSecretAuthFilter extends OncePerRequestFilter {

  public static final String CLEANUP_PATH = "/api/invitations/cleanup";
  public static final String AUTHORITY_SCHEDULER = "ROLE_SCHEDULER";

  private static final Logger log = LoggerFactory.getLogger(CronSecretAuthFilter.class);
  private static final String BEARER_PREFIX = "Bearer ";

  private final String expectedSecret;

  public CronSecretAuthFilter(InvitationProperties properties) {
    this.expectedSecret = properties.cleanupSecret();
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String header = request.getHeader("Authorization");

    if (matches(header)) {
      SecurityContextHolder.getContext().setAuthentication(new SchedulerAuthenticationToken());
      filterChain.doFilter(request, response);
    } else {
      log.warn(
          "security.auth_failed: path={}, method={}, reason=invalid_cron_secret, remote_addr={}",
          request.getRequestURI(),
          request.getMethod(),
          ClientIpResolver.resolve(request));
      response.sendError(HttpServletResponse.SC_UNAUTHORIZED, "Invalid cron secret");
    }
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !request.getRequestURI().equals(CLEANUP_PATH);
  }

  private boolean matches(String header) {
    if (expectedSecret == null || expectedSecret.isBlank()) {
      return false;
    }
    if (header == null || !header.startsWith(BEARER_PREFIX)) {
      return false;
    }
    byte[] provided = header.substring(BEARER_PREFIX.length()).getBytes(StandardCharsets.UTF_8);
    return MessageDigest.isEqual(provided, expectedSecret.getBytes(StandardCharsets.UTF_8));
  }

  private static class SchedulerAuthenticationToken extends AbstractAuthenticationToken {

    SchedulerAuthenticationToken() {
      super(List.of(new SimpleGrantedAuthority(AUTHORITY_SCHEDULER)));
      setAuthenticated(true);
    }

    @Override
    public Object getCredentials() {
      return null;
    }

    @Override
    public Object getPrincipal() {
      return "invitation-cleanup";
    }
  }
}
