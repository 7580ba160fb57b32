package io.b2mash.ledgerbooks.identity;

import io.b2mash.ledgerbooks.security.IdentityJwtUtils;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds the caller's identity from the validated JWT into {@link RequestScopes}. Requests without a
 * JWT (public endpoints, actuator) continue unbound.
 */
@Component
public class IdentityFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(IdentityFilter.class);

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    Actor actor = resolveActor();
    if (actor == null) {
      filterChain.doFilter(request, response);
      return;
    }

    RequestScopes.bind(actor);
    try {
      filterChain.doFilter(request, response);
    } finally {
      RequestScopes.clear();
    }
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return request.getRequestURI().startsWith("/actuator/");
  }

  private Actor resolveActor() {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (!(authentication instanceof JwtAuthenticationToken jwtAuth)) {
      return null;
    }

    Jwt jwt = jwtAuth.getToken();
    String subject = jwt.getSubject();
    if (subject == null) {
      return null;
    }

    try {
      return new Actor(UUID.fromString(subject), IdentityJwtUtils.extractEmail(jwt));
    } catch (IllegalArgumentException e) {
      log.warn("Ignoring token with non-UUID subject: {}", subject);
      return null;
    }
  }
}
