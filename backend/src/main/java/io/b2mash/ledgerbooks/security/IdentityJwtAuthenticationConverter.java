package io.b2mash.ledgerbooks.security;

import java.util.List;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

/**
 * Converts a validated identity-provider JWT into an authentication token. Organization roles are
 * not carried in the token: they live in the membership registry and are resolved per request.
 */
@Component
public class IdentityJwtAuthenticationConverter
    implements Converter<Jwt, AbstractAuthenticationToken> {

  public static final String AUTHORITY_USER = "ROLE_USER";

  @Override
  public AbstractAuthenticationToken convert(Jwt jwt) {
    return new JwtAuthenticationToken(
        jwt, List.of(new SimpleGrantedAuthority(AUTHORITY_USER)), jwt.getSubject());
  }
}
