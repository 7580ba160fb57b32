package io.b2mash.ledgerbooks.security;

import io.b2mash.ledgerbooks.audit.AuditAuthenticationEntryPoint;
import io.b2mash.ledgerbooks.identity.IdentityFilter;
import io.b2mash.ledgerbooks.identity.IdentityLoggingFilter;
import java.util.List;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.core.env.Environment;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.oauth2.server.resource.web.authentication.BearerTokenAuthenticationFilter;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

@Configuration
@EnableWebSecurity
public class SecurityConfig {

  private final IdentityJwtAuthenticationConverter jwtAuthConverter;
  private final CronSecretAuthFilter cronSecretAuthFilter;
  private final IdentityFilter identityFilter;
  private final IdentityLoggingFilter identityLoggingFilter;
  private final AuditAuthenticationEntryPoint auditAuthEntryPoint;
  private final Environment environment;

  public SecurityConfig(
      IdentityJwtAuthenticationConverter jwtAuthConverter,
      CronSecretAuthFilter cronSecretAuthFilter,
      IdentityFilter identityFilter,
      IdentityLoggingFilter identityLoggingFilter,
      AuditAuthenticationEntryPoint auditAuthEntryPoint,
      Environment environment) {
    this.jwtAuthConverter = jwtAuthConverter;
    this.cronSecretAuthFilter = cronSecretAuthFilter;
    this.identityFilter = identityFilter;
    this.identityLoggingFilter = identityLoggingFilter;
    this.auditAuthEntryPoint = auditAuthEntryPoint;
    this.environment = environment;
  }

  /**
   * Filter chain for the invitation cleanup trigger. Authenticated by shared secret only, never by
   * a user JWT.
   */
  @Bean
  @Order(1)
  public SecurityFilterChain cleanupFilterChain(HttpSecurity http) throws Exception {
    http.securityMatcher(CronSecretAuthFilter.CLEANUP_PATH)
        .csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(auth -> auth.anyRequest().hasRole("SCHEDULER"))
        .addFilterBefore(cronSecretAuthFilter, UsernamePasswordAuthenticationFilter.class);

    return http.build();
  }

  /** Main filter chain for the API. Uses identity-provider JWTs plus per-request actor binding. */
  @Bean
  @Order(2)
  public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    http.cors(cors -> cors.configurationSource(corsConfigurationSource()))
        .csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers("/actuator/health/**", "/actuator/health")
                    .permitAll()
                    .requestMatchers(HttpMethod.GET, "/api/invitations/details")
                    .permitAll()
                    .requestMatchers("/api/**")
                    .authenticated()
                    .anyRequest()
                    .denyAll())
        .oauth2ResourceServer(
            oauth2 ->
                oauth2
                    .jwt(jwt -> jwt.jwtAuthenticationConverter(jwtAuthConverter))
                    .authenticationEntryPoint(auditAuthEntryPoint))
        .addFilterAfter(identityFilter, BearerTokenAuthenticationFilter.class)
        .addFilterAfter(identityLoggingFilter, IdentityFilter.class);

    return http.build();
  }

  @Bean
  CorsConfigurationSource corsConfigurationSource() {
    List<String> origins =
        Binder.get(environment)
            .bind("cors.allowed-origins", Bindable.listOf(String.class))
            .orElse(List.of());

    var config = new CorsConfiguration();
    if (!origins.isEmpty()) {
      config.setAllowedOrigins(origins);
    }
    config.setAllowedMethods(List.of("GET", "POST", "PUT", "DELETE", "OPTIONS"));
    config.setAllowedHeaders(List.of("*"));
    config.setAllowCredentials(true);
    config.setMaxAge(3600L);

    var source = new UrlBasedCorsConfigurationSource();
    source.registerCorsConfiguration("/**", config);
    return source;
  }
}
