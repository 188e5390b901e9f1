package com.lookupgate.api.security;

import com.lookupgate.api.common.ErrorBodies;
import com.lookupgate.domain.credential.CredentialException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;

/**
 * Security configuration for the LookupGate API.
 *
 * Design principles:
 * - Stateless (session tokens or API keys, no HTTP sessions)
 * - Fail-closed for secured APIs
 * - Explicit public endpoints (login, signup, health)
 */
@Configuration
public class SecurityConfig {

  private final CredentialResolver resolver;
  private final ErrorBodies errors;

  public SecurityConfig(CredentialResolver resolver, ErrorBodies errors) {
    this.resolver = resolver;
    this.errors = errors;
  }

  /**
   * Public endpoints (no credential):
   * - Admin login
   * - Customer signup / login
   * - Health & error
   */
  @Bean
  @Order(2)
  SecurityFilterChain publicApiChain(HttpSecurity http) throws Exception {
    return http
        .securityMatcher(
            "/api/v1/health",
            "/error",
            "/api/v1/admin/auth/login",
            "/api/v1/customer/auth/signup",
            "/api/v1/customer/auth/login"
        )
        .csrf(csrf -> csrf.disable())
        .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(auth -> auth
            .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
            .requestMatchers("/api/v1/health", "/error").permitAll()
            .requestMatchers(HttpMethod.POST,
                "/api/v1/admin/auth/login",
                "/api/v1/customer/auth/signup",
                "/api/v1/customer/auth/login"
            ).permitAll()
            .anyRequest().denyAll() // fail-closed
        )
        .build();
  }

  /**
   * Secured API: every remaining /api/** endpoint needs a credential accepted by its route family.
   */
  @Bean
  @Order(3)
  SecurityFilterChain securedApiChain(HttpSecurity http) throws Exception {
    return http
        .securityMatcher("/api/**")
        .csrf(csrf -> csrf.disable())
        .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .addFilterBefore(new CredentialAuthenticationFilter(resolver, errors), AnonymousAuthenticationFilter.class)
        .authorizeHttpRequests(auth -> auth
            .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
            .anyRequest().authenticated()
        )
        .exceptionHandling(ex -> ex
            .authenticationEntryPoint((request, response, authException) ->
                errors.write(response, CredentialException.authenticationRequired("Authentication required")))
            .accessDeniedHandler((request, response, denied) ->
                errors.write(response, CredentialException.forbidden("Access denied")))
        )
        .build();
  }
}
