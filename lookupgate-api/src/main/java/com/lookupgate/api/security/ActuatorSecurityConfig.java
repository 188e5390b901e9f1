package com.lookupgate.api.security;

import com.lookupgate.api.common.ErrorBodies;
import org.springframework.boot.actuate.autoconfigure.security.servlet.EndpointRequest;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;

/**
 * Actuator endpoints sit outside the credential model: health and info are open for liveness checks, every
 * other endpoint is refused with the usual JSON error body.
 */
@Configuration
public class ActuatorSecurityConfig {

  @Bean
  @Order(1)
  SecurityFilterChain actuatorChain(HttpSecurity http, ErrorBodies errors) throws Exception {
    return http
        .securityMatcher(EndpointRequest.toAnyEndpoint())
        .csrf(csrf -> csrf.disable())
        .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(auth -> auth
            .requestMatchers(EndpointRequest.to("health", "info")).permitAll()
            .anyRequest().denyAll())
        .exceptionHandling(ex -> ex
            .authenticationEntryPoint((request, response, e) ->
                errors.write(response, 403, ErrorBodies.body("forbidden", "Endpoint is not exposed")))
            .accessDeniedHandler((request, response, e) ->
                errors.write(response, 403, ErrorBodies.body("forbidden", "Endpoint is not exposed"))))
        .build();
  }
}
