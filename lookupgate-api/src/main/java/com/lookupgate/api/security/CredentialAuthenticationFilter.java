package com.lookupgate.api.security;

import com.lookupgate.api.common.ErrorBodies;
import com.lookupgate.application.security.ResolvedPrincipal;
import com.lookupgate.domain.credential.CredentialException;
import com.lookupgate.domain.credential.StorageCorruptionException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;

/**
 * Resolves the caller's principal for protected route families.
 *
 * - no credential: passes through unauthenticated; the chain's entry point answers 401
 * - bad credential: answers immediately with the specific reason (invalid / expired / revoked / forbidden)
 * - good credential: installs a {@link PrincipalAuthentication}
 *
 * Not a Spring bean, so it only runs inside the secured filter chain.
 */
public class CredentialAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(CredentialAuthenticationFilter.class);

  private final CredentialResolver resolver;
  private final ErrorBodies errors;

  public CredentialAuthenticationFilter(CredentialResolver resolver, ErrorBodies errors) {
    this.resolver = resolver;
    this.errors = errors;
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
      throws ServletException, IOException {

    String path = request.getRequestURI().substring(request.getContextPath().length());
    Optional<RouteFamily> family = RouteFamily.of(path);
    Optional<PresentedCredential> credential = PresentedCredential.from(
        request.getHeader(HttpHeaders.AUTHORIZATION),
        request.getHeader(PresentedCredential.HDR_API_KEY)
    );

    if (family.isEmpty() || credential.isEmpty()) {
      chain.doFilter(request, response);
      return;
    }

    final ResolvedPrincipal principal;
    try {
      principal = resolver.resolve(family.get(), credential.get());
    } catch (CredentialException e) {
      log.info("Credential rejected: route={} type={} reason={}", family.get(), credential.get().type(), e.code().reason());
      errors.write(response, e);
      return;
    } catch (StorageCorruptionException e) {
      log.error("Credential check hit corrupt stored data: route={}", family.get(), e);
      errors.write(response, 500, ErrorBodies.body("storage_corruption", "Stored credential data is corrupt"));
      return;
    }

    SecurityContext context = SecurityContextHolder.createEmptyContext();
    context.setAuthentication(new PrincipalAuthentication(principal));
    SecurityContextHolder.setContext(context);
    chain.doFilter(request, response);
  }
}
