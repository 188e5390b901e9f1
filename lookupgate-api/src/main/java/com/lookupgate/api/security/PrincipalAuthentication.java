package com.lookupgate.api.security;

import com.lookupgate.application.security.ResolvedPrincipal;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.util.stream.Collectors;

/**
 * Spring Security carrier for a {@link ResolvedPrincipal}. Authorities are the permission wire values.
 */
public class PrincipalAuthentication extends AbstractAuthenticationToken {

  private final ResolvedPrincipal principal;

  public PrincipalAuthentication(ResolvedPrincipal principal) {
    super(principal.permissions().stream()
        .map(p -> new SimpleGrantedAuthority(p.value()))
        .collect(Collectors.toList()));
    this.principal = principal;
    setAuthenticated(true);
  }

  @Override
  public Object getCredentials() {
    return "";
  }

  @Override
  public ResolvedPrincipal getPrincipal() {
    return principal;
  }

  @Override
  public String getName() {
    return principal.principalId();
  }
}
