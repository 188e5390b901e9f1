package com.lookupgate.api.security;

import com.lookupgate.application.security.AdministratorPrincipal;
import com.lookupgate.application.security.ResolvedPrincipal;
import com.lookupgate.domain.credential.CredentialException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.Optional;

public final class CurrentPrincipal {

  private CurrentPrincipal() {}

  public static Optional<ResolvedPrincipal> get() {
    Authentication auth = SecurityContextHolder.getContext().getAuthentication();
    if (auth instanceof PrincipalAuthentication pa) return Optional.of(pa.getPrincipal());
    return Optional.empty();
  }

  public static ResolvedPrincipal require() {
    return get().orElseThrow(() -> CredentialException.authenticationRequired("Authentication required"));
  }

  public static AdministratorPrincipal requireAdministrator() {
    ResolvedPrincipal p = require();
    if (p instanceof AdministratorPrincipal admin) return admin;
    throw CredentialException.forbidden("Administrator session required");
  }
}
