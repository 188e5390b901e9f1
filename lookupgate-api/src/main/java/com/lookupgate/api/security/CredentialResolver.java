package com.lookupgate.api.security;

import com.lookupgate.application.ports.PrincipalDirectory;
import com.lookupgate.application.security.AdministratorPrincipal;
import com.lookupgate.application.security.ApiKeyIssuer;
import com.lookupgate.application.security.ApiKeyPrincipal;
import com.lookupgate.application.security.CustomerSessionPrincipal;
import com.lookupgate.application.security.ResolvedPrincipal;
import com.lookupgate.domain.credential.CredentialException;
import com.lookupgate.domain.model.AdministratorAccount;
import com.lookupgate.domain.model.ApiKeyRecord;
import com.lookupgate.domain.model.CustomerAccount;
import com.lookupgate.domain.model.PrincipalAccount;
import com.lookupgate.domain.model.PrincipalKind;
import com.lookupgate.domain.model.SessionClaims;
import org.springframework.stereotype.Component;

/**
 * Turns a presented credential into exactly one principal variant for the given route family.
 *
 * Session principals carry the account's current permissions; key principals carry the key's scope.
 */
@Component
public class CredentialResolver {

  private final SessionIssuer sessions;
  private final ApiKeyIssuer apiKeys;
  private final PrincipalDirectory directory;

  public CredentialResolver(SessionIssuer sessions, ApiKeyIssuer apiKeys, PrincipalDirectory directory) {
    this.sessions = sessions;
    this.apiKeys = apiKeys;
    this.directory = directory;
  }

  public ResolvedPrincipal resolve(RouteFamily family, PresentedCredential credential) {
    if (credential == null) {
      throw CredentialException.authenticationRequired("Authentication required");
    }
    return switch (credential.type()) {
      case SESSION_TOKEN -> resolveSession(family, credential.value());
      case API_KEY -> resolveApiKey(family, credential.value());
    };
  }

  private ResolvedPrincipal resolveSession(RouteFamily family, String token) {
    PrincipalKind expected = family == RouteFamily.ADMIN ? PrincipalKind.ADMIN : PrincipalKind.CUSTOMER;
    SessionClaims claims = sessions.verify(token, expected);
    PrincipalAccount account = activeAccount(expected, claims.principalId(), "Session account no longer exists");

    if (account instanceof AdministratorAccount admin) {
      return new AdministratorPrincipal(admin.id(), admin.email(), admin.role(), admin.permissions());
    }
    CustomerAccount customer = (CustomerAccount) account;
    return new CustomerSessionPrincipal(customer.id(), customer.email(), customer.permissions());
  }

  private ResolvedPrincipal resolveApiKey(RouteFamily family, String presented) {
    if (!family.acceptsApiKeys()) {
      throw CredentialException.invalid("API keys are not accepted on this route");
    }
    ApiKeyRecord key = apiKeys.verify(presented).orThrow();
    activeAccount(PrincipalKind.CUSTOMER, key.customerId(), "API key owner no longer exists");
    apiKeys.recordUse(key.id());
    return new ApiKeyPrincipal(key.id(), key.customerId(), key.name(), key.scope());
  }

  private PrincipalAccount activeAccount(PrincipalKind kind, String id, String missingMessage) {
    PrincipalAccount account = directory.findById(kind, id)
        .orElseThrow(() -> CredentialException.invalid(missingMessage));
    if (!account.isActive()) {
      throw CredentialException.forbidden(kind == PrincipalKind.ADMIN
          ? "Administrator account is suspended"
          : "Customer account is suspended");
    }
    return account;
  }
}
