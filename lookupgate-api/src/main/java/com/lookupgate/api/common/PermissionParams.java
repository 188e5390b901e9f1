package com.lookupgate.api.common;

import com.lookupgate.domain.credential.CredentialException;
import com.lookupgate.domain.model.Permission;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

public final class PermissionParams {

  private PermissionParams() {}

  /** Null stays null so callers can apply their own default. Unknown values are rejected. */
  public static Set<Permission> parse(Collection<String> values) {
    if (values == null) return null;
    Set<Permission> out = EnumSet.noneOf(Permission.class);
    for (String v : values) {
      out.add(Permission.fromValue(v)
          .orElseThrow(() -> CredentialException.validation("Unknown permission: " + v)));
    }
    return out;
  }
}
