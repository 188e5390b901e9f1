package com.lookupgate.api.admin;

import com.lookupgate.api.tracing.RequestContext;
import com.lookupgate.application.security.AdministratorPrincipal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Administrative audit trail, written to the dedicated {@code AUDIT} logger.
 * Entries never include secrets or candidate keys.
 */
@Service
public class AdminAuditService {

  private static final Logger audit = LoggerFactory.getLogger("AUDIT");

  public void logAdmin(AdministratorPrincipal actor, String action, String targetType, String targetId) {
    logAdmin(actor, action, targetType, targetId, null);
  }

  public void logAdmin(AdministratorPrincipal actor, String action, String targetType, String targetId, String outcome) {
    audit.info("actor={} action={} targetType={} targetId={} outcome={} requestId={}",
        actor == null ? "system" : actor.id(),
        action,
        targetType,
        targetId,
        outcome == null ? "ok" : outcome,
        RequestContext.requestId());
  }
}
