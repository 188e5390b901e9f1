package com.lookupgate.api.security;

import com.lookupgate.application.security.PermissionGuard;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.Arrays;

/**
 * Enforces {@link RequiresPermission} before the handler runs. Failures surface as
 * {@code FORBIDDEN} through the regular exception handler.
 */
@Component
public class PermissionInterceptor implements HandlerInterceptor {

  @Override
  public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
    if (!(handler instanceof HandlerMethod method)) return true;

    RequiresPermission required = AnnotatedElementUtils.findMergedAnnotation(method.getMethod(), RequiresPermission.class);
    if (required == null) {
      required = AnnotatedElementUtils.findMergedAnnotation(method.getBeanType(), RequiresPermission.class);
    }
    if (required == null) return true;

    PermissionGuard.require(CurrentPrincipal.get().orElse(null), Arrays.asList(required.value()));
    return true;
  }
}
