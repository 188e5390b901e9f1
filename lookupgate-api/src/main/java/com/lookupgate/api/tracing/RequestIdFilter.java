package com.lookupgate.api.tracing;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Correlation id for every request, including those rejected by the credential filter.
 *
 * A caller-supplied {@code X-Request-Id} is reused when it is short and made of safe characters;
 * otherwise a UUID is generated. The id goes into MDC (log pattern {@code %X{requestId}}), into
 * {@link RequestContext} for error bodies and audit lines, and back out in the response header.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

  public static final String HDR_REQUEST_ID = "X-Request-Id";
  public static final String MDC_REQUEST_ID = "requestId";

  private static final Pattern ACCEPTED = Pattern.compile("[A-Za-z0-9._-]{1,64}");

  static String chooseRequestId(String supplied) {
    if (supplied != null) {
      String trimmed = supplied.trim();
      if (ACCEPTED.matcher(trimmed).matches()) return trimmed;
    }
    return UUID.randomUUID().toString();
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
      throws ServletException, IOException {
    String requestId = chooseRequestId(request.getHeader(HDR_REQUEST_ID));
    response.setHeader(HDR_REQUEST_ID, requestId);
    RequestContext.set(requestId);
    try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_REQUEST_ID, requestId)) {
      chain.doFilter(request, response);
    } finally {
      RequestContext.clear();
    }
  }
}
