package com.lookupgate.api.common;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lookupgate.api.tracing.RequestContext;
import com.lookupgate.domain.credential.CredentialException;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared error body: {@code {status:"error", reason, message, requestId, ts}}.
 * Used by the exception handler and by security components that answer before MVC.
 */
@Component
public class ErrorBodies {

  private final ObjectMapper objectMapper;

  public ErrorBodies(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public static Map<String, Object> body(String reason, String message) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "error");
    body.put("reason", reason);
    body.put("message", message == null ? reason : message);
    body.put("requestId", RequestContext.requestId());
    body.put("ts", Instant.now().toString());
    return body;
  }

  public void write(HttpServletResponse response, CredentialException ex) throws IOException {
    write(response, ex.code().httpStatus(), body(ex.code().reason(), ex.getMessage()));
  }

  public void write(HttpServletResponse response, int status, Map<String, Object> body) throws IOException {
    response.setStatus(status);
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    response.setCharacterEncoding("UTF-8");
    objectMapper.writeValue(response.getOutputStream(), body);
  }
}
