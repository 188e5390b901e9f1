package com.lookupgate.api.tracing;

/**
 * Per-request correlation id held in a ThreadLocal so error bodies and audit lines can carry it.
 */
public final class RequestContext {

  private static final ThreadLocal<String> REQUEST_ID = new ThreadLocal<>();

  private RequestContext() {}

  public static void set(String requestId) {
    REQUEST_ID.set(requestId);
  }

  public static void clear() {
    REQUEST_ID.remove();
  }

  public static String requestId() {
    return REQUEST_ID.get();
  }
}
