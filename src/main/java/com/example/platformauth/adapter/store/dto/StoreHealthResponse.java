package com.example.platformauth.adapter.store.dto;

/**
 * Store Health Check Response
 */
public record StoreHealthResponse(
    boolean healthy,
    String backend,
    long responseTimeMs,
    String version,
    String error
) {
  public static StoreHealthResponse healthy(String backend, long responseTimeMs, String version) {
    return new StoreHealthResponse(true, backend, responseTimeMs, version, null);
  }

  public static StoreHealthResponse unhealthy(String backend, String error) {
    return new StoreHealthResponse(false, backend, 0, null, error);
  }
}
