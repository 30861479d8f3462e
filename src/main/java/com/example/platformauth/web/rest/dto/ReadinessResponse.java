package com.example.platformauth.web.rest.dto;

import com.example.platformauth.adapter.store.dto.StoreHealthResponse;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Readiness of the session store plus the state of encryption at rest and, when enabled, the
 * cookie sync bridge. Only the store decides {@code ready}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReadinessResponse(
    boolean ready,
    StoreStatus store,
    EncryptionStatus encryption,
    BridgeStatus bridge,
    long timestamp
) {

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record StoreStatus(String status, String backend, long responseTimeMs, String version, String error) {

    public static StoreStatus from(StoreHealthResponse health) {
      return new StoreStatus(health.healthy() ? "UP" : "DOWN", health.backend(), health.responseTimeMs(),
                             health.version(), health.error());
    }
  }

  public record EncryptionStatus(boolean available) {}

  public record BridgeStatus(boolean connected) {}
}
