package com.example.platformauth.web.rest.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Body of the basic and liveness checks. {@code memoryUsagePercent} is only set by liveness.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthStatusResponse(String status, String memoryUsagePercent, Long timestamp) {

  public static HealthStatusResponse up(long timestamp) {
    return new HealthStatusResponse("UP", null, timestamp);
  }

  public static HealthStatusResponse liveness(String status, double memoryUsagePercent) {
    return new HealthStatusResponse(status, String.format("%.2f", memoryUsagePercent), null);
  }
}
