package com.example.platformauth.web.rest.controller;

import static com.example.platformauth.web.rest.ApiConstants.ApiPath.*;

import com.example.platformauth.web.rest.dto.HealthStatusResponse;
import com.example.platformauth.web.rest.dto.ReadinessResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Health checks for the local supervisor. Unauthenticated and never cached.
 */
@Tag(
    name = "Health",
    description = "Process, session store and capture channel health"
)
@RequestMapping(
    value = HEALTH_BASE,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface HealthAPI {

  @Operation(
      summary = "Process is serving requests"
  )
  @GetMapping
  ResponseEntity<HealthStatusResponse> health();

  @Operation(
      summary = "Liveness check",
      description = "LIVE while heap usage stays under the critical threshold, DEAD with 503 above it"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Heap usage is acceptable"),
      @ApiResponse(responseCode = "503", description = "Heap usage is critical")
  })
  @GetMapping(value = LIVE)
  ResponseEntity<HealthStatusResponse> liveness();

  @Operation(
      summary = "Readiness check",
      description = "store: backend, round-trip time and error of the session store. "
          + "encryption: whether sessions are encrypted at rest or stored in plaintext. "
          + "bridge: browser connection of the cookie sync bridge, omitted when the bridge is disabled. "
          + "Only the store affects readiness."
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Session store answers"),
      @ApiResponse(responseCode = "503", description = "Session store is unreachable, captures cannot be saved")
  })
  @GetMapping(value = READY)
  ResponseEntity<ReadinessResponse> readiness();
}
