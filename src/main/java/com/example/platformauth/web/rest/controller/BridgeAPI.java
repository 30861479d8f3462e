package com.example.platformauth.web.rest.controller;

import static com.example.platformauth.web.rest.ApiConstants.ApiPath.*;

import com.example.platformauth.bridge.BridgePlatformStatus;
import com.example.platformauth.bridge.BridgeSyncResult;
import com.example.platformauth.web.rest.dto.PendingBundleResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Manual controls of the cookie sync bridge. Only present when the bridge is enabled.
 */
@Tag(
    name = "Bridge",
    description = "Cookie sync bridge attached to the everyday browser"
)
@RequestMapping(
    value = BRIDGE_BASE,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface BridgeAPI {

  @Operation(
      summary = "Browser login status",
      description = "Cookie-only authentication check of every platform in the everyday browser"
  )
  @GetMapping(value = STATUS)
  ResponseEntity<Map<String, BridgePlatformStatus>> status();

  @Operation(
      summary = "Sync one platform"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Sync attempted, see success and error"),
      @ApiResponse(responseCode = "400", description = "Unknown platform")
  })
  @PostMapping(value = SYNC + "/{platformId}")
  ResponseEntity<BridgeSyncResult> syncPlatform(@PathVariable String platformId);

  @Operation(
      summary = "Sync all platforms",
      description = "Syncs every platform the browser is logged in to"
  )
  @PostMapping(value = SYNC)
  ResponseEntity<Map<String, BridgeSyncResult>> syncAll();

  @Operation(
      summary = "Pending bundles",
      description = "Bundles waiting in fallback storage for the store to become reachable"
  )
  @GetMapping(value = PENDING)
  ResponseEntity<Map<String, PendingBundleResponse>> pending();
}
