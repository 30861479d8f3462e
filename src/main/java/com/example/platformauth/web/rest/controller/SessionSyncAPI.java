package com.example.platformauth.web.rest.controller;

import static com.example.platformauth.web.rest.ApiConstants.ApiPath.*;

import com.example.platformauth.web.rest.dto.SyncRequest;
import com.example.platformauth.web.rest.dto.SyncResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Network entry point of the session store, used by the cookie sync bridge.
 */
@Tag(
    name = "Session Sync",
    description = "Receives sessions captured from the user's everyday browser"
)
@RequestMapping(
    value = API_BASE + SYNC,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface SessionSyncAPI {

  @Operation(
      summary = "Push a cookie bundle",
      description = "Stores the bundle unless a newer capture is already held; applied=false reports that case"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Bundle accepted"),
      @ApiResponse(responseCode = "400", description = "Missing fields or unknown platform"),
      @ApiResponse(responseCode = "401", description = "Missing or invalid sync token"),
      @ApiResponse(responseCode = "503", description = "Session store unavailable")
  })
  @PostMapping(value = COOKIES, consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<SyncResponse> syncCookies(@Valid @RequestBody SyncRequest request);
}
