package com.example.platformauth.web.rest.controller;

import static com.example.platformauth.web.rest.ApiConstants.ApiPath.*;

import com.example.platformauth.domain.entity.CaptureState;
import com.example.platformauth.domain.entity.LoginResult;
import com.example.platformauth.domain.entity.PlatformStatus;
import com.example.platformauth.web.rest.dto.PlatformSummary;
import com.example.platformauth.web.rest.dto.SessionCookiesResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Platform catalogue, session status and interactive login control.
 */
@Tag(
    name = "Platforms",
    description = "Session status and interactive login for supported platforms"
)
@RequestMapping(
    value = API_BASE + PLATFORMS,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface PlatformAPI {

  @Operation(
      summary = "List platforms",
      description = "Returns every configured platform in catalogue order"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Platform list returned")
  })
  @GetMapping
  ResponseEntity<List<PlatformSummary>> listPlatforms();

  @Operation(
      summary = "Status of all platforms",
      description = "Authentication status of every platform. Expired sessions are evicted while reading."
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Status map returned"),
      @ApiResponse(responseCode = "503", description = "Session store unavailable")
  })
  @GetMapping(value = STATUS)
  ResponseEntity<Map<String, PlatformStatus>> getStatus();

  @Operation(
      summary = "Status of one platform"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Status returned"),
      @ApiResponse(responseCode = "400", description = "Unknown platform")
  })
  @GetMapping(value = PLATFORM_ID + STATUS)
  ResponseEntity<PlatformStatus> getPlatformStatus(
      @Parameter(description = "Platform id", example = "leetcode") @PathVariable String platformId);

  @Operation(
      summary = "Session cookies",
      description = "Cookie header of a fresh session for the platform"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Cookies returned"),
      @ApiResponse(responseCode = "204", description = "No fresh session"),
      @ApiResponse(responseCode = "400", description = "Unknown platform")
  })
  @GetMapping(value = PLATFORM_ID + COOKIES)
  ResponseEntity<SessionCookiesResponse> getSessionCookies(@PathVariable String platformId);

  @Operation(
      summary = "Interactive login",
      description = "Opens a login window for the platform. The response is sent once the window closes."
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Login finished, see success and reason"),
      @ApiResponse(responseCode = "400", description = "Unknown platform")
  })
  @PostMapping(value = PLATFORM_ID + LOGIN)
  CompletableFuture<ResponseEntity<LoginResult>> login(@PathVariable String platformId);

  @Operation(
      summary = "Logout",
      description = "Deletes the stored session and the platform's browser profile"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Logged out"),
      @ApiResponse(responseCode = "400", description = "Unknown platform")
  })
  @DeleteMapping(value = PLATFORM_ID + SESSION)
  ResponseEntity<Map<String, Object>> logout(@PathVariable String platformId);

  @Operation(
      summary = "Clear all sessions"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Sessions cleared")
  })
  @DeleteMapping(value = SESSIONS)
  ResponseEntity<Map<String, Object>> clearAllSessions();

  @Operation(
      summary = "Logins in flight",
      description = "Platforms with an open login window and the state of each attempt"
  )
  @GetMapping(value = LOGINS)
  ResponseEntity<Map<String, CaptureState>> activeLogins();
}
