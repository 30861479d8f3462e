package com.example.platformauth.web.rest.controller;

import com.example.platformauth.domain.entity.CaptureState;
import com.example.platformauth.domain.entity.LoginResult;
import com.example.platformauth.domain.entity.PlatformStatus;
import com.example.platformauth.service.LoginCaptureService;
import com.example.platformauth.service.PlatformRegistry;
import com.example.platformauth.service.PlatformStatusService;
import com.example.platformauth.service.SessionStore;
import com.example.platformauth.web.rest.dto.PlatformSummary;
import com.example.platformauth.web.rest.dto.SessionCookiesResponse;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class PlatformController implements PlatformAPI {

  private final PlatformRegistry platformRegistry;
  private final PlatformStatusService statusService;
  private final LoginCaptureService loginCaptureService;
  private final SessionStore sessionStore;

  @Override
  public ResponseEntity<List<PlatformSummary>> listPlatforms() {
    return ResponseEntity.ok(platformRegistry.all().stream().map(PlatformSummary::from).toList());
  }

  @Override
  public ResponseEntity<Map<String, PlatformStatus>> getStatus() {
    return ResponseEntity.ok(statusService.getStatus());
  }

  @Override
  public ResponseEntity<PlatformStatus> getPlatformStatus(String platformId) {
    return ResponseEntity.ok(statusService.status(platformId));
  }

  @Override
  public ResponseEntity<SessionCookiesResponse> getSessionCookies(String platformId) {
    return statusService.getSessionCookies(platformId)
        .map(cookies -> ResponseEntity.ok(new SessionCookiesResponse(platformId, cookies)))
        .orElseGet(() -> ResponseEntity.noContent().build());
  }

  @Override
  public CompletableFuture<ResponseEntity<LoginResult>> login(String platformId) {
    return loginCaptureService.startLogin(platformId).thenApply(ResponseEntity::ok);
  }

  @Override
  public ResponseEntity<Map<String, Object>> logout(String platformId) {
    return ResponseEntity.ok(Map.of(
        "success", loginCaptureService.logout(platformId),
        "platform", platformId));
  }

  @Override
  public ResponseEntity<Map<String, Object>> clearAllSessions() {
    int cleared = sessionStore.deleteAll();
    return ResponseEntity.ok(Map.of(
        "success", true,
        "cleared", cleared));
  }

  @Override
  public ResponseEntity<Map<String, CaptureState>> activeLogins() {
    return ResponseEntity.ok(loginCaptureService.activeAttempts());
  }
}
