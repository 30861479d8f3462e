package com.example.platformauth.web.rest.controller;

import com.example.platformauth.bridge.BridgePlatformStatus;
import com.example.platformauth.bridge.BridgeSyncResult;
import com.example.platformauth.bridge.CookieSyncBridge;
import com.example.platformauth.web.rest.dto.PendingBundleResponse;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@ConditionalOnProperty(value = "app.bridge.enabled", havingValue = "true")
public class BridgeController implements BridgeAPI {

  private final CookieSyncBridge cookieSyncBridge;

  @Override
  public ResponseEntity<Map<String, BridgePlatformStatus>> status() {
    return ResponseEntity.ok(cookieSyncBridge.status());
  }

  @Override
  public ResponseEntity<BridgeSyncResult> syncPlatform(String platformId) {
    return ResponseEntity.ok(cookieSyncBridge.syncPlatform(platformId));
  }

  @Override
  public ResponseEntity<Map<String, BridgeSyncResult>> syncAll() {
    return ResponseEntity.ok(cookieSyncBridge.syncAll());
  }

  @Override
  public ResponseEntity<Map<String, PendingBundleResponse>> pending() {
    Map<String, PendingBundleResponse> pending = new LinkedHashMap<>();
    cookieSyncBridge.pendingBundles().forEach((platformId, bundle) ->
                                                  pending.put(platformId, PendingBundleResponse.from(bundle)));
    return ResponseEntity.ok(pending);
  }
}
