package com.example.platformauth.web.rest.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.example.platformauth.bridge.BridgeSyncResult;
import com.example.platformauth.bridge.CookieSyncBridge;
import com.example.platformauth.domain.entity.CookieBundle;
import com.example.platformauth.web.rest.dto.PendingBundleResponse;
import java.util.Map;
import java.util.TreeMap;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;

@ExtendWith(MockitoExtension.class)
class BridgeControllerTest {

  @Mock
  private CookieSyncBridge cookieSyncBridge;

  @InjectMocks
  private BridgeController bridgeController;

  @Test
  void pending_exposesCountsNotCookieValues() {
    Map<String, CookieBundle> bundles = new TreeMap<>();
    bundles.put("leetcode", new CookieBundle("LEETCODE_SESSION=abc; csrftoken=xyz", 1_000L));
    when(cookieSyncBridge.pendingBundles()).thenReturn(bundles);

    ResponseEntity<Map<String, PendingBundleResponse>> response = bridgeController.pending();

    assertThat(response.getBody()).containsExactly(Map.entry("leetcode", new PendingBundleResponse(1_000L, 2)));
  }

  @Test
  void syncPlatform_passesResultThrough() {
    BridgeSyncResult failed = BridgeSyncResult.failed("glider", BridgeSyncResult.ERROR_SAVED_LOCALLY);
    when(cookieSyncBridge.syncPlatform("glider")).thenReturn(failed);

    assertThat(bridgeController.syncPlatform("glider").getBody()).isEqualTo(failed);
  }
}
