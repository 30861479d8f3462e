package com.example.platformauth.web.rest.controller;

import com.example.platformauth.adapter.browser.CookieJarSource;
import com.example.platformauth.adapter.store.SessionRecordRepository;
import com.example.platformauth.adapter.store.dto.StoreHealthResponse;
import com.example.platformauth.service.EncryptionService;
import com.example.platformauth.web.rest.dto.HealthStatusResponse;
import com.example.platformauth.web.rest.dto.ReadinessResponse;
import com.example.platformauth.web.rest.dto.ReadinessResponse.BridgeStatus;
import com.example.platformauth.web.rest.dto.ReadinessResponse.EncryptionStatus;
import com.example.platformauth.web.rest.dto.ReadinessResponse.StoreStatus;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

/**
 * Health checks. Failures are answered here with 503 rather than passed to the
 * {@code GlobalErrorHandler}, so the supervisor always gets a status body.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class HealthController implements HealthAPI {

  private static final double MEMORY_USAGE_CRITICAL_PERCENT = 90.0;
  private static final long STORE_RESPONSE_TIME_WARNING_MS = 100L;
  private static final String STATUS_LIVE = "LIVE";
  private static final String STATUS_DEAD = "DEAD";

  private final SessionRecordRepository sessionRecordRepository;
  private final EncryptionService encryptionService;
  private final ObjectProvider<CookieJarSource> cookieJarSource;
  private final Clock clock;

  @Override
  public ResponseEntity<HealthStatusResponse> health() {
    return ResponseEntity.ok(HealthStatusResponse.up(clock.millis()));
  }

  @Override
  public ResponseEntity<HealthStatusResponse> liveness() {
    Runtime runtime = Runtime.getRuntime();
    long usedMemory = runtime.totalMemory() - runtime.freeMemory();
    double memoryUsagePercent = (double) usedMemory / runtime.maxMemory() * 100;

    if (memoryUsagePercent < MEMORY_USAGE_CRITICAL_PERCENT) {
      return ResponseEntity.ok(HealthStatusResponse.liveness(STATUS_LIVE, memoryUsagePercent));
    }
    log.warn("Liveness check failed: memory usage {}%", memoryUsagePercent);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(HealthStatusResponse.liveness(STATUS_DEAD, memoryUsagePercent));
  }

  /**
   * The session store must answer. Missing encryption and a detached bridge are reported but do
   * not make the service unready.
   */
  @Override
  public ResponseEntity<ReadinessResponse> readiness() {
    StoreHealthResponse storeHealth;
    try {
      storeHealth = sessionRecordRepository.checkHealth();
    } catch (RuntimeException e) {
      log.error("Session store health check failed", e);
      storeHealth = StoreHealthResponse.unhealthy("unknown", e.getMessage());
    }
    if (storeHealth.responseTimeMs() > STORE_RESPONSE_TIME_WARNING_MS) {
      log.warn("Session store is slow: {}ms", storeHealth.responseTimeMs());
    }

    CookieJarSource bridgeSource = cookieJarSource.getIfAvailable();
    BridgeStatus bridge = bridgeSource == null ? null : new BridgeStatus(bridgeSource.isConnected());

    boolean ready = storeHealth.healthy();
    if (!ready) {
      log.warn("Readiness check failed: store backend {} unhealthy", storeHealth.backend());
    }
    ReadinessResponse body = new ReadinessResponse(
        ready,
        StoreStatus.from(storeHealth),
        new EncryptionStatus(encryptionService.isEncryptionAvailable()),
        bridge,
        clock.millis());
    return ResponseEntity.status(ready ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
  }
}
