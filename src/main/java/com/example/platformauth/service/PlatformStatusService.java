package com.example.platformauth.service;

import com.example.platformauth.domain.entity.PlatformDescriptor;
import com.example.platformauth.domain.entity.PlatformStatus;
import com.example.platformauth.domain.entity.SessionRecord;
import com.example.platformauth.properties.ApplicationProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Read path for platform authentication state. Expired records are evicted on read; there is no
 * background expiry.
 */
@Slf4j
@Service
public class PlatformStatusService {

  private final SessionStore sessionStore;
  private final PlatformRegistry platformRegistry;
  private final Clock clock;
  private final Duration freshnessWindow;

  public PlatformStatusService(
      SessionStore sessionStore,
      PlatformRegistry platformRegistry,
      Clock clock,
      ApplicationProperties properties) {
    this.sessionStore = sessionStore;
    this.platformRegistry = platformRegistry;
    this.clock = clock;
    this.freshnessWindow = properties.session().freshnessWindow();
  }

  /**
   * Status of every configured platform, in catalogue order.
   */
  public Map<String, PlatformStatus> getStatus() {
    Map<String, PlatformStatus> statuses = new LinkedHashMap<>();
    for (PlatformDescriptor platform : platformRegistry.all()) {
      statuses.put(platform.id(), status(platform.id()));
    }
    return statuses;
  }

  public PlatformStatus status(String platformId) {
    platformRegistry.require(platformId);
    return freshRecord(platformId)
        .map(PlatformStatus::authenticated)
        .orElse(PlatformStatus.notAuthenticated());
  }

  /**
   * @return the cookie header of a fresh session, empty when none
   */
  public Optional<String> getSessionCookies(String platformId) {
    platformRegistry.require(platformId);
    return freshRecord(platformId).map(SessionRecord::cookieHeader);
  }

  private Optional<SessionRecord> freshRecord(String platformId) {
    Optional<SessionRecord> record = sessionStore.load(platformId);
    if (record.isEmpty()) {
      return Optional.empty();
    }
    Instant now = clock.instant();
    if (!record.get().isExpired(freshnessWindow, now)) {
      return record;
    }
    log.info("Session for {} is older than {}, evicting", platformId, freshnessWindow);
    sessionStore.evictIfCapturedBefore(platformId, now.minus(freshnessWindow));
    // A newer capture may have landed between the read and the eviction.
    return sessionStore.load(platformId).filter(current -> !current.isExpired(freshnessWindow, now));
  }
}
