package com.example.platformauth.bridge;

import com.example.platformauth.adapter.backend.client.SessionSyncClient;
import com.example.platformauth.adapter.backend.dto.SyncAcknowledgement;
import com.example.platformauth.adapter.backend.dto.SyncPayload;
import com.example.platformauth.adapter.browser.CookieChangeEvent;
import com.example.platformauth.adapter.browser.CookieJarSource;
import com.example.platformauth.capture.LoginDetectionPolicyRegistry;
import com.example.platformauth.domain.entity.AuthCheck;
import com.example.platformauth.domain.entity.BrowserCookie;
import com.example.platformauth.domain.entity.CookieBundle;
import com.example.platformauth.domain.entity.PlatformDescriptor;
import com.example.platformauth.exception.CookieJarUnavailableException;
import com.example.platformauth.exception.SyncNetworkException;
import com.example.platformauth.service.PlatformRegistry;
import com.example.platformauth.util.CookieUtil;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

/**
 * Watches the everyday browser's cookie jar and pushes platform sessions to the session store
 * over HTTP. Bundles that cannot be delivered are kept in {@link FallbackBundleStore} and
 * re-posted with their original capture time.
 */
@Slf4j
public class CookieSyncBridge {

  private static final String URL_SCHEME = "https://";
  private static final String WWW_PREFIX = "www.";

  private final PlatformRegistry platformRegistry;
  private final LoginDetectionPolicyRegistry policyRegistry;
  private final CookieJarSource cookieJarSource;
  private final SessionSyncClient syncClient;
  private final FallbackBundleStore fallbackStore;
  private final Executor syncExecutor;
  private final TaskScheduler taskScheduler;
  private final Duration retryInterval;
  private final Clock clock;

  private final Map<String, String> lastSynced = new ConcurrentHashMap<>();
  private final Set<String> queued = ConcurrentHashMap.newKeySet();
  private final ReentrantLock flushLock = new ReentrantLock();
  private final Object fallbackLock = new Object();
  private ScheduledFuture<?> retryTask;

  public CookieSyncBridge(
      PlatformRegistry platformRegistry,
      LoginDetectionPolicyRegistry policyRegistry,
      CookieJarSource cookieJarSource,
      SessionSyncClient syncClient,
      FallbackBundleStore fallbackStore,
      Executor syncExecutor,
      TaskScheduler taskScheduler,
      Duration retryInterval,
      Clock clock) {
    this.platformRegistry = platformRegistry;
    this.policyRegistry = policyRegistry;
    this.cookieJarSource = cookieJarSource;
    this.syncClient = syncClient;
    this.fallbackStore = fallbackStore;
    this.syncExecutor = syncExecutor;
    this.taskScheduler = taskScheduler;
    this.retryInterval = retryInterval;
    this.clock = clock;
  }

  public void start() {
    cookieJarSource.addListener(this::onCookieChanged);
    retryTask = taskScheduler.scheduleWithFixedDelay(
        this::retryPending, clock.instant().plus(retryInterval), retryInterval);
    log.info("Cookie sync bridge started, retrying pending bundles every {}", retryInterval);
  }

  public void stop() {
    if (retryTask != null) {
      retryTask.cancel(false);
    }
  }

  /**
   * Collects the platform's cookies from the browser. URL queries see secure and partitioned
   * cookies, so their values win over the domain query.
   *
   * @return cookie name to value, empty when the browser holds none
   * @throws com.example.platformauth.exception.UnknownPlatformException for unconfigured ids
   * @throws CookieJarUnavailableException when the browser cannot be reached
   */
  public Optional<Map<String, String>> captureCookies(String platformId) {
    PlatformDescriptor platform = platformRegistry.require(platformId);
    Map<String, String> fromUrls = new LinkedHashMap<>();
    Map<String, String> fromDomains = new LinkedHashMap<>();

    for (String domain : platform.domains()) {
      for (String url : List.of(URL_SCHEME + domain, URL_SCHEME + WWW_PREFIX + domain)) {
        for (BrowserCookie cookie : cookieJarSource.cookiesForUrl(url)) {
          fromUrls.put(cookie.name(), cookie.value());
        }
      }
      for (BrowserCookie cookie : cookieJarSource.cookiesForDomain(domain)) {
        fromDomains.putIfAbsent(cookie.name(), cookie.value());
      }
    }

    Map<String, String> merged = new LinkedHashMap<>(fromDomains);
    merged.putAll(fromUrls);
    log.debug("Captured {} cookies for {} ({} by URL, {} by domain)",
              merged.size(), platformId, fromUrls.size(), fromDomains.size());
    return merged.isEmpty() ? Optional.empty() : Optional.of(merged);
  }

  /**
   * Cookie-only login check. Cookies are only returned for an authenticated platform.
   */
  public AuthCheck checkAuth(String platformId) {
    PlatformDescriptor platform = platformRegistry.require(platformId);
    Optional<Map<String, String>> cookies;
    try {
      cookies = captureCookies(platformId);
    } catch (CookieJarUnavailableException e) {
      log.warn("Cannot check {}: {}", platformId, e.getMessage());
      return AuthCheck.unauthenticated();
    }
    if (cookies.isEmpty()) {
      return AuthCheck.unauthenticated();
    }
    boolean authenticated = policyRegistry.forPlatform(platform)
        .evaluateCookies(platform, cookies.get())
        .isAuthenticated();
    return authenticated ? AuthCheck.authenticated(cookies.get()) : AuthCheck.unauthenticated();
  }

  /**
   * Posts the cookies to the session store. On failure the bundle is kept locally for retry.
   *
   * @return true when the store accepted the bundle
   */
  public boolean syncToBackend(String platformId, Map<String, String> cookies) {
    platformRegistry.require(platformId);
    String cookieHeader = CookieUtil.toCookieHeader(cookies);
    if (cookieHeader.isBlank()) {
      return false;
    }
    CookieBundle bundle = new CookieBundle(cookieHeader, clock.millis());
    try {
      SyncAcknowledgement ack = syncClient.push(new SyncPayload(platformId, cookieHeader, bundle.timestamp()));
      lastSynced.put(platformId, cookieHeader);
      log.info("Synced {} cookies for {} (applied={})", cookies.size(), platformId, ack.applied());
    } catch (SyncNetworkException e) {
      log.warn("Sync of {} failed, keeping it in fallback storage: {}", platformId, e.getMessage());
      synchronized (fallbackLock) {
        fallbackStore.write(platformId, bundle);
      }
      return false;
    }
    synchronized (fallbackLock) {
      fallbackStore.read(platformId)
          .filter(pending -> pending.timestamp() <= bundle.timestamp())
          .ifPresent(pending -> fallbackStore.remove(platformId));
    }
    retryPending();
    return true;
  }

  public BridgeSyncResult syncPlatform(String platformId) {
    AuthCheck check = checkAuth(platformId);
    if (!check.authenticated()) {
      return BridgeSyncResult.failed(platformId, BridgeSyncResult.ERROR_NOT_AUTHENTICATED);
    }
    return syncToBackend(platformId, check.cookies())
        ? BridgeSyncResult.synced(platformId)
        : BridgeSyncResult.failed(platformId, BridgeSyncResult.ERROR_SAVED_LOCALLY);
  }

  /**
   * Syncs every platform the browser is logged in to.
   */
  public Map<String, BridgeSyncResult> syncAll() {
    Map<String, BridgeSyncResult> results = new LinkedHashMap<>();
    for (PlatformDescriptor platform : platformRegistry.all()) {
      BridgeSyncResult result = syncPlatform(platform.id());
      if (result.success() || !BridgeSyncResult.ERROR_NOT_AUTHENTICATED.equals(result.error())) {
        results.put(platform.id(), result);
      }
    }
    return results;
  }

  public Map<String, BridgePlatformStatus> status() {
    Map<String, BridgePlatformStatus> statuses = new LinkedHashMap<>();
    for (PlatformDescriptor platform : platformRegistry.all()) {
      AuthCheck check = checkAuth(platform.id());
      statuses.put(platform.id(),
                   new BridgePlatformStatus(check.authenticated(), check.authenticated() ? check.cookies().size() : 0));
    }
    return statuses;
  }

  public Map<String, CookieBundle> pendingBundles() {
    return fallbackStore.pending();
  }

  /**
   * Re-posts bundles held in fallback storage. A bundle the store rejects is dropped and the pass
   * continues; any other failure ends the pass with the remaining bundles kept.
   *
   * @return number of bundles the store accepted
   */
  public int retryPending() {
    if (!flushLock.tryLock()) {
      return 0;
    }
    try {
      int delivered = 0;
      for (Map.Entry<String, CookieBundle> entry : fallbackStore.pending().entrySet()) {
        String platformId = entry.getKey();
        CookieBundle bundle = entry.getValue();
        try {
          SyncAcknowledgement ack = syncClient.push(new SyncPayload(platformId, bundle.cookies(), bundle.timestamp()));
          log.info("Delivered pending bundle for {} (applied={})", platformId, ack.applied());
        } catch (SyncNetworkException e) {
          if (!e.isRejected()) {
            log.debug("Pending bundles still undeliverable: {}", e.getMessage());
            break;
          }
          log.warn("Store rejected pending bundle for {}, dropping it: {}", platformId, e.getMessage());
          removePending(platformId, bundle);
          continue;
        }
        removePending(platformId, bundle);
        delivered++;
      }
      return delivered;
    } finally {
      flushLock.unlock();
    }
  }

  private void removePending(String platformId, CookieBundle bundle) {
    synchronized (fallbackLock) {
      fallbackStore.read(platformId)
          .filter(current -> current.timestamp() == bundle.timestamp())
          .ifPresent(current -> fallbackStore.remove(platformId));
    }
  }

  /**
   * Cookie jar listener. Runs on the cookie source's thread, so matching work is handed to the
   * sync executor; repeated changes for a platform already queued are coalesced.
   */
  public void onCookieChanged(CookieChangeEvent event) {
    if (event.removed()) {
      return;
    }
    BrowserCookie cookie = event.cookie();
    platformRegistry.all().stream()
        .filter(platform -> platform.ownsCookieDomain(cookie.domain()))
        .filter(platform -> platform.isAuthCookieName(cookie.name()) || platform.anyCookieAuthenticates())
        .findFirst()
        .ifPresent(platform -> scheduleAutoSync(platform.id()));
  }

  private void scheduleAutoSync(String platformId) {
    if (!queued.add(platformId)) {
      return;
    }
    try {
      syncExecutor.execute(() -> {
        queued.remove(platformId);
        autoSync(platformId);
      });
    } catch (RejectedExecutionException e) {
      queued.remove(platformId);
      log.warn("Auto-sync of {} dropped, sync executor is saturated", platformId);
    }
  }

  private void autoSync(String platformId) {
    try {
      AuthCheck check = checkAuth(platformId);
      if (!check.authenticated()) {
        return;
      }
      String cookieHeader = CookieUtil.toCookieHeader(check.cookies());
      if (cookieHeader.equals(lastSynced.get(platformId))) {
        log.debug("Cookies of {} unchanged since last sync", platformId);
        return;
      }
      log.info("Cookie change detected for {}, syncing", platformId);
      syncToBackend(platformId, check.cookies());
    } catch (RuntimeException e) {
      log.error("Auto-sync of {} failed", platformId, e);
    }
  }
}
