package com.example.platformauth.config;

import com.example.platformauth.adapter.backend.client.SessionSyncClient;
import com.example.platformauth.adapter.browser.playwright.CdpCookieJarSource;
import com.example.platformauth.bridge.CookieSyncBridge;
import com.example.platformauth.bridge.FallbackBundleStore;
import com.example.platformauth.capture.LoginDetectionPolicyRegistry;
import com.example.platformauth.properties.ApplicationProperties;
import com.example.platformauth.service.EncryptionService;
import com.example.platformauth.service.PlatformRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bridge role: watches the everyday browser over CDP and pushes sessions to the store's sync
 * endpoint.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(value = "app.bridge.enabled", havingValue = "true")
public class BridgeConfig {

  private static final int SYNC_QUEUE_CAPACITY = 64;

  @Bean(initMethod = "start", destroyMethod = "stop")
  public CdpCookieJarSource cookieJarSource(ApplicationProperties properties) {
    ApplicationProperties.BridgeProperties bridge = properties.bridge();
    log.info("Bridge attaching to browser at {}", bridge.cdpEndpoint());
    return new CdpCookieJarSource(bridge.cdpEndpoint(), bridge.pollInterval());
  }

  @Bean
  public SessionSyncClient sessionSyncClient(ApplicationProperties properties, OkHttpClient syncOkHttpClient,
                                             ObjectMapper objectMapper) {
    return new SessionSyncClient(syncOkHttpClient, objectMapper, properties.bridge().backendUrl(),
                                 properties.sync().headerName(), properties.sync().sharedSecret());
  }

  @Bean
  public FallbackBundleStore fallbackBundleStore(ApplicationProperties properties, ObjectMapper objectMapper,
                                                 EncryptionService encryptionService) {
    return new FallbackBundleStore(Path.of(properties.bridge().fallbackDir()), objectMapper, encryptionService);
  }

  /**
   * Bounded so a burst of cookie changes cannot queue unbounded work.
   */
  @Bean(name = "bridgeSyncExecutor")
  public ThreadPoolTaskExecutor bridgeSyncExecutor(ApplicationProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.bridge().syncThreads());
    executor.setMaxPoolSize(properties.bridge().syncThreads());
    executor.setQueueCapacity(SYNC_QUEUE_CAPACITY);
    executor.setThreadNamePrefix("bridge-sync-");
    executor.initialize();
    return executor;
  }

  @Bean(initMethod = "start", destroyMethod = "stop")
  public CookieSyncBridge cookieSyncBridge(
      ApplicationProperties properties,
      PlatformRegistry platformRegistry,
      LoginDetectionPolicyRegistry policyRegistry,
      CdpCookieJarSource cookieJarSource,
      SessionSyncClient sessionSyncClient,
      FallbackBundleStore fallbackBundleStore,
      @Qualifier("bridgeSyncExecutor") ThreadPoolTaskExecutor bridgeSyncExecutor,
      TaskScheduler taskScheduler,
      Clock clock) {
    return new CookieSyncBridge(platformRegistry, policyRegistry, cookieJarSource, sessionSyncClient,
                                fallbackBundleStore, bridgeSyncExecutor, taskScheduler,
                                properties.bridge().retryInterval(), clock);
  }
}
