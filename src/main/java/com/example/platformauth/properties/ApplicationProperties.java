package com.example.platformauth.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Set;

/**
 * Centralized configuration properties for the platform session engine.
 * Uses records for immutability and type safety.
 */
@Validated
@ConfigurationProperties(prefix = "app")
public record ApplicationProperties(
    @NotNull @Valid SessionProperties session,
    @NotNull @Valid StoreProperties store,
    @NotNull @Valid RedisProperties redis,
    @NotNull @Valid CryptoProperties crypto,
    @NotNull @Valid CaptureProperties capture,
    @NotNull @Valid BridgeProperties bridge,
    @NotNull @Valid SyncProperties sync,
    @NotNull @Valid OkHttpProperties http,
    @NotEmpty List<@Valid PlatformProperties> platforms
) {

  /**
   * Session freshness and local cache sizing
   */
  public record SessionProperties(
      @DefaultValue("24h") @DurationUnit(ChronoUnit.HOURS) Duration freshnessWindow,
      @DefaultValue("1000") @Positive int cacheMaxSize
  ) {}

  /**
   * Durable backend selection
   */
  public record StoreProperties(
      @DefaultValue("redis") @Pattern(regexp = "redis|memory") String type,
      @DefaultValue("platform-auth:") @NotBlank String keyPrefix
  ) {}

  /**
   * Redis configuration
   */
  public record RedisProperties(
      @DefaultValue("localhost") @NotBlank String host,
      @DefaultValue("6379") @Min(1) @Max(65535) int port,
      String password,
      @DefaultValue("false") boolean ssl,
      @DefaultValue("2s") @DurationUnit(ChronoUnit.SECONDS) Duration timeout,
      @NotNull @Valid PoolProperties pool
  ) {
    public record PoolProperties(
        @DefaultValue("8") @Positive int maxActive,
        @DefaultValue("4") @Positive int maxIdle,
        @DefaultValue("0") @PositiveOrZero int minIdle,
        @DefaultValue("2s") @DurationUnit(ChronoUnit.SECONDS) Duration maxWait
    ) {}
  }

  /**
   * Keystore holding the session encryption key
   */
  public record CryptoProperties(
      @NotBlank String keystorePath,
      String keystorePassword,
      @DefaultValue("platform-auth-session-key") @NotBlank String keyAlias
  ) {}

  /**
   * Interactive login capture
   */
  public record CaptureProperties(
      @DefaultValue("3") int cookieThreshold,
      @DefaultValue("1s") @DurationUnit(ChronoUnit.MILLIS) Duration closeGraceDelay,
      @NotBlank String profileDir,
      @DefaultValue("false") boolean headless,
      @DefaultValue("1000") @Positive int windowWidth,
      @DefaultValue("700") @Positive int windowHeight,
      @DefaultValue("100ms") @DurationUnit(ChronoUnit.MILLIS) Duration pumpInterval,
      @DefaultValue("2m") @DurationUnit(ChronoUnit.SECONDS) Duration launchTimeout,
      @DefaultValue({"/login", "/signin", "/auth", "/accounts/login", "/register", "/signup"})
      List<String> loginPagePatterns
  ) {}

  /**
   * Cookie sync bridge attached to the user's everyday browser
   */
  public record BridgeProperties(
      @DefaultValue("false") boolean enabled,
      @DefaultValue("http://localhost:8080") String backendUrl,
      @DefaultValue("http://localhost:9222") String cdpEndpoint,
      @DefaultValue("2s") @DurationUnit(ChronoUnit.MILLIS) Duration pollInterval,
      @DefaultValue("60s") @DurationUnit(ChronoUnit.SECONDS) Duration retryInterval,
      @NotBlank String fallbackDir,
      @DefaultValue("4") @Positive int syncThreads
  ) {}

  /**
   * Shared secret guarding the network sync endpoint
   */
  public record SyncProperties(
      String sharedSecret,
      @DefaultValue("X-Sync-Token") @NotBlank String headerName
  ) {
    public boolean isSecured() {
      return sharedSecret != null && !sharedSecret.isBlank();
    }
  }

  /**
   * OkHttp client configuration
   */
  public record OkHttpProperties(
      @NotNull @Valid ClientProperties client
  ) {
    public record ClientProperties(
        @DefaultValue("20") @Positive int maxIdleConnections,
        @DefaultValue("5") @Positive int keepAliveDurationMinutes,
        @DefaultValue("100") @Positive int maxRequests,
        @DefaultValue("20") @Positive int maxRequestsPerHost,
        @DefaultValue("3s") @DurationUnit(ChronoUnit.SECONDS) Duration connectTimeout,
        @DefaultValue("10s") @DurationUnit(ChronoUnit.SECONDS) Duration readTimeout
    ) {}
  }

  /**
   * One supported platform. Login page patterns fall back to
   * {@link CaptureProperties#loginPagePatterns()} when not set.
   */
  public record PlatformProperties(
      @NotBlank String id,
      String name,
      @NotBlank String loginUrl,
      List<String> domains,
      List<String> dashboardPatterns,
      List<String> loginPagePatterns,
      Set<String> cookieAuthNames,
      @DefaultValue("false") boolean anyCookieAuthenticates,
      @DefaultValue("threshold") @NotBlank String detection
  ) {}
}
