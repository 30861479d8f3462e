package com.example.platformauth.config;

import com.example.platformauth.capture.LoginDetectionPolicyRegistry;
import com.example.platformauth.properties.ApplicationProperties;
import com.example.platformauth.properties.ApplicationProperties.PlatformProperties;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Cross-field configuration rules that bean validation on {@link ApplicationProperties} cannot
 * express. All violations are collected and reported together at startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@EnableConfigurationProperties(ApplicationProperties.class)
public class ConfigurationValidator implements InitializingBean {

  private static final String ERROR_INVALID_URL = "%s is invalid: %s";
  private static final String ERROR_MIN_DURATION = "%s must be at least %s.";
  private static final Duration MIN_FRESHNESS_WINDOW = Duration.ofMinutes(1);
  private static final Duration MIN_POLL_INTERVAL = Duration.ofMillis(250);
  private static final Set<String> WEB_SCHEMES = Set.of("http", "https");

  private final ApplicationProperties properties;
  private final LoginDetectionPolicyRegistry policyRegistry;

  @Override
  public void afterPropertiesSet() {
    log.info("Validating application configuration business rules...");
    List<String> errors = validate();

    if (!errors.isEmpty()) {
      String errorMessage = String.format("Configuration validation failed with %d error(s):\n- %s",
                                          errors.size(), String.join("\n- ", errors));
      log.error(errorMessage);
      throw new IllegalStateException(errorMessage);
    }
    log.info("Configuration validated successfully.");
  }

  List<String> validate() {
    List<String> errors = new ArrayList<>();
    validatePlatforms(errors);
    validateSessionConfig(errors);
    validateCaptureConfig(errors);
    validateBridgeConfig(errors);
    validateHttpConfig(errors);
    return errors;
  }

  private void validatePlatforms(List<String> errors) {
    Set<String> seen = new HashSet<>();
    for (PlatformProperties platform : properties.platforms()) {
      String id = platform.id();
      if (!seen.add(id)) {
        errors.add("Duplicate platform id: " + id);
      }
      if (!id.equals(id.toLowerCase(Locale.ROOT))) {
        errors.add("Platform id must be lower-case: " + id);
      }
      if (!isValidWebUrl(platform.loginUrl())) {
        errors.add(ERROR_INVALID_URL.formatted("Login URL of " + id, platform.loginUrl()));
      }
      if (!policyRegistry.names().contains(platform.detection())) {
        errors.add("Platform %s uses unknown login detection policy '%s', known: %s"
                       .formatted(id, platform.detection(), policyRegistry.names()));
      }
      if (platform.domains() != null) {
        for (String domain : platform.domains()) {
          if (domain == null || domain.isBlank() || domain.startsWith(".") || domain.contains("/")) {
            errors.add("Platform %s has an invalid cookie domain: '%s'".formatted(id, domain));
          }
        }
      }
    }
  }

  private void validateSessionConfig(List<String> errors) {
    if (properties.session().freshnessWindow().compareTo(MIN_FRESHNESS_WINDOW) < 0) {
      errors.add(ERROR_MIN_DURATION.formatted("Session freshness window", "1 minute"));
    }
  }

  private void validateCaptureConfig(List<String> errors) {
    ApplicationProperties.CaptureProperties capture = properties.capture();
    if (capture.cookieThreshold() < 1) {
      errors.add("Cookie threshold must be at least 1, but was: " + capture.cookieThreshold());
    }
    if (capture.closeGraceDelay().isNegative()) {
      errors.add("Close grace delay cannot be negative.");
    }
  }

  private void validateBridgeConfig(List<String> errors) {
    ApplicationProperties.BridgeProperties bridge = properties.bridge();
    if (!bridge.enabled()) {
      return;
    }
    if (!isValidWebUrl(bridge.backendUrl())) {
      errors.add(ERROR_INVALID_URL.formatted("Bridge backend URL", bridge.backendUrl()));
    }
    if (!isValidWebUrl(bridge.cdpEndpoint())) {
      errors.add(ERROR_INVALID_URL.formatted("Bridge CDP endpoint", bridge.cdpEndpoint()));
    }
    if (bridge.pollInterval().compareTo(MIN_POLL_INTERVAL) < 0) {
      errors.add(ERROR_MIN_DURATION.formatted("Bridge poll interval", "250ms"));
    }
    if (bridge.retryInterval().compareTo(Duration.ofSeconds(1)) < 0) {
      errors.add(ERROR_MIN_DURATION.formatted("Bridge retry interval", "1 second"));
    }
  }

  private void validateHttpConfig(List<String> errors) {
    ApplicationProperties.OkHttpProperties.ClientProperties client = properties.http().client();
    if (client.maxRequests() < client.maxRequestsPerHost()) {
      errors.add("Total max requests must be greater than or equal to max requests per host.");
    }
  }

  private boolean isValidWebUrl(String url) {
    if (url == null || url.isBlank()) {
      return false;
    }
    try {
      URI uri = new URI(url);
      return uri.getScheme() != null
          && WEB_SCHEMES.contains(uri.getScheme().toLowerCase(Locale.ROOT))
          && uri.getHost() != null;
    } catch (URISyntaxException e) {
      return false;
    }
  }
}
