package com.example.platformauth.service;

import com.example.platformauth.domain.entity.PlatformDescriptor;
import com.example.platformauth.exception.UnknownPlatformException;
import com.example.platformauth.properties.ApplicationProperties;
import com.example.platformauth.properties.ApplicationProperties.PlatformProperties;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Immutable catalogue of supported platforms, in configuration order.
 */
@Slf4j
@Service
public class PlatformRegistry {

  private final Map<String, PlatformDescriptor> platforms;

  @Autowired
  public PlatformRegistry(ApplicationProperties properties) {
    this(toDescriptors(properties));
  }

  public PlatformRegistry(List<PlatformDescriptor> descriptors) {
    Map<String, PlatformDescriptor> byId = new LinkedHashMap<>();
    for (PlatformDescriptor descriptor : descriptors) {
      if (byId.putIfAbsent(descriptor.id(), descriptor) != null) {
        throw new IllegalStateException("Duplicate platform id: " + descriptor.id());
      }
    }
    this.platforms = Collections.unmodifiableMap(byId);
    log.info("Platform registry loaded with {} platforms: {}", platforms.size(), platforms.keySet());
  }

  public Optional<PlatformDescriptor> find(String platformId) {
    if (platformId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(platforms.get(platformId));
  }

  /**
   * @throws UnknownPlatformException when no platform with this id is configured
   */
  public PlatformDescriptor require(String platformId) {
    return find(platformId).orElseThrow(() -> {
      log.error("Rejected request for unknown platform '{}'", platformId);
      return new UnknownPlatformException(platformId);
    });
  }

  public Collection<PlatformDescriptor> all() {
    return platforms.values();
  }

  public Set<String> ids() {
    return platforms.keySet();
  }

  private static List<PlatformDescriptor> toDescriptors(ApplicationProperties properties) {
    List<String> sharedLoginPatterns = properties.capture().loginPagePatterns();
    return properties.platforms().stream()
        .map(platform -> toDescriptor(platform, sharedLoginPatterns))
        .toList();
  }

  private static PlatformDescriptor toDescriptor(PlatformProperties platform, List<String> sharedLoginPatterns) {
    List<String> loginPatterns = platform.loginPagePatterns() == null || platform.loginPagePatterns().isEmpty()
        ? sharedLoginPatterns
        : platform.loginPagePatterns();
    return new PlatformDescriptor(
        platform.id(),
        platform.name(),
        platform.loginUrl(),
        platform.domains(),
        platform.dashboardPatterns(),
        loginPatterns,
        platform.cookieAuthNames(),
        platform.anyCookieAuthenticates(),
        platform.detection());
  }
}
