package com.example.platformauth.capture;

import com.example.platformauth.domain.entity.PlatformDescriptor;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Resolves the detection policy configured for a platform.
 */
@Component
public class LoginDetectionPolicyRegistry {

  private final Map<String, LoginDetectionPolicy> policies;

  public LoginDetectionPolicyRegistry(List<LoginDetectionPolicy> policies) {
    Map<String, LoginDetectionPolicy> byName = new LinkedHashMap<>();
    for (LoginDetectionPolicy policy : policies) {
      if (byName.putIfAbsent(policy.name(), policy) != null) {
        throw new IllegalStateException("Duplicate login detection policy: " + policy.name());
      }
    }
    this.policies = Collections.unmodifiableMap(byName);
  }

  public LoginDetectionPolicy forPlatform(PlatformDescriptor platform) {
    LoginDetectionPolicy policy = policies.get(platform.detection());
    if (policy == null) {
      throw new IllegalStateException(
          "Platform " + platform.id() + " uses unknown login detection policy: " + platform.detection());
    }
    return policy;
  }

  public Set<String> names() {
    return policies.keySet();
  }
}
