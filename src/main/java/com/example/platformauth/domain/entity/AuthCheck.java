package com.example.platformauth.domain.entity;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of inspecting the live browser cookie jar for one platform. Cookies are only carried when
 * the platform is authenticated.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuthCheck(boolean authenticated, Map<String, String> cookies) {

  public static AuthCheck unauthenticated() {
    return new AuthCheck(false, null);
  }

  public static AuthCheck authenticated(Map<String, String> cookies) {
    return new AuthCheck(true, Collections.unmodifiableMap(new LinkedHashMap<>(cookies)));
  }
}
