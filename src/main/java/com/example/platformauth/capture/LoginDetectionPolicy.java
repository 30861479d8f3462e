package com.example.platformauth.capture;

import com.example.platformauth.domain.entity.BrowserCookie;
import com.example.platformauth.domain.entity.PlatformDescriptor;
import java.util.Collection;
import java.util.Map;

/**
 * Decides whether a platform login has completed. Implementations are stateless and selected
 * per platform by name.
 */
public interface LoginDetectionPolicy {

  /**
   * Name used in platform configuration to select this policy.
   */
  String name();

  /**
   * Evaluate a main-frame navigation of an interactive login window.
   *
   * @param url     the URL just navigated to
   * @param cookies the login context's whole cookie jar at that moment
   */
  DetectionOutcome evaluateNavigation(PlatformDescriptor platform, String url, Collection<BrowserCookie> cookies);

  /**
   * Evaluate a cookie set without any navigation context, as seen by the bridge.
   *
   * @param cookies cookie name to value
   */
  DetectionOutcome evaluateCookies(PlatformDescriptor platform, Map<String, String> cookies);

  static boolean hasAuthCookie(PlatformDescriptor platform, Collection<BrowserCookie> cookies) {
    return cookies.stream().anyMatch(cookie -> cookie.hasValue() && platform.isAuthCookieName(cookie.name()));
  }

  static boolean hasAuthCookie(PlatformDescriptor platform, Map<String, String> cookies) {
    return cookies.entrySet().stream()
        .anyMatch(entry -> platform.isAuthCookieName(entry.getKey())
            && entry.getValue() != null && !entry.getValue().isEmpty());
  }
}
