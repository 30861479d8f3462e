package com.example.platformauth.capture;

import com.example.platformauth.domain.entity.BrowserCookie;
import com.example.platformauth.domain.entity.PlatformDescriptor;
import java.util.Collection;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * For platforms whose intermediate pages set many cookies before login completes: only a
 * dashboard URL, or a named auth cookie when there is no URL, counts.
 */
@Component
public class DashboardOnlyLoginDetectionPolicy implements LoginDetectionPolicy {

  public static final String NAME = "dashboard-only";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public DetectionOutcome evaluateNavigation(
      PlatformDescriptor platform, String url, Collection<BrowserCookie> cookies) {
    return platform.isDashboardUrl(url) ? DetectionOutcome.DASHBOARD_MATCH : DetectionOutcome.NOT_AUTHENTICATED;
  }

  @Override
  public DetectionOutcome evaluateCookies(PlatformDescriptor platform, Map<String, String> cookies) {
    return LoginDetectionPolicy.hasAuthCookie(platform, cookies)
        ? DetectionOutcome.AUTH_COOKIE_PRESENT
        : DetectionOutcome.NOT_AUTHENTICATED;
  }
}
