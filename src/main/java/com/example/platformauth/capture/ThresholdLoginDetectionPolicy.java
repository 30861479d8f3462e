package com.example.platformauth.capture;

import com.example.platformauth.domain.entity.BrowserCookie;
import com.example.platformauth.domain.entity.PlatformDescriptor;
import com.example.platformauth.properties.ApplicationProperties;
import java.util.Collection;
import java.util.Map;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Default policy. A dashboard URL wins outright. Otherwise, off a login page, enough cookies count
 * as logged in. Named auth cookies only matter when there is no URL to go by.
 */
@Component
public class ThresholdLoginDetectionPolicy implements LoginDetectionPolicy {

  public static final String NAME = "threshold";

  private final int cookieThreshold;

  @Autowired
  public ThresholdLoginDetectionPolicy(ApplicationProperties properties) {
    this(properties.capture().cookieThreshold());
  }

  public ThresholdLoginDetectionPolicy(int cookieThreshold) {
    this.cookieThreshold = cookieThreshold;
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public DetectionOutcome evaluateNavigation(
      PlatformDescriptor platform, String url, Collection<BrowserCookie> cookies) {
    if (platform.isDashboardUrl(url)) {
      return DetectionOutcome.DASHBOARD_MATCH;
    }
    if (url == null || platform.isLoginPage(url)) {
      return DetectionOutcome.NOT_AUTHENTICATED;
    }
    if (cookies.size() >= cookieThreshold) {
      return DetectionOutcome.COOKIE_THRESHOLD;
    }
    return DetectionOutcome.NOT_AUTHENTICATED;
  }

  @Override
  public DetectionOutcome evaluateCookies(PlatformDescriptor platform, Map<String, String> cookies) {
    if (LoginDetectionPolicy.hasAuthCookie(platform, cookies)) {
      return DetectionOutcome.AUTH_COOKIE_PRESENT;
    }
    if (platform.anyCookieAuthenticates() && cookies.size() >= cookieThreshold) {
      return DetectionOutcome.COOKIE_THRESHOLD;
    }
    return DetectionOutcome.NOT_AUTHENTICATED;
  }
}
