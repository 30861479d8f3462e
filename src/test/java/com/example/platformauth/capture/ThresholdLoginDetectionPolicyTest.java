package com.example.platformauth.capture;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.platformauth.TestFixtures;
import com.example.platformauth.domain.entity.BrowserCookie;
import com.example.platformauth.domain.entity.PlatformDescriptor;
import com.example.platformauth.service.PlatformRegistry;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ThresholdLoginDetectionPolicyTest {

  @TempDir
  Path tempDir;

  private PlatformRegistry registry;
  private ThresholdLoginDetectionPolicy policy;

  @BeforeEach
  void setUp() {
    registry = new PlatformRegistry(TestFixtures.properties(tempDir).build());
    policy = new ThresholdLoginDetectionPolicy(3);
  }

  @Test
  void dashboardUrl_succeedsWithoutCookies() {
    PlatformDescriptor leetcode = registry.require("leetcode");

    DetectionOutcome outcome = policy.evaluateNavigation(leetcode, "https://leetcode.com/problemset/", List.of());

    assertThat(outcome).isEqualTo(DetectionOutcome.DASHBOARD_MATCH);
    assertThat(outcome.isAuthenticated()).isTrue();
  }

  @Test
  void intermediatePage_withThreeCookies_succeedsByThreshold() {
    PlatformDescriptor coderpad = registry.require("coderpad");

    DetectionOutcome outcome = policy.evaluateNavigation(coderpad, "https://coderpad.io/verify", cookies(3));

    assertThat(outcome).isEqualTo(DetectionOutcome.COOKIE_THRESHOLD);
  }

  @Test
  void intermediatePage_withTwoCookies_keepsWaiting() {
    PlatformDescriptor coderpad = registry.require("coderpad");

    DetectionOutcome outcome = policy.evaluateNavigation(coderpad, "https://coderpad.io/verify", cookies(2));

    assertThat(outcome).isEqualTo(DetectionOutcome.NOT_AUTHENTICATED);
    assertThat(outcome.isAuthenticated()).isFalse();
  }

  @Test
  void loginPage_neverSucceedsOnCookieCount() {
    PlatformDescriptor coderpad = registry.require("coderpad");

    assertThat(policy.evaluateNavigation(coderpad, "https://coderpad.io/login?next=/x", cookies(10)))
        .isEqualTo(DetectionOutcome.NOT_AUTHENTICATED);
    assertThat(policy.evaluateNavigation(coderpad, "https://coderpad.io/SignUp", cookies(10)))
        .isEqualTo(DetectionOutcome.NOT_AUTHENTICATED);
  }

  @Test
  void dashboardPatterns_areCaseSensitive() {
    PlatformDescriptor leetcode = registry.require("leetcode");

    assertThat(policy.evaluateNavigation(leetcode, "https://LEETCODE.com/PROBLEMSET/", cookies(1)))
        .isEqualTo(DetectionOutcome.NOT_AUTHENTICATED);
  }

  @Test
  void glider_withFiveUnnamedCookiesOffLoginPage_isAuthenticated() {
    PlatformDescriptor glider = registry.require("glider");

    DetectionOutcome outcome = policy.evaluateNavigation(glider, "https://glider.ai/welcome", cookies(5));

    assertThat(outcome.isAuthenticated()).isTrue();
  }

  @Test
  void namedAuthCookieBelowThreshold_offLoginPage_keepsWaiting() {
    PlatformDescriptor hackerrank = registry.require("hackerrank");
    List<BrowserCookie> jar = List.of(BrowserCookie.of("_hrank_session", "abc", ".hackerrank.com"));

    DetectionOutcome outcome = policy.evaluateNavigation(hackerrank, "https://www.hackerrank.com/", jar);

    assertThat(outcome).isEqualTo(DetectionOutcome.NOT_AUTHENTICATED);
    assertThat(outcome.isAuthenticated()).isFalse();
  }

  @Test
  void namedAuthCookieWithEmptyValue_doesNotCount() {
    PlatformDescriptor hackerrank = registry.require("hackerrank");
    List<BrowserCookie> jar = List.of(BrowserCookie.of("_hrank_session", "", ".hackerrank.com"));

    assertThat(policy.evaluateNavigation(hackerrank, "https://www.hackerrank.com/onboarding", jar))
        .isEqualTo(DetectionOutcome.NOT_AUTHENTICATED);
  }

  @Test
  void cookiesOnly_authCookieWins() {
    PlatformDescriptor lark = registry.require("lark");

    assertThat(policy.evaluateCookies(lark, Map.of("biz_token", "t")))
        .isEqualTo(DetectionOutcome.AUTH_COOKIE_PRESENT);
    assertThat(policy.evaluateCookies(lark, Map.of("biz_token", "")))
        .isEqualTo(DetectionOutcome.NOT_AUTHENTICATED);
  }

  @Test
  void cookiesOnly_thresholdRequiresAnyCookieFlag() {
    Map<String, String> fiveCookies = cookieMap(5);

    assertThat(policy.evaluateCookies(registry.require("glider"), fiveCookies))
        .isEqualTo(DetectionOutcome.COOKIE_THRESHOLD);
    assertThat(policy.evaluateCookies(registry.require("lark"), fiveCookies))
        .isEqualTo(DetectionOutcome.NOT_AUTHENTICATED);
  }

  private static List<BrowserCookie> cookies(int count) {
    List<BrowserCookie> cookies = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      cookies.add(BrowserCookie.of("c" + i, "v" + i, ".example.com"));
    }
    return cookies;
  }

  private static Map<String, String> cookieMap(int count) {
    Map<String, String> cookies = new LinkedHashMap<>();
    for (int i = 0; i < count; i++) {
      cookies.put("c" + i, "v" + i);
    }
    return cookies;
  }
}
