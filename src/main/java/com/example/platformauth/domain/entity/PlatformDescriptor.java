package com.example.platformauth.domain.entity;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Static description of a third-party platform the engine can authenticate against.
 *
 * <p>Dashboard patterns are matched case-sensitively as substrings of the full URL, login page
 * patterns case-insensitively. Domains are bare registrable domains without a leading dot.
 */
public record PlatformDescriptor(
    String id,
    String name,
    String loginUrl,
    List<String> domains,
    List<String> dashboardPatterns,
    List<String> loginPagePatterns,
    Set<String> cookieAuthNames,
    boolean anyCookieAuthenticates,
    String detection
) {

  public static final String PARTITION_PREFIX = "auth-";

  public PlatformDescriptor {
    domains = domains == null ? List.of() : List.copyOf(domains);
    dashboardPatterns = dashboardPatterns == null ? List.of() : List.copyOf(dashboardPatterns);
    loginPagePatterns = loginPagePatterns == null ? List.of() : loginPagePatterns.stream()
        .map(pattern -> pattern.toLowerCase(Locale.ROOT))
        .toList();
    cookieAuthNames = cookieAuthNames == null ? Set.of() : Set.copyOf(cookieAuthNames);
    name = name == null || name.isBlank() ? id : name;
  }

  /**
   * Name of the isolated browser storage area used for interactive logins.
   */
  public String partition() {
    return PARTITION_PREFIX + id;
  }

  public boolean isDashboardUrl(String url) {
    if (url == null) {
      return false;
    }
    return dashboardPatterns.stream().anyMatch(url::contains);
  }

  public boolean isLoginPage(String url) {
    if (url == null) {
      return false;
    }
    String lower = url.toLowerCase(Locale.ROOT);
    return loginPagePatterns.stream().anyMatch(lower::contains);
  }

  public boolean isAuthCookieName(String cookieName) {
    return cookieAuthNames.contains(cookieName);
  }

  /**
   * True when a cookie scoped to {@code cookieDomain} belongs to this platform. Leading dots are
   * ignored and subdomains match their parent.
   */
  public boolean ownsCookieDomain(String cookieDomain) {
    if (cookieDomain == null || cookieDomain.isEmpty()) {
      return false;
    }
    String host = cookieDomain.startsWith(".") ? cookieDomain.substring(1) : cookieDomain;
    host = host.toLowerCase(Locale.ROOT);
    for (String domain : domains) {
      if (host.equals(domain) || host.endsWith("." + domain)) {
        return true;
      }
    }
    return false;
  }
}
