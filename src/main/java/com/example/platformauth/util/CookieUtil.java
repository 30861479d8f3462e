package com.example.platformauth.util;

import com.example.platformauth.domain.entity.BrowserCookie;
import java.util.Collection;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Cookie header helpers shared by both capture channels.
 * Headers use the request form {@code name=value; name=value}.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class CookieUtil {

  private static final String PAIR_SEPARATOR = "; ";
  private static final char NAME_VALUE_SEPARATOR = '=';

  /**
   * Serialize browser cookies in jar order. Later cookies with a repeated name are kept, as a
   * browser would send both.
   */
  public static String toCookieHeader(Collection<BrowserCookie> cookies) {
    if (cookies == null || cookies.isEmpty()) {
      return "";
    }
    return cookies.stream()
        .map(cookie -> cookie.name() + NAME_VALUE_SEPARATOR + cookie.value())
        .collect(Collectors.joining(PAIR_SEPARATOR));
  }

  public static String toCookieHeader(Map<String, String> cookies) {
    if (cookies == null || cookies.isEmpty()) {
      return "";
    }
    return cookies.entrySet().stream()
        .map(entry -> entry.getKey() + NAME_VALUE_SEPARATOR + entry.getValue())
        .collect(Collectors.joining(PAIR_SEPARATOR));
  }

  public static int countCookies(String header) {
    if (header == null || header.isBlank()) {
      return 0;
    }
    int count = 0;
    for (String segment : header.split(";")) {
      if (!segment.isBlank()) {
        count++;
      }
    }
    return count;
  }
}
