package com.example.platformauth.domain.entity;

/**
 * A cookie as read from a browser cookie jar. Only the name and value travel further than the
 * browser adapters.
 */
public record BrowserCookie(String name, String value, String domain, String path) {

  public BrowserCookie {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("Cookie name must not be empty");
    }
    value = value == null ? "" : value;
    path = path == null || path.isEmpty() ? "/" : path;
  }

  public static BrowserCookie of(String name, String value, String domain) {
    return new BrowserCookie(name, value, domain, "/");
  }

  public boolean hasValue() {
    return !value.isEmpty();
  }
}
