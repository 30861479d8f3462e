package com.example.platformauth.adapter.browser;

import com.example.platformauth.domain.entity.BrowserCookie;
import com.example.platformauth.exception.CookieJarUnavailableException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory everyday-browser jar. Cookies added with {@link #putForUrl} are only visible to URL
 * queries, like partitioned cookies in a real browser.
 */
public class FakeCookieJarSource implements CookieJarSource {

  private final List<BrowserCookie> jar = new CopyOnWriteArrayList<>();
  private final Map<String, List<BrowserCookie>> urlOnly = new ConcurrentHashMap<>();
  private final List<CookieChangeListener> listeners = new CopyOnWriteArrayList<>();
  private volatile boolean connected = true;

  /**
   * Adds a cookie and notifies listeners.
   */
  public void put(BrowserCookie cookie) {
    jar.removeIf(existing -> existing.name().equals(cookie.name()) && existing.domain().equals(cookie.domain()));
    jar.add(cookie);
    listeners.forEach(listener -> listener.onCookieChanged(new CookieChangeEvent(cookie, false)));
  }

  public void putForUrl(String url, BrowserCookie cookie) {
    urlOnly.computeIfAbsent(url, key -> new CopyOnWriteArrayList<>()).add(cookie);
  }

  public void disconnect() {
    connected = false;
  }

  @Override
  public List<BrowserCookie> cookiesForUrl(String url) {
    requireConnected();
    String host = URI.create(url).getHost().toLowerCase(Locale.ROOT);
    List<BrowserCookie> matches = new ArrayList<>();
    for (BrowserCookie cookie : jar) {
      String domain = bare(cookie.domain());
      if (host.equals(domain) || host.endsWith("." + domain)) {
        matches.add(cookie);
      }
    }
    matches.addAll(urlOnly.getOrDefault(url, List.of()));
    return matches;
  }

  @Override
  public List<BrowserCookie> cookiesForDomain(String domain) {
    requireConnected();
    List<BrowserCookie> matches = new ArrayList<>();
    for (BrowserCookie cookie : jar) {
      String cookieDomain = bare(cookie.domain());
      if (cookieDomain.equals(domain) || cookieDomain.endsWith("." + domain)) {
        matches.add(cookie);
      }
    }
    return matches;
  }

  @Override
  public void addListener(CookieChangeListener listener) {
    listeners.add(listener);
  }

  @Override
  public boolean isConnected() {
    return connected;
  }

  private void requireConnected() {
    if (!connected) {
      throw new CookieJarUnavailableException("Browser not reachable");
    }
  }

  private static String bare(String domain) {
    return (domain.startsWith(".") ? domain.substring(1) : domain).toLowerCase(Locale.ROOT);
  }
}
