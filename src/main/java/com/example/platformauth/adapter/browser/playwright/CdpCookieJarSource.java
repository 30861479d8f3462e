package com.example.platformauth.adapter.browser.playwright;

import com.example.platformauth.adapter.browser.CookieChangeEvent;
import com.example.platformauth.adapter.browser.CookieChangeListener;
import com.example.platformauth.adapter.browser.CookieJarSource;
import com.example.platformauth.domain.entity.BrowserCookie;
import com.example.platformauth.exception.CookieJarUnavailableException;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.Cookie;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads the cookie jar of a running Chromium-family browser over the DevTools protocol.
 *
 * <p>The protocol has no cookie change stream, so the jar is polled and diffed. A single thread
 * owns the Playwright connection: queries from other threads are queued to it, and listeners are
 * notified on it.
 */
@Slf4j
public class CdpCookieJarSource implements CookieJarSource {

  private static final long QUERY_TIMEOUT_SECONDS = 30;

  private final String cdpEndpoint;
  private final Duration pollInterval;
  private final List<CookieChangeListener> listeners = new CopyOnWriteArrayList<>();
  private final BlockingQueue<FutureTask<?>> queries = new LinkedBlockingQueue<>();
  private final Thread worker;

  private volatile boolean running;
  private volatile boolean connected;
  private Map<String, BrowserCookie> snapshot = new HashMap<>();
  private Browser browser;

  public CdpCookieJarSource(String cdpEndpoint, Duration pollInterval) {
    this.cdpEndpoint = cdpEndpoint;
    this.pollInterval = pollInterval;
    this.worker = new Thread(this::run, "cdp-cookie-jar");
    this.worker.setDaemon(true);
  }

  public void start() {
    running = true;
    worker.start();
  }

  public void stop() {
    running = false;
    worker.interrupt();
  }

  @Override
  public List<BrowserCookie> cookiesForUrl(String url) {
    return query(context -> toBrowserCookies(context.cookies(url)));
  }

  @Override
  public List<BrowserCookie> cookiesForDomain(String domain) {
    String bare = domain.toLowerCase(Locale.ROOT);
    return query(context -> toBrowserCookies(context.cookies()).stream()
        .filter(cookie -> matchesDomain(cookie.domain(), bare))
        .toList());
  }

  @Override
  public void addListener(CookieChangeListener listener) {
    listeners.add(listener);
  }

  @Override
  public boolean isConnected() {
    return connected;
  }

  private <T> T query(Function<BrowserContext, T> action) {
    FutureTask<T> task = new FutureTask<>(() -> {
      BrowserContext context = defaultContext();
      if (context == null) {
        throw new CookieJarUnavailableException("Not connected to browser at " + cdpEndpoint);
      }
      return action.apply(context);
    });
    if (Thread.currentThread() == worker) {
      task.run();
    } else {
      queries.add(task);
    }
    try {
      return task.get(QUERY_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof CookieJarUnavailableException) {
        throw (CookieJarUnavailableException) e.getCause();
      }
      throw new CookieJarUnavailableException("Cookie query failed: " + e.getCause().getMessage(), e.getCause());
    } catch (CancellationException | TimeoutException e) {
      task.cancel(false);
      throw new CookieJarUnavailableException("Cookie query did not complete", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CookieJarUnavailableException("Interrupted while querying cookies", e);
    }
  }

  private void run() {
    try (Playwright playwright = Playwright.create()) {
      long nextPoll = 0;
      while (running) {
        if (browser == null || !browser.isConnected()) {
          connect(playwright);
        }
        long wait = Math.max(0, nextPoll - System.currentTimeMillis());
        FutureTask<?> task = queries.poll(wait, TimeUnit.MILLISECONDS);
        if (task != null) {
          task.run();
          continue;
        }
        if (connected) {
          pollChanges();
        }
        nextPoll = System.currentTimeMillis() + pollInterval.toMillis();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (RuntimeException e) {
      log.error("Cookie jar reader stopped", e);
    } finally {
      connected = false;
      FutureTask<?> pending;
      while ((pending = queries.poll()) != null) {
        pending.cancel(false);
      }
    }
  }

  private void connect(Playwright playwright) {
    boolean wasConnected = connected;
    try {
      browser = playwright.chromium().connectOverCDP(cdpEndpoint);
      connected = true;
      snapshot = new HashMap<>();
      log.info("Connected to browser at {}", cdpEndpoint);
    } catch (PlaywrightException e) {
      browser = null;
      connected = false;
      if (wasConnected) {
        log.warn("Lost connection to browser at {}: {}", cdpEndpoint, e.getMessage());
      } else {
        log.debug("Browser at {} not reachable: {}", cdpEndpoint, e.getMessage());
      }
    }
  }

  private BrowserContext defaultContext() {
    if (browser == null || !browser.isConnected() || browser.contexts().isEmpty()) {
      return null;
    }
    return browser.contexts().get(0);
  }

  private void pollChanges() {
    BrowserContext context = defaultContext();
    if (context == null) {
      return;
    }
    Map<String, BrowserCookie> current = new HashMap<>();
    try {
      for (BrowserCookie cookie : toBrowserCookies(context.cookies())) {
        current.put(key(cookie), cookie);
      }
    } catch (PlaywrightException e) {
      log.warn("Failed to read browser cookies: {}", e.getMessage());
      return;
    }

    Map<String, BrowserCookie> previous = snapshot;
    snapshot = current;
    current.forEach((key, cookie) -> {
      BrowserCookie before = previous.get(key);
      if (before == null || !before.value().equals(cookie.value())) {
        notifyListeners(new CookieChangeEvent(cookie, false));
      }
    });
    previous.forEach((key, cookie) -> {
      if (!current.containsKey(key)) {
        notifyListeners(new CookieChangeEvent(cookie, true));
      }
    });
  }

  private void notifyListeners(CookieChangeEvent event) {
    for (CookieChangeListener listener : listeners) {
      try {
        listener.onCookieChanged(event);
      } catch (RuntimeException e) {
        log.error("Cookie change listener failed", e);
      }
    }
  }

  private static String key(BrowserCookie cookie) {
    return cookie.domain() + '|' + cookie.path() + '|' + cookie.name();
  }

  private static boolean matchesDomain(String cookieDomain, String domain) {
    if (cookieDomain == null) {
      return false;
    }
    String host = cookieDomain.startsWith(".") ? cookieDomain.substring(1) : cookieDomain;
    host = host.toLowerCase(Locale.ROOT);
    return host.equals(domain) || host.endsWith("." + domain);
  }

  private static List<BrowserCookie> toBrowserCookies(List<Cookie> cookies) {
    return cookies.stream()
        .map(cookie -> new BrowserCookie(cookie.name, cookie.value, cookie.domain, cookie.path))
        .toList();
  }
}
