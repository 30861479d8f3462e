package com.example.platformauth.adapter.browser.playwright;

import com.example.platformauth.adapter.browser.BrowsingContext;
import com.example.platformauth.adapter.browser.BrowsingContextListener;
import com.example.platformauth.domain.entity.BrowserCookie;
import com.example.platformauth.exception.BrowserLaunchException;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.Cookie;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;

/**
 * A headed Chromium window on a persistent profile directory.
 *
 * <p>Playwright objects are not thread safe and only deliver events while a call into them is in
 * progress, so every context owns a pump thread that launches the browser, waits in short slices
 * and runs all listener callbacks. {@link #close()} only raises a flag the pump acts on.
 */
@Slf4j
class PlaywrightBrowsingContext implements BrowsingContext {

  private static final String CLOSE_BINDING = "__platformAuthCloseWindow";
  private static final String ESCAPE_TO_CLOSE_SCRIPT =
      "document.addEventListener('keydown', e => {"
          + " if (e.key === 'Escape' && window." + CLOSE_BINDING + ") { window." + CLOSE_BINDING + "(); }"
          + " });";

  private final String partition;
  private final Path profileDir;
  private final String startUrl;
  private final BrowsingContextListener listener;
  private final PlaywrightLaunchOptions options;
  private final CompletableFuture<Void> launched = new CompletableFuture<>();
  private final Thread pump;

  private volatile boolean closeRequested;
  private volatile boolean closed;
  private BrowserContext browserContext;

  PlaywrightBrowsingContext(String partition, Path profileDir, String startUrl,
                            PlaywrightLaunchOptions options, BrowsingContextListener listener) {
    this.partition = partition;
    this.profileDir = profileDir;
    this.startUrl = startUrl;
    this.options = options;
    this.listener = listener;
    this.pump = new Thread(this::pumpEvents, "login-" + partition);
    this.pump.setDaemon(true);
  }

  /**
   * Starts the pump and blocks until the window exists.
   */
  void start() {
    pump.start();
    try {
      launched.get(options.launchTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (ExecutionException e) {
      throw new BrowserLaunchException(e.getCause().getMessage(), e.getCause());
    } catch (TimeoutException e) {
      closeRequested = true;
      throw new BrowserLaunchException("Browser did not start within " + options.launchTimeout(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      closeRequested = true;
      throw new BrowserLaunchException("Interrupted while starting browser", e);
    }
  }

  @Override
  public String partition() {
    return partition;
  }

  @Override
  public List<BrowserCookie> cookies() {
    if (Thread.currentThread() != pump) {
      throw new IllegalStateException("Cookies of " + partition + " can only be read from its event thread");
    }
    if (browserContext == null || closed) {
      return List.of();
    }
    return browserContext.cookies().stream()
        .map(PlaywrightBrowsingContext::toBrowserCookie)
        .toList();
  }

  @Override
  public void close() {
    closeRequested = true;
  }

  @Override
  public boolean isClosed() {
    return closed;
  }

  private void pumpEvents() {
    try (Playwright playwright = Playwright.create()) {
      browserContext = playwright.chromium().launchPersistentContext(profileDir,
          new BrowserType.LaunchPersistentContextOptions()
              .setHeadless(options.headless())
              .setViewportSize(options.windowWidth(), options.windowHeight()));
      browserContext.exposeBinding(CLOSE_BINDING, (source, args) -> {
        log.debug("Escape pressed in login window {}", partition);
        closeRequested = true;
        return null;
      });
      browserContext.addInitScript(ESCAPE_TO_CLOSE_SCRIPT);

      Page page = browserContext.pages().isEmpty() ? browserContext.newPage() : browserContext.pages().get(0);
      page.onFrameNavigated(frame -> {
        if (frame.parentFrame() == null) {
          try {
            listener.onNavigated(this, frame.url());
          } catch (RuntimeException e) {
            log.error("Navigation handling failed for {}", partition, e);
          }
        }
      });
      page.onClose(p -> closeRequested = true);
      launched.complete(null);
      log.info("Login window opened for {}", partition);

      try {
        page.navigate(startUrl);
      } catch (PlaywrightException e) {
        log.warn("Initial navigation of {} failed: {}", partition, e.getMessage());
      }

      double slice = options.pumpInterval().toMillis();
      while (!closeRequested && !page.isClosed()) {
        page.waitForTimeout(slice);
      }
      browserContext.close();

    } catch (RuntimeException e) {
      if (!launched.isDone()) {
        launched.completeExceptionally(e);
      } else if (!closeRequested) {
        log.warn("Login window {} terminated unexpectedly: {}", partition, e.getMessage());
      }
    } finally {
      closed = true;
      if (launched.isDone() && !launched.isCompletedExceptionally()) {
        listener.onClosed(this);
      }
      log.info("Login window closed for {}", partition);
    }
  }

  private static BrowserCookie toBrowserCookie(Cookie cookie) {
    return new BrowserCookie(cookie.name, cookie.value, cookie.domain, cookie.path);
  }

  /**
   * Launch settings shared by all login windows.
   */
  record PlaywrightLaunchOptions(
      boolean headless,
      int windowWidth,
      int windowHeight,
      Duration pumpInterval,
      Duration launchTimeout
  ) {}
}
