package com.example.platformauth.service;

import com.example.platformauth.adapter.browser.BrowsingContext;
import com.example.platformauth.adapter.browser.BrowsingContextListener;
import com.example.platformauth.capture.DetectionOutcome;
import com.example.platformauth.capture.LoginDetectionPolicy;
import com.example.platformauth.domain.entity.BrowserCookie;
import com.example.platformauth.domain.entity.CaptureChannel;
import com.example.platformauth.domain.entity.CaptureState;
import com.example.platformauth.domain.entity.LoginResult;
import com.example.platformauth.domain.entity.PlatformDescriptor;
import com.example.platformauth.exception.SessionStoreException;
import com.example.platformauth.util.CookieUtil;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

/**
 * State machine of one interactive login for one platform.
 *
 * <p>Navigation and close callbacks arrive on the browsing context's event thread, abort on the
 * caller's thread. State changes and the store write happen while holding this object's monitor,
 * so once {@link #abort(String)} returns the attempt can no longer write.
 */
@Slf4j
class LoginAttempt implements BrowsingContextListener {

  private final PlatformDescriptor platform;
  private final LoginDetectionPolicy policy;
  private final SessionStore sessionStore;
  private final TaskScheduler scheduler;
  private final Clock clock;
  private final Duration closeGraceDelay;
  private final CompletableFuture<LoginResult> result = new CompletableFuture<>();
  private final CompletableFuture<Void> closed = new CompletableFuture<>();

  private CaptureState state = CaptureState.IDLE;
  private BrowsingContext context;
  private boolean opening;
  private LoginResult outcome;

  LoginAttempt(PlatformDescriptor platform, LoginDetectionPolicy policy, SessionStore sessionStore,
               TaskScheduler scheduler, Clock clock, Duration closeGraceDelay) {
    this.platform = platform;
    this.policy = policy;
    this.sessionStore = sessionStore;
    this.scheduler = scheduler;
    this.clock = clock;
    this.closeGraceDelay = closeGraceDelay;
  }

  CompletableFuture<LoginResult> result() {
    return result;
  }

  /**
   * Completes once the attempt holds no browser window any more.
   */
  CompletableFuture<Void> closed() {
    return closed;
  }

  synchronized CaptureState state() {
    return state;
  }

  /**
   * Marks that a window is being opened for this attempt. Returns false when the attempt has
   * already ended and no window should be opened.
   */
  synchronized boolean beginOpening() {
    if (state.isTerminal()) {
      return false;
    }
    opening = true;
    return true;
  }

  /**
   * Binds the opened window. A window opened for an attempt aborted in the meantime is closed
   * straight away.
   */
  void attach(BrowsingContext browsingContext) {
    boolean closeNow;
    synchronized (this) {
      context = browsingContext;
      opening = false;
      closeNow = state == CaptureState.ABORTED;
      if (state == CaptureState.IDLE) {
        state = CaptureState.AWAITING_NAVIGATION;
      }
    }
    if (closeNow) {
      browsingContext.close();
    }
  }

  /**
   * Ends the attempt without a window, e.g. when the browser could not be started.
   */
  void fail(String reason) {
    synchronized (this) {
      opening = false;
      if (!state.isTerminal()) {
        state = CaptureState.ABORTED;
      }
    }
    result.complete(LoginResult.failed(platform.id(), reason));
    closed.complete(null);
  }

  /**
   * Aborts an attempt still waiting for login and closes its window. Returns false when the
   * attempt had already finished.
   */
  boolean abort(String reason) {
    BrowsingContext toClose;
    boolean windowPending;
    synchronized (this) {
      if (state.isTerminal()) {
        return false;
      }
      state = CaptureState.ABORTED;
      toClose = context;
      windowPending = opening;
    }
    log.info("Login attempt for {} aborted: {}", platform.id(), reason);
    result.complete(LoginResult.failed(platform.id(), reason));
    if (toClose != null) {
      toClose.close();
    } else if (!windowPending) {
      closed.complete(null);
    }
    return true;
  }

  @Override
  public void onNavigated(BrowsingContext source, String url) {
    synchronized (this) {
      if (state != CaptureState.AWAITING_NAVIGATION && state != CaptureState.IDLE) {
        return;
      }
      state = CaptureState.EVALUATING;
    }

    List<BrowserCookie> cookies = source.cookies();
    DetectionOutcome detection = policy.evaluateNavigation(platform, url, cookies);
    log.debug("Navigation for {} evaluated as {} with {} cookies", platform.id(), detection, cookies.size());

    String cookieHeader = CookieUtil.toCookieHeader(cookies);
    boolean authenticated = detection.isAuthenticated() && !cookieHeader.isBlank();
    if (detection.isAuthenticated() && !authenticated) {
      log.debug("Login for {} looks complete but the jar is empty, waiting", platform.id());
    }

    synchronized (this) {
      if (state != CaptureState.EVALUATING) {
        return;
      }
      if (!authenticated) {
        state = CaptureState.AWAITING_NAVIGATION;
        return;
      }
      try {
        sessionStore.save(platform.id(), cookieHeader, CaptureChannel.INTERACTIVE);
        outcome = LoginResult.succeeded(platform.id());
        log.info("Login detected for {} ({}), {} cookies captured", platform.id(), detection, cookies.size());
      } catch (SessionStoreException e) {
        log.error("Login detected for {} but the session could not be stored", platform.id(), e);
        outcome = LoginResult.failed(platform.id(), LoginResult.REASON_PERSIST_FAILED);
      }
      state = CaptureState.SUCCEEDED;
    }
    scheduler.schedule(source::close, clock.instant().plus(closeGraceDelay));
  }

  @Override
  public void onClosed(BrowsingContext source) {
    LoginResult completion;
    synchronized (this) {
      if (state == CaptureState.SUCCEEDED) {
        completion = outcome;
      } else if (state == CaptureState.ABORTED) {
        completion = null;
      } else {
        state = CaptureState.ABORTED;
        completion = LoginResult.windowClosed(platform.id());
        log.info("Login window for {} closed before login", platform.id());
      }
    }
    if (completion != null) {
      result.complete(completion);
    }
    closed.complete(null);
  }
}
