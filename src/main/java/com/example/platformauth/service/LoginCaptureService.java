package com.example.platformauth.service;

import com.example.platformauth.adapter.browser.BrowsingContext;
import com.example.platformauth.adapter.browser.BrowsingContextFactory;
import com.example.platformauth.capture.LoginDetectionPolicyRegistry;
import com.example.platformauth.domain.entity.CaptureState;
import com.example.platformauth.domain.entity.LoginResult;
import com.example.platformauth.domain.entity.PlatformDescriptor;
import com.example.platformauth.exception.BrowserLaunchException;
import com.example.platformauth.properties.ApplicationProperties;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Drives interactive logins: at most one attempt per platform, each in its own browser partition.
 * A new attempt for a platform supersedes the one in flight.
 */
@Slf4j
@Service
public class LoginCaptureService {

  private static final long PREVIOUS_WINDOW_CLOSE_WAIT_SECONDS = 10;

  private final PlatformRegistry platformRegistry;
  private final LoginDetectionPolicyRegistry policyRegistry;
  private final SessionStore sessionStore;
  private final BrowsingContextFactory browsingContextFactory;
  private final TaskScheduler taskScheduler;
  private final Executor captureExecutor;
  private final Clock clock;
  private final Duration closeGraceDelay;
  private final ConcurrentMap<String, LoginAttempt> activeAttempts = new ConcurrentHashMap<>();

  public LoginCaptureService(
      PlatformRegistry platformRegistry,
      LoginDetectionPolicyRegistry policyRegistry,
      SessionStore sessionStore,
      BrowsingContextFactory browsingContextFactory,
      TaskScheduler taskScheduler,
      @Qualifier("captureExecutor") Executor captureExecutor,
      Clock clock,
      ApplicationProperties properties) {
    this.platformRegistry = platformRegistry;
    this.policyRegistry = policyRegistry;
    this.sessionStore = sessionStore;
    this.browsingContextFactory = browsingContextFactory;
    this.taskScheduler = taskScheduler;
    this.captureExecutor = captureExecutor;
    this.clock = clock;
    this.closeGraceDelay = properties.capture().closeGraceDelay();
  }

  /**
   * Opens a login window for the platform. The future completes when the window closes, with
   * success if a login was detected and stored before that.
   *
   * @throws com.example.platformauth.exception.UnknownPlatformException for unconfigured ids
   */
  public CompletableFuture<LoginResult> startLogin(String platformId) {
    PlatformDescriptor platform = platformRegistry.require(platformId);
    LoginAttempt attempt = new LoginAttempt(
        platform, policyRegistry.forPlatform(platform), sessionStore, taskScheduler, clock,
        closeGraceDelay);

    LoginAttempt previous = activeAttempts.put(platformId, attempt);
    CompletableFuture<Void> previousClosed = CompletableFuture.completedFuture(null);
    if (previous != null) {
      previous.abort(LoginResult.REASON_SUPERSEDED);
      // The partition profile can only be opened once; wait for the old window to let go.
      previousClosed = previous.closed().copy()
          .completeOnTimeout(null, PREVIOUS_WINDOW_CLOSE_WAIT_SECONDS, TimeUnit.SECONDS);
    }

    attempt.result().whenComplete((result, error) -> activeAttempts.remove(platformId, attempt));
    previousClosed.thenRunAsync(() -> open(platform, attempt), captureExecutor);
    log.info("Login started for {}", platformId);
    return attempt.result();
  }

  /**
   * Removes the stored session and the partition's browser data.
   */
  public boolean logout(String platformId) {
    PlatformDescriptor platform = platformRegistry.require(platformId);
    LoginAttempt inFlight = activeAttempts.get(platformId);
    if (inFlight != null && inFlight.state() != CaptureState.SUCCEEDED) {
      inFlight.abort(LoginResult.REASON_LOGGED_OUT);
    }
    sessionStore.delete(platformId);
    if (inFlight == null) {
      browsingContextFactory.clearPartition(platform.partition());
    } else {
      inFlight.closed().thenRun(() -> browsingContextFactory.clearPartition(platform.partition()));
    }
    log.info("Logged out of {}", platformId);
    return true;
  }

  /**
   * Platforms with a login in flight and the state each attempt is in.
   */
  public Map<String, CaptureState> activeAttempts() {
    Map<String, CaptureState> states = new LinkedHashMap<>();
    activeAttempts.forEach((platformId, attempt) -> states.put(platformId, attempt.state()));
    return states;
  }

  private void open(PlatformDescriptor platform, LoginAttempt attempt) {
    if (!attempt.beginOpening()) {
      return;
    }
    try {
      BrowsingContext context = browsingContextFactory.open(platform.partition(), platform.loginUrl(), attempt);
      attempt.attach(context);
    } catch (BrowserLaunchException e) {
      log.error("Could not open login window for {}", platform.id(), e);
      attempt.fail(LoginResult.REASON_BROWSER_UNAVAILABLE + e.getMessage());
    } catch (RuntimeException e) {
      log.error("Unexpected failure opening login window for {}", platform.id(), e);
      attempt.fail(LoginResult.REASON_BROWSER_UNAVAILABLE + e.getMessage());
    }
  }
}
