package com.example.platformauth.capture;

/**
 * Verdict of a login detection policy for one observation.
 */
public enum DetectionOutcome {
  DASHBOARD_MATCH(true),
  COOKIE_THRESHOLD(true),
  AUTH_COOKIE_PRESENT(true),
  NOT_AUTHENTICATED(false);

  private final boolean authenticated;

  DetectionOutcome(boolean authenticated) {
    this.authenticated = authenticated;
  }

  public boolean isAuthenticated() {
    return authenticated;
  }
}
