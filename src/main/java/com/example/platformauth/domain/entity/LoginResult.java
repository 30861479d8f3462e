package com.example.platformauth.domain.entity;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LoginResult(boolean success, String platformId, String reason) {

  public static final String REASON_WINDOW_CLOSED = "Window closed before login";
  public static final String REASON_SUPERSEDED = "Superseded by a new login attempt";
  public static final String REASON_LOGGED_OUT = "Logged out";
  public static final String REASON_PERSIST_FAILED = "Failed to persist session";
  public static final String REASON_BROWSER_UNAVAILABLE = "Browser unavailable: ";

  public static LoginResult succeeded(String platformId) {
    return new LoginResult(true, platformId, null);
  }

  public static LoginResult failed(String platformId, String reason) {
    return new LoginResult(false, platformId, reason);
  }

  public static LoginResult windowClosed(String platformId) {
    return failed(platformId, REASON_WINDOW_CLOSED);
  }
}
