package com.example.platformauth.exception;

/**
 * Raised when a browsing context cannot be started
 */
public class BrowserLaunchException extends RuntimeException {
  public BrowserLaunchException(String message) {
    super(message);
  }

  public BrowserLaunchException(String message, Throwable cause) {
    super(message, cause);
  }
}
