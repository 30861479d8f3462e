package com.example.platformauth.exception;

/**
 * The everyday browser's cookie jar cannot be read, usually because the browser is not running
 * with remote debugging enabled.
 */
public class CookieJarUnavailableException extends RuntimeException {
  public CookieJarUnavailableException(String message) {
    super(message);
  }

  public CookieJarUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
