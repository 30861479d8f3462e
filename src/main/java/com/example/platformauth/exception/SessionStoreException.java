package com.example.platformauth.exception;

/**
 * Session store could not be read or written
 */
public class SessionStoreException extends RuntimeException {
  public SessionStoreException(String message) {
    super(message);
  }

  public SessionStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
