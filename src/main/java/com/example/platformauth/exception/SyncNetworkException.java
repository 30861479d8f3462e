package com.example.platformauth.exception;

/**
 * Delivery of a cookie bundle to the session store failed, either at the transport level or with
 * a non-success status.
 */
public class SyncNetworkException extends RuntimeException {

  private final int statusCode;

  public SyncNetworkException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = -1;
  }

  public SyncNetworkException(String message, int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  /**
   * HTTP status returned by the store, or -1 when no response was received.
   */
  public int getStatusCode() {
    return statusCode;
  }

  /**
   * True when the store answered with a client error about the bundle itself. Sending the same
   * bundle again cannot succeed, unlike transport failures, server errors, auth failures and
   * throttling.
   */
  public boolean isRejected() {
    return statusCode >= 400 && statusCode < 500
        && statusCode != 401 && statusCode != 403 && statusCode != 408 && statusCode != 429;
  }
}
