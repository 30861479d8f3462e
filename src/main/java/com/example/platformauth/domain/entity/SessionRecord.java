package com.example.platformauth.domain.entity;

import java.time.Duration;
import java.time.Instant;

/**
 * The most recent captured session for one platform, in plaintext.
 */
public record SessionRecord(
    String platformId,
    String cookieHeader,
    Instant capturedAt,
    CaptureChannel channel
) {

  public SessionRecord {
    if (platformId == null || platformId.isBlank()) {
      throw new IllegalArgumentException("Platform id must not be blank");
    }
    if (cookieHeader == null || cookieHeader.isBlank()) {
      throw new IllegalArgumentException("Cookie header must not be empty");
    }
    if (capturedAt == null || channel == null) {
      throw new IllegalArgumentException("Capture time and channel are required");
    }
  }

  public Duration age(Instant now) {
    return Duration.between(capturedAt, now);
  }

  /**
   * A record is expired once its age strictly exceeds the freshness window.
   */
  public boolean isExpired(Duration freshnessWindow, Instant now) {
    return age(now).compareTo(freshnessWindow) > 0;
  }
}
