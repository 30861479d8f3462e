package com.example.platformauth.domain.entity;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Authentication status of one platform. The timestamp is the capture time in epoch millis and is
 * only present for authenticated platforms.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlatformStatus(boolean authenticated, Long timestamp) {

  private static final PlatformStatus NOT_AUTHENTICATED = new PlatformStatus(false, null);

  public static PlatformStatus notAuthenticated() {
    return NOT_AUTHENTICATED;
  }

  public static PlatformStatus authenticated(SessionRecord record) {
    return new PlatformStatus(true, record.capturedAt().toEpochMilli());
  }
}
