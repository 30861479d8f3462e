package com.example.platformauth.domain.entity;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a session record was obtained.
 */
public enum CaptureChannel {
  INTERACTIVE("interactive"),
  EXTENSION_SYNC("extension-sync");

  private final String wireName;

  CaptureChannel(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  public static CaptureChannel fromWireName(String value) {
    for (CaptureChannel channel : values()) {
      if (channel.wireName.equals(value)) {
        return channel;
      }
    }
    throw new IllegalArgumentException("Unknown capture channel: " + value);
  }
}
