package com.example.platformauth.domain.entity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class SessionRecordTest {

  private static final Instant CAPTURED = Instant.parse("2026-03-01T00:00:00Z");
  private static final Duration WINDOW = Duration.ofHours(24);

  @Test
  void expiresOnlyOnceAgeExceedsWindow() {
    SessionRecord record = new SessionRecord("leetcode", "a=1", CAPTURED, CaptureChannel.INTERACTIVE);

    assertThat(record.isExpired(WINDOW, CAPTURED.plus(WINDOW))).isFalse();
    assertThat(record.isExpired(WINDOW, CAPTURED.plus(WINDOW).plusMillis(1))).isTrue();
  }

  @Test
  void emptyCookieHeader_isRejected() {
    assertThatThrownBy(() -> new SessionRecord("leetcode", " ", CAPTURED, CaptureChannel.EXTENSION_SYNC))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void channel_roundTripsThroughWireName() {
    assertThat(CaptureChannel.fromWireName("extension-sync")).isEqualTo(CaptureChannel.EXTENSION_SYNC);
    assertThat(CaptureChannel.INTERACTIVE.wireName()).isEqualTo("interactive");
    assertThatThrownBy(() -> CaptureChannel.fromWireName("carrier-pigeon"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
