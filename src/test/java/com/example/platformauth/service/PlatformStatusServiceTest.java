package com.example.platformauth.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.platformauth.TestFixtures;
import com.example.platformauth.TestFixtures.MutableClock;
import com.example.platformauth.adapter.keystore.KeyStoreSessionKeyProvider;
import com.example.platformauth.adapter.memory.InMemorySessionRecordRepository;
import com.example.platformauth.domain.entity.CaptureChannel;
import com.example.platformauth.domain.entity.PlatformStatus;
import com.example.platformauth.exception.UnknownPlatformException;
import com.example.platformauth.properties.ApplicationProperties;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PlatformStatusServiceTest {

  @TempDir
  Path tempDir;

  private InMemorySessionRecordRepository repository;
  private MutableClock clock;
  private SessionStore sessionStore;
  private PlatformStatusService statusService;

  @BeforeEach
  void setUp() {
    ApplicationProperties properties = TestFixtures.properties(tempDir).build();
    repository = new InMemorySessionRecordRepository();
    clock = new MutableClock(TestFixtures.NOW);
    EncryptionService encryptionService = new EncryptionService(
        new KeyStoreSessionKeyProvider(tempDir.resolve("keys.p12"), TestFixtures.KEYSTORE_PASSWORD, "session"));
    sessionStore = new SessionStore(repository, encryptionService, new PlatformLockService(), clock, properties);
    statusService = new PlatformStatusService(sessionStore, new PlatformRegistry(properties), clock, properties);
  }

  @Test
  void getStatus_listsEveryPlatformInCatalogueOrder() {
    sessionStore.save("coderpad", "pad=1", CaptureChannel.INTERACTIVE);

    Map<String, PlatformStatus> statuses = statusService.getStatus();

    assertThat(statuses).containsOnlyKeys("leetcode", "coderpad", "glider", "hackerrank", "lark");
    assertThat(statuses.keySet()).first().isEqualTo("leetcode");
    assertThat(statuses.get("coderpad").authenticated()).isTrue();
    assertThat(statuses.get("coderpad").timestamp()).isEqualTo(TestFixtures.NOW.toEpochMilli());
    assertThat(statuses.get("leetcode")).isEqualTo(PlatformStatus.notAuthenticated());
    assertThat(statuses.get("leetcode").timestamp()).isNull();
  }

  @Test
  void sessionAtExactlyWindowAge_isStillFresh() {
    sessionStore.save("leetcode", "a=1", CaptureChannel.INTERACTIVE);
    clock.advance(Duration.ofHours(24));

    assertThat(statusService.status("leetcode").authenticated()).isTrue();
    assertThat(statusService.getSessionCookies("leetcode")).contains("a=1");
  }

  @Test
  void sessionOlderThanWindow_isEvictedOnRead() {
    sessionStore.save("leetcode", "a=1", CaptureChannel.INTERACTIVE);
    clock.advance(Duration.ofHours(24).plusMillis(1));

    assertThat(statusService.getSessionCookies("leetcode")).isEmpty();
    assertThat(statusService.status("leetcode").authenticated()).isFalse();
    assertThat(repository.find("leetcode")).isEmpty();
  }

  @Test
  void unknownPlatform_isRejected() {
    assertThatThrownBy(() -> statusService.status("nope"))
        .isInstanceOf(UnknownPlatformException.class)
        .hasMessage("Unknown platform: nope");
    assertThatThrownBy(() -> statusService.getSessionCookies("nope"))
        .isInstanceOf(UnknownPlatformException.class);
  }
}
