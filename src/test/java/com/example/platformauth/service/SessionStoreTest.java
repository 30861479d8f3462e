package com.example.platformauth.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

import com.example.platformauth.TestFixtures;
import com.example.platformauth.TestFixtures.MutableClock;
import com.example.platformauth.adapter.keystore.KeyStoreSessionKeyProvider;
import com.example.platformauth.adapter.memory.InMemorySessionRecordRepository;
import com.example.platformauth.adapter.store.SessionRecordRepository;
import com.example.platformauth.domain.entity.CaptureChannel;
import com.example.platformauth.domain.entity.SaveResult;
import com.example.platformauth.domain.entity.SessionRecord;
import com.example.platformauth.domain.entity.StoredSession;
import com.example.platformauth.exception.SessionStoreException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SessionStoreTest {

  @TempDir
  Path tempDir;

  private InMemorySessionRecordRepository repository;
  private EncryptionService encryptionService;
  private MutableClock clock;
  private SessionStore sessionStore;

  @BeforeEach
  void setUp() {
    repository = new InMemorySessionRecordRepository();
    encryptionService = new EncryptionService(
        new KeyStoreSessionKeyProvider(tempDir.resolve("keys.p12"), TestFixtures.KEYSTORE_PASSWORD, "session"));
    clock = new MutableClock(TestFixtures.NOW);
    sessionStore = newStore(repository);
  }

  @Test
  void save_storesEncryptedPayload() {
    SaveResult result = sessionStore.save("leetcode", "LEETCODE_SESSION=abc", CaptureChannel.INTERACTIVE);

    assertThat(result.applied()).isTrue();
    assertThat(result.record().capturedAt()).isEqualTo(TestFixtures.NOW);
    StoredSession stored = repository.find("leetcode").orElseThrow();
    assertThat(stored.encrypted()).isTrue();
    assertThat(stored.payload()).doesNotContain("LEETCODE_SESSION");
    assertThat(stored.channel()).isEqualTo("interactive");
  }

  @Test
  void save_olderCaptureIsDiscarded() {
    sessionStore.save("leetcode", "new=1", CaptureChannel.INTERACTIVE);

    SaveResult result = sessionStore.save(
        "leetcode", "old=1", CaptureChannel.EXTENSION_SYNC, TestFixtures.NOW.minusSeconds(60));

    assertThat(result.applied()).isFalse();
    assertThat(result.record().cookieHeader()).isEqualTo("new=1");
    assertThat(sessionStore.load("leetcode")).get().extracting(SessionRecord::cookieHeader).isEqualTo("new=1");
  }

  @Test
  void save_equalCaptureTimeReplaces() {
    sessionStore.save("leetcode", "first=1", CaptureChannel.INTERACTIVE);

    SaveResult result = sessionStore.save("leetcode", "second=1", CaptureChannel.EXTENSION_SYNC, TestFixtures.NOW);

    assertThat(result.applied()).isTrue();
    assertThat(sessionStore.load("leetcode").orElseThrow().channel()).isEqualTo(CaptureChannel.EXTENSION_SYNC);
  }

  @Test
  void save_futureCaptureTimeIsClampedToNow() {
    SaveResult result = sessionStore.save(
        "leetcode", "a=1", CaptureChannel.EXTENSION_SYNC, TestFixtures.NOW.plus(Duration.ofDays(365)));

    assertThat(result.record().capturedAt()).isEqualTo(TestFixtures.NOW);

    clock.advance(Duration.ofMinutes(1));
    assertThat(sessionStore.save("leetcode", "b=1", CaptureChannel.INTERACTIVE).applied()).isTrue();
  }

  @Test
  void save_blankHeaderIsRejected() {
    assertThatThrownBy(() -> sessionStore.save("leetcode", "  ", CaptureChannel.INTERACTIVE))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(repository.find("leetcode")).isEmpty();
  }

  @Test
  void save_durableFailureLeavesCacheUntouched() {
    SessionRecordRepository failing = mock(SessionRecordRepository.class);
    doThrow(new SessionStoreException("connection refused")).when(failing).save(any());
    SessionStore store = newStore(failing);

    assertThatThrownBy(() -> store.save("leetcode", "a=1", CaptureChannel.INTERACTIVE))
        .isInstanceOf(SessionStoreException.class);
    assertThat(store.load("leetcode")).isEmpty();
  }

  @Test
  void load_recordsSurviveRestart() {
    sessionStore.save("coderpad", "pad=1", CaptureChannel.INTERACTIVE);

    SessionStore restarted = newStore(repository);
    restarted.warmCache();

    assertThat(restarted.load("coderpad")).get().extracting(SessionRecord::cookieHeader).isEqualTo("pad=1");
    assertThat(restarted.loadAll()).containsOnlyKeys("coderpad");
  }

  @Test
  void load_undecryptableRecordIsEvicted() {
    repository.save(new StoredSession("leetcode", "garbage", TestFixtures.NOW.toEpochMilli(), "interactive", true));

    assertThat(sessionStore.load("leetcode")).isEmpty();
    assertThat(repository.find("leetcode")).isEmpty();
  }

  @Test
  void load_plaintextRecordIsAccepted() {
    repository.save(new StoredSession("leetcode", "a=1", TestFixtures.NOW.toEpochMilli(), "extension-sync", false));

    SessionRecord record = sessionStore.load("leetcode").orElseThrow();

    assertThat(record.cookieHeader()).isEqualTo("a=1");
    assertThat(record.channel()).isEqualTo(CaptureChannel.EXTENSION_SYNC);
  }

  @Test
  void evictIfCapturedBefore_sparesNewerRecord() {
    sessionStore.save("leetcode", "a=1", CaptureChannel.INTERACTIVE);

    assertThat(sessionStore.evictIfCapturedBefore("leetcode", TestFixtures.NOW)).isFalse();
    assertThat(sessionStore.evictIfCapturedBefore("leetcode", TestFixtures.NOW.plusMillis(1))).isTrue();
    assertThat(sessionStore.load("leetcode")).isEmpty();
  }

  @Test
  void deleteAndDeleteAll() {
    sessionStore.save("leetcode", "a=1", CaptureChannel.INTERACTIVE);
    sessionStore.save("coderpad", "b=1", CaptureChannel.INTERACTIVE);
    sessionStore.save("glider", "c=1", CaptureChannel.EXTENSION_SYNC);

    assertThat(sessionStore.delete("leetcode")).isTrue();
    assertThat(sessionStore.delete("leetcode")).isFalse();
    assertThat(sessionStore.deleteAll()).isEqualTo(2);
    assertThat(repository.findAll()).isEmpty();
  }

  @Test
  void save_withoutKeystoreStoresPlaintext() {
    EncryptionService plaintext = new EncryptionService(
        new KeyStoreSessionKeyProvider(tempDir.resolve("none.p12"), null, "session"));
    SessionStore store = new SessionStore(repository, plaintext, new PlatformLockService(), clock,
                                          TestFixtures.properties(tempDir).build());

    store.save("leetcode", "a=1", CaptureChannel.INTERACTIVE, Instant.EPOCH.plusSeconds(5));

    StoredSession stored = repository.find("leetcode").orElseThrow();
    assertThat(stored.encrypted()).isFalse();
    assertThat(stored.payload()).isEqualTo("a=1");
  }

  @Test
  void save_concurrentOutOfOrderWritesKeepNewestPerPlatform() throws Exception {
    List<String> platformIds = List.of("leetcode", "coderpad", "glider", "hackerrank", "lark");
    int writesPerPlatform = 25;
    CountDownLatch start = new CountDownLatch(1);
    List<Callable<SaveResult>> writes = new ArrayList<>();
    for (String platformId : platformIds) {
      for (int age = 0; age < writesPerPlatform; age++) {
        Instant capturedAt = TestFixtures.NOW.minusSeconds(age);
        String header = platformId + "=" + age;
        writes.add(() -> {
          start.await();
          return sessionStore.save(platformId, header, CaptureChannel.EXTENSION_SYNC, capturedAt);
        });
      }
    }
    Collections.shuffle(writes, new Random(42));

    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      List<Future<SaveResult>> results = new ArrayList<>();
      for (Callable<SaveResult> write : writes) {
        results.add(pool.submit(write));
      }
      start.countDown();
      for (Future<SaveResult> result : results) {
        result.get(30, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    SessionStore restarted = newStore(repository);
    for (String platformId : platformIds) {
      SessionRecord cached = sessionStore.load(platformId).orElseThrow();
      assertThat(cached.capturedAt()).isEqualTo(TestFixtures.NOW);
      assertThat(cached.cookieHeader()).isEqualTo(platformId + "=0");

      StoredSession stored = repository.find(platformId).orElseThrow();
      assertThat(stored.capturedAtEpochMillis()).isEqualTo(TestFixtures.NOW.toEpochMilli());
      assertThat(restarted.load(platformId)).contains(cached);
    }
    assertThat(repository.findAll()).containsOnlyKeys(platformIds);
  }

  @Test
  void saveAndDelete_concurrentAcrossPlatformsDoNotInterfere() throws Exception {
    List<String> kept = List.of("leetcode", "coderpad", "glider");
    List<String> deleted = List.of("hackerrank", "lark");
    deleted.forEach(platformId -> sessionStore.save(platformId, "old=1", CaptureChannel.INTERACTIVE,
                                                    TestFixtures.NOW.minusSeconds(60)));
    CountDownLatch start = new CountDownLatch(1);
    List<Callable<Object>> work = new ArrayList<>();
    for (String platformId : kept) {
      work.add(() -> {
        start.await();
        return sessionStore.save(platformId, platformId + "=1", CaptureChannel.INTERACTIVE);
      });
    }
    for (String platformId : deleted) {
      work.add(() -> {
        start.await();
        return sessionStore.delete(platformId);
      });
    }

    ExecutorService pool = Executors.newFixedThreadPool(work.size());
    try {
      List<Future<Object>> results = new ArrayList<>();
      for (Callable<Object> task : work) {
        results.add(pool.submit(task));
      }
      start.countDown();
      for (Future<Object> result : results) {
        result.get(30, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    assertThat(repository.findAll()).containsOnlyKeys(kept);
    assertThat(sessionStore.loadAll()).containsOnlyKeys(kept);
    deleted.forEach(platformId -> assertThat(sessionStore.load(platformId)).isEmpty());
  }

  private SessionStore newStore(SessionRecordRepository backing) {
    return new SessionStore(backing, encryptionService, new PlatformLockService(), clock,
                            TestFixtures.properties(tempDir).build());
  }
}
