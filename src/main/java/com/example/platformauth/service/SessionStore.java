package com.example.platformauth.service;

import com.example.platformauth.adapter.store.SessionRecordRepository;
import com.example.platformauth.domain.entity.CaptureChannel;
import com.example.platformauth.domain.entity.SaveResult;
import com.example.platformauth.domain.entity.SessionRecord;
import com.example.platformauth.domain.entity.StoredSession;
import com.example.platformauth.exception.SessionStoreException;
import com.example.platformauth.properties.ApplicationProperties;
import com.example.platformauth.util.CookieUtil;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Authoritative store of captured platform sessions.
 *
 * <p>Durable storage is the source of truth; the local cache is only written after a durable
 * write succeeds, so it never holds anything a restart would not return. All mutations for one
 * platform run under that platform's lock and a record is never replaced by one with an earlier
 * capture time.
 */
@Service
@Slf4j
public class SessionStore {

  private final SessionRecordRepository repository;
  private final EncryptionService encryptionService;
  private final PlatformLockService lockService;
  private final Clock clock;
  private final Cache<String, SessionRecord> sessionCache;

  public SessionStore(
      SessionRecordRepository repository,
      EncryptionService encryptionService,
      PlatformLockService lockService,
      Clock clock,
      ApplicationProperties properties) {
    this.repository = repository;
    this.encryptionService = encryptionService;
    this.lockService = lockService;
    this.clock = clock;
    this.sessionCache = Caffeine.newBuilder()
        .maximumSize(properties.session().cacheMaxSize())
        .build();
  }

  @PostConstruct
  public void warmCache() {
    try {
      Map<String, SessionRecord> records = loadAll();
      log.info("Session store warmed with {} records", records.size());
    } catch (SessionStoreException e) {
      log.warn("Session store could not be warmed, reads will go to durable storage: {}", e.getMessage());
    }
  }

  /**
   * Reads every stored record from durable storage and replaces the cache contents with them.
   * Records that fail to decrypt are evicted.
   */
  public Map<String, SessionRecord> loadAll() {
    Map<String, SessionRecord> records = new LinkedHashMap<>();
    for (String platformId : repository.findAll().keySet()) {
      lockService.withLock(platformId, () -> {
        sessionCache.invalidate(platformId);
        return readThrough(platformId);
      }).ifPresent(record -> records.put(platformId, record));
    }
    return records;
  }

  public Optional<SessionRecord> load(String platformId) {
    SessionRecord cached = sessionCache.getIfPresent(platformId);
    if (cached != null) {
      return Optional.of(cached);
    }
    return lockService.withLock(platformId, () -> readThrough(platformId));
  }

  public SaveResult save(String platformId, String cookieHeader, CaptureChannel channel) {
    return save(platformId, cookieHeader, channel, null);
  }

  /**
   * Replaces the platform's record unless the stored one was captured strictly later.
   *
   * @param capturedAt capture time, or null for now; future times are clamped to now
   * @throws IllegalArgumentException when the cookie header is blank
   * @throws SessionStoreException    when the durable write fails; cache and storage are unchanged
   */
  public SaveResult save(String platformId, String cookieHeader, CaptureChannel channel, Instant capturedAt) {
    if (cookieHeader == null || cookieHeader.isBlank()) {
      throw new IllegalArgumentException("Cookie header must not be empty");
    }
    Instant now = clock.instant();
    Instant effective = capturedAt == null || capturedAt.isAfter(now) ? now : capturedAt;
    SessionRecord candidate = new SessionRecord(
        platformId, cookieHeader.trim(), effective.truncatedTo(ChronoUnit.MILLIS), channel);

    return lockService.withLock(platformId, () -> {
      Optional<SessionRecord> current = currentRecord(platformId);
      if (current.isPresent() && current.get().capturedAt().isAfter(candidate.capturedAt())) {
        log.info("Discarding {} capture for {} taken at {}, stored record is newer ({})",
                 channel.wireName(), platformId, candidate.capturedAt(), current.get().capturedAt());
        return SaveResult.stale(current.get());
      }

      repository.save(encode(candidate));
      sessionCache.put(platformId, candidate);
      log.info("Stored {} session for {} with {} cookies",
               channel.wireName(), platformId, CookieUtil.countCookies(candidate.cookieHeader()));
      return SaveResult.applied(candidate);
    });
  }

  /**
   * @return true when a record existed and was removed
   */
  public boolean delete(String platformId) {
    return lockService.withLock(platformId, () -> {
      boolean removed = repository.delete(platformId);
      boolean cached = sessionCache.getIfPresent(platformId) != null;
      sessionCache.invalidate(platformId);
      if (removed || cached) {
        log.info("Deleted session for {}", platformId);
      }
      return removed || cached;
    });
  }

  /**
   * Deletes the platform's record only if it was captured before {@code cutoff}. A record saved
   * concurrently with a newer capture time survives.
   */
  public boolean evictIfCapturedBefore(String platformId, Instant cutoff) {
    return lockService.withLock(platformId, () -> {
      Optional<SessionRecord> current = currentRecord(platformId);
      if (current.isEmpty() || !current.get().capturedAt().isBefore(cutoff)) {
        return false;
      }
      repository.delete(platformId);
      sessionCache.invalidate(platformId);
      log.info("Evicted expired session for {} captured at {}", platformId, current.get().capturedAt());
      return true;
    });
  }

  /**
   * @return number of records removed
   */
  public int deleteAll() {
    Set<String> platformIds = new HashSet<>(repository.findAll().keySet());
    platformIds.addAll(sessionCache.asMap().keySet());
    int removed = 0;
    for (String platformId : platformIds) {
      if (delete(platformId)) {
        removed++;
      }
    }
    log.info("Cleared {} stored sessions", removed);
    return removed;
  }

  // Caller holds the platform lock.
  private Optional<SessionRecord> currentRecord(String platformId) {
    SessionRecord cached = sessionCache.getIfPresent(platformId);
    if (cached != null) {
      return Optional.of(cached);
    }
    return readThrough(platformId);
  }

  // Caller holds the platform lock.
  private Optional<SessionRecord> readThrough(String platformId) {
    Optional<StoredSession> stored = repository.find(platformId);
    if (stored.isEmpty()) {
      return Optional.empty();
    }
    Optional<SessionRecord> record = decode(stored.get());
    record.ifPresent(value -> sessionCache.put(platformId, value));
    return record;
  }

  private Optional<SessionRecord> decode(StoredSession stored) {
    String platformId = stored.platformId();
    String cookieHeader;
    if (!stored.encrypted()) {
      cookieHeader = stored.payload();
    } else if (!encryptionService.isEncryptionAvailable()) {
      log.warn("Session for {} is encrypted but secure storage is unavailable, ignoring it", platformId);
      return Optional.empty();
    } else {
      cookieHeader = encryptionService.decrypt(stored.payload());
    }

    if (cookieHeader == null || cookieHeader.isBlank()) {
      log.warn("Stored session for {} could not be decrypted, evicting it", platformId);
      repository.delete(platformId);
      return Optional.empty();
    }

    CaptureChannel channel;
    try {
      channel = CaptureChannel.fromWireName(stored.channel());
    } catch (IllegalArgumentException e) {
      channel = CaptureChannel.INTERACTIVE;
    }
    return Optional.of(new SessionRecord(
        platformId, cookieHeader, Instant.ofEpochMilli(stored.capturedAtEpochMillis()), channel));
  }

  private StoredSession encode(SessionRecord record) {
    boolean encrypted = encryptionService.isEncryptionAvailable();
    String payload = encrypted ? encryptionService.encrypt(record.cookieHeader()) : record.cookieHeader();
    return new StoredSession(
        record.platformId(),
        payload,
        record.capturedAt().toEpochMilli(),
        record.channel().wireName(),
        encrypted);
  }
}
