package com.example.platformauth.adapter.redis.client;

import com.example.platformauth.adapter.store.SessionRecordRepository;
import com.example.platformauth.adapter.store.dto.StoreHealthResponse;
import com.example.platformauth.domain.entity.StoredSession;
import com.example.platformauth.exception.SessionStoreException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.lang.NonNull;

/**
 * Stores one Redis hash per platform plus an index set of platform ids. Hashes carry no TTL,
 * freshness is decided on read by the status service.
 */
@Slf4j
public class RedisSessionRecordRepository implements SessionRecordRepository {

  public static final String FIELD_PLATFORM_ID = "platformId";
  public static final String FIELD_PAYLOAD = "payload";
  public static final String FIELD_CAPTURED_AT = "capturedAt";
  public static final String FIELD_CHANNEL = "channel";
  public static final String FIELD_ENCRYPTED = "encrypted";

  private final RedisTemplate<String, String> redisTemplate;
  private final RedisHealthClient healthClient;
  private final String sessionKeyPrefix;
  private final String indexKey;

  public RedisSessionRecordRepository(
      RedisTemplate<String, String> redisTemplate, RedisHealthClient healthClient, String keyPrefix) {
    this.redisTemplate = redisTemplate;
    this.healthClient = healthClient;
    this.sessionKeyPrefix = keyPrefix + "session:";
    this.indexKey = keyPrefix + "sessions";
  }

  @Override
  public Map<String, StoredSession> findAll() {
    try {
      Set<String> platformIds = redisTemplate.opsForSet().members(indexKey);
      if (platformIds == null || platformIds.isEmpty()) {
        return Map.of();
      }
      List<String> ids = new ArrayList<>(platformIds);

      List<Object> results = redisTemplate.executePipelined(new SessionCallback<Object>() {
        @Override
        public Object execute(@NonNull RedisOperations operations) {
          @SuppressWarnings("unchecked")
          RedisOperations<String, String> redisOps = (RedisOperations<String, String>) operations;
          for (String id : ids) {
            redisOps.opsForHash().entries(sessionKey(id));
          }
          return null;
        }
      });

      Map<String, StoredSession> sessions = new LinkedHashMap<>();
      for (int i = 0; i < ids.size(); i++) {
        @SuppressWarnings("unchecked")
        Map<String, String> fields = (Map<String, String>) results.get(i);
        Optional<StoredSession> session = toStoredSession(ids.get(i), fields);
        if (session.isPresent()) {
          sessions.put(ids.get(i), session.get());
        } else {
          log.warn("Dropping stale index entry for platform {}", ids.get(i));
          redisTemplate.opsForSet().remove(indexKey, ids.get(i));
        }
      }
      return sessions;

    } catch (DataAccessException e) {
      throw new SessionStoreException("Failed to load sessions from Redis", e);
    }
  }

  @Override
  public Optional<StoredSession> find(String platformId) {
    try {
      HashOperations<String, String, String> hashOps = redisTemplate.opsForHash();
      return toStoredSession(platformId, hashOps.entries(sessionKey(platformId)));
    } catch (DataAccessException e) {
      throw new SessionStoreException("Failed to load session for " + platformId, e);
    }
  }

  @Override
  public void save(StoredSession session) {
    String sessionKey = sessionKey(session.platformId());
    Map<String, String> fields = new HashMap<>();
    fields.put(FIELD_PLATFORM_ID, session.platformId());
    fields.put(FIELD_PAYLOAD, session.payload());
    fields.put(FIELD_CAPTURED_AT, String.valueOf(session.capturedAtEpochMillis()));
    fields.put(FIELD_CHANNEL, session.channel());
    fields.put(FIELD_ENCRYPTED, String.valueOf(session.encrypted()));

    try {
      redisTemplate.executePipelined(new SessionCallback<Object>() {
        @Override
        public Object execute(@NonNull RedisOperations operations) {
          @SuppressWarnings("unchecked")
          RedisOperations<String, String> redisOps = (RedisOperations<String, String>) operations;
          redisOps.delete(sessionKey);
          redisOps.opsForHash().putAll(sessionKey, fields);
          redisOps.opsForSet().add(indexKey, session.platformId());
          return null;
        }
      });
    } catch (DataAccessException e) {
      throw new SessionStoreException("Failed to persist session for " + session.platformId(), e);
    }
  }

  @Override
  public boolean delete(String platformId) {
    String sessionKey = sessionKey(platformId);
    try {
      List<Object> results = redisTemplate.executePipelined(new SessionCallback<Object>() {
        @Override
        public Object execute(@NonNull RedisOperations operations) {
          @SuppressWarnings("unchecked")
          RedisOperations<String, String> redisOps = (RedisOperations<String, String>) operations;
          redisOps.delete(sessionKey);
          redisOps.opsForSet().remove(indexKey, platformId);
          return null;
        }
      });
      Object deleted = results.isEmpty() ? null : results.get(0);
      return Boolean.TRUE.equals(deleted) || (deleted instanceof Long && (Long) deleted > 0);
    } catch (DataAccessException e) {
      throw new SessionStoreException("Failed to delete session for " + platformId, e);
    }
  }

  @Override
  public StoreHealthResponse checkHealth() {
    return healthClient.checkHealth();
  }

  private String sessionKey(String platformId) {
    return sessionKeyPrefix + platformId;
  }

  private Optional<StoredSession> toStoredSession(String platformId, Map<String, String> fields) {
    if (fields == null || fields.isEmpty() || fields.get(FIELD_PAYLOAD) == null
        || fields.get(FIELD_CAPTURED_AT) == null) {
      return Optional.empty();
    }
    long capturedAt;
    try {
      capturedAt = Long.parseLong(fields.get(FIELD_CAPTURED_AT));
    } catch (NumberFormatException e) {
      log.warn("Unreadable capture time for platform {}", platformId);
      return Optional.empty();
    }
    return Optional.of(new StoredSession(
        platformId,
        fields.get(FIELD_PAYLOAD),
        capturedAt,
        fields.get(FIELD_CHANNEL),
        Boolean.parseBoolean(fields.get(FIELD_ENCRYPTED))));
  }
}
