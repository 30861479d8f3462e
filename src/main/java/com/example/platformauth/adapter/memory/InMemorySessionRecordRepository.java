package com.example.platformauth.adapter.memory;

import com.example.platformauth.adapter.store.SessionRecordRepository;
import com.example.platformauth.adapter.store.dto.StoreHealthResponse;
import com.example.platformauth.domain.entity.StoredSession;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-persistent repository for development and tests. Contents are lost on restart.
 */
public class InMemorySessionRecordRepository implements SessionRecordRepository {

  private static final String BACKEND = "memory";

  private final Map<String, StoredSession> sessions = new ConcurrentHashMap<>();

  @Override
  public Map<String, StoredSession> findAll() {
    return Map.copyOf(sessions);
  }

  @Override
  public Optional<StoredSession> find(String platformId) {
    return Optional.ofNullable(sessions.get(platformId));
  }

  @Override
  public void save(StoredSession session) {
    sessions.put(session.platformId(), session);
  }

  @Override
  public boolean delete(String platformId) {
    return sessions.remove(platformId) != null;
  }

  @Override
  public StoreHealthResponse checkHealth() {
    return StoreHealthResponse.healthy(BACKEND, 0, null);
  }
}
