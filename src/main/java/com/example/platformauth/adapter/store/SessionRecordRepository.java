package com.example.platformauth.adapter.store;

import com.example.platformauth.adapter.store.dto.StoreHealthResponse;
import com.example.platformauth.domain.entity.StoredSession;
import java.util.Map;
import java.util.Optional;

/**
 * Durable storage of session payloads, one entry per platform id. Implementations throw
 * {@link com.example.platformauth.exception.SessionStoreException} when the backend fails.
 */
public interface SessionRecordRepository {

  Map<String, StoredSession> findAll();

  Optional<StoredSession> find(String platformId);

  void save(StoredSession session);

  /**
   * @return true when an entry was removed
   */
  boolean delete(String platformId);

  StoreHealthResponse checkHealth();
}
