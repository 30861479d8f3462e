package com.example.platformauth.adapter.redis.client;

import com.example.platformauth.adapter.store.dto.StoreHealthResponse;
import java.util.Properties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;

/**
 * Redis Health Check Client
 */
@Slf4j
@RequiredArgsConstructor
public class RedisHealthClient {

  private static final String BACKEND = "redis";

  private final RedisTemplate<String, String> redisTemplate;

  public StoreHealthResponse checkHealth() {
    long startTime = System.currentTimeMillis();

    try {
      String pingResponse = redisTemplate.execute((RedisCallback<String>) connection -> connection.ping());

      if (!"PONG".equals(pingResponse)) {
        return StoreHealthResponse.unhealthy(BACKEND, "Invalid PING response: " + pingResponse);
      }

      Properties info = redisTemplate.execute((RedisCallback<Properties>) connection -> connection.info("server"));
      long responseTime = System.currentTimeMillis() - startTime;

      return StoreHealthResponse.healthy(
          BACKEND,
          responseTime,
          info != null ? info.getProperty("redis_version", "unknown") : "unknown");

    } catch (RuntimeException e) {
      log.error("Redis health check failed", e);
      return StoreHealthResponse.unhealthy(BACKEND, e.getMessage());
    }
  }
}
