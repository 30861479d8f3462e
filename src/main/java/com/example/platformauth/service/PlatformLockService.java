package com.example.platformauth.service;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Service;

/**
 * Per-platform mutual exclusion for store mutations. Work for different platforms never contends.
 */
@Service
public class PlatformLockService {

  private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

  public <T> T withLock(String platformId, Supplier<T> action) {
    ReentrantLock lock = locks.computeIfAbsent(platformId, id -> new ReentrantLock());
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }
}
