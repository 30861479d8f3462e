package com.example.platformauth.config;

import com.example.platformauth.adapter.memory.InMemorySessionRecordRepository;
import com.example.platformauth.adapter.store.SessionRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(value = "app.store.type", havingValue = "memory")
public class MemoryStoreConfig {

  @Bean
  public SessionRecordRepository sessionRecordRepository() {
    log.warn("Session store is in memory only, sessions will not survive a restart");
    return new InMemorySessionRecordRepository();
  }
}
