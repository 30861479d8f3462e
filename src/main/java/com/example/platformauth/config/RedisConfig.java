package com.example.platformauth.config;

import com.example.platformauth.adapter.redis.client.RedisHealthClient;
import com.example.platformauth.adapter.redis.client.RedisSessionRecordRepository;
import com.example.platformauth.adapter.store.SessionRecordRepository;
import com.example.platformauth.properties.ApplicationProperties;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.TimeoutOptions;
import io.lettuce.core.api.StatefulConnection;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettucePoolingClientConfiguration;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis-backed session storage with a pooled Lettuce connection. Active unless
 * {@code app.store.type} selects another backend.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(value = "app.store.type", havingValue = "redis", matchIfMissing = true)
@RequiredArgsConstructor
public class RedisConfig {

  private final ApplicationProperties properties;

  @Bean
  public GenericObjectPoolConfig<StatefulConnection<?, ?>> redisPoolConfig() {
    ApplicationProperties.RedisProperties.PoolProperties poolProps = properties.redis().pool();

    GenericObjectPoolConfig<StatefulConnection<?, ?>> config = new GenericObjectPoolConfig<>();
    config.setMaxTotal(poolProps.maxActive());
    config.setMaxIdle(poolProps.maxIdle());
    config.setMinIdle(poolProps.minIdle());
    config.setMaxWait(poolProps.maxWait());
    config.setTestOnBorrow(false);
    config.setTestWhileIdle(true);
    return config;
  }

  @Bean
  public RedisConnectionFactory redisConnectionFactory(GenericObjectPoolConfig<StatefulConnection<?, ?>> poolConfig) {
    ApplicationProperties.RedisProperties redisProps = properties.redis();

    RedisStandaloneConfiguration redisConfig = new RedisStandaloneConfiguration();
    redisConfig.setHostName(redisProps.host());
    redisConfig.setPort(redisProps.port());
    if (redisProps.password() != null && !redisProps.password().isBlank()) {
      redisConfig.setPassword(redisProps.password());
    }

    LettuceClientConfiguration.LettuceClientConfigurationBuilder builder =
        LettucePoolingClientConfiguration.builder()
            .poolConfig(poolConfig)
            .commandTimeout(redisProps.timeout())
            .shutdownTimeout(Duration.ofSeconds(2))
            .clientOptions(ClientOptions.builder()
                               .socketOptions(SocketOptions.builder()
                                                  .connectTimeout(redisProps.timeout())
                                                  .keepAlive(true)
                                                  .build())
                               .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
                               .timeoutOptions(TimeoutOptions.enabled(redisProps.timeout()))
                               .build());

    if (redisProps.ssl()) {
      builder.useSsl();
    }

    log.info("Session store backed by Redis at {}:{}", redisProps.host(), redisProps.port());
    return new LettuceConnectionFactory(redisConfig, builder.build());
  }

  @Bean
  @Primary
  public RedisTemplate<String, String> redisTemplate(RedisConnectionFactory connectionFactory) {
    RedisTemplate<String, String> template = new RedisTemplate<>();
    template.setConnectionFactory(connectionFactory);

    StringRedisSerializer stringSerializer = new StringRedisSerializer();
    template.setKeySerializer(stringSerializer);
    template.setValueSerializer(stringSerializer);
    template.setHashKeySerializer(stringSerializer);
    template.setHashValueSerializer(stringSerializer);

    template.setEnableTransactionSupport(false);
    template.afterPropertiesSet();
    return template;
  }

  @Bean
  public RedisHealthClient redisHealthClient(RedisTemplate<String, String> redisTemplate) {
    return new RedisHealthClient(redisTemplate);
  }

  @Bean
  public SessionRecordRepository sessionRecordRepository(
      RedisTemplate<String, String> redisTemplate, RedisHealthClient redisHealthClient) {
    return new RedisSessionRecordRepository(redisTemplate, redisHealthClient, properties.store().keyPrefix());
  }
}
