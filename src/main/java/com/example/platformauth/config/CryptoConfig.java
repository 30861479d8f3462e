package com.example.platformauth.config;

import com.example.platformauth.adapter.keystore.KeyStoreSessionKeyProvider;
import com.example.platformauth.properties.ApplicationProperties;
import java.nio.file.Path;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods = false)
public class CryptoConfig {

  @Bean
  public KeyStoreSessionKeyProvider sessionKeyProvider(ApplicationProperties properties) {
    ApplicationProperties.CryptoProperties crypto = properties.crypto();
    return new KeyStoreSessionKeyProvider(Path.of(crypto.keystorePath()), crypto.keystorePassword(), crypto.keyAlias());
  }
}
