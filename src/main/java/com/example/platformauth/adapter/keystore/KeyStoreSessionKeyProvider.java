package com.example.platformauth.adapter.keystore;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.util.Optional;
import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads the session encryption key from a password-protected PKCS#12 keystore, creating the
 * keystore with a fresh AES-256 key on first use.
 */
@Slf4j
public class KeyStoreSessionKeyProvider {

  private static final String KEYSTORE_TYPE = "PKCS12";
  private static final String KEY_ALGORITHM = "AES";
  private static final int KEY_SIZE_BITS = 256;

  private final Path keystorePath;
  private final String password;
  private final String alias;

  public KeyStoreSessionKeyProvider(Path keystorePath, String password, String alias) {
    this.keystorePath = keystorePath;
    this.password = password;
    this.alias = alias;
  }

  /**
   * @return the key, or empty when no password is configured or the keystore is unusable
   */
  public Optional<SecretKey> loadKey() {
    if (password == null || password.isBlank()) {
      log.warn("No keystore password configured, secure storage is unavailable");
      return Optional.empty();
    }
    char[] secret = password.toCharArray();
    KeyStore.ProtectionParameter protection = new KeyStore.PasswordProtection(secret);
    try {
      KeyStore keyStore = KeyStore.getInstance(KEYSTORE_TYPE);
      if (Files.exists(keystorePath)) {
        try (InputStream in = Files.newInputStream(keystorePath)) {
          keyStore.load(in, secret);
        }
      } else {
        keyStore.load(null, secret);
      }

      KeyStore.Entry entry = keyStore.getEntry(alias, protection);
      if (entry instanceof KeyStore.SecretKeyEntry) {
        log.info("Session key '{}' loaded from {}", alias, keystorePath);
        return Optional.of(((KeyStore.SecretKeyEntry) entry).getSecretKey());
      }

      SecretKey key = generateKey();
      keyStore.setEntry(alias, new KeyStore.SecretKeyEntry(key), protection);
      if (keystorePath.getParent() != null) {
        Files.createDirectories(keystorePath.getParent());
      }
      try (OutputStream out = Files.newOutputStream(keystorePath)) {
        keyStore.store(out, secret);
      }
      log.info("Generated new session key '{}' in {}", alias, keystorePath);
      return Optional.of(key);

    } catch (IOException | GeneralSecurityException e) {
      log.error("Failed to open session keystore {}", keystorePath, e);
      return Optional.empty();
    }
  }

  private SecretKey generateKey() throws GeneralSecurityException {
    KeyGenerator generator = KeyGenerator.getInstance(KEY_ALGORITHM);
    generator.init(KEY_SIZE_BITS);
    return generator.generateKey();
  }
}
