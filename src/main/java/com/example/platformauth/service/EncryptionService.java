package com.example.platformauth.service;

import com.example.platformauth.adapter.keystore.KeyStoreSessionKeyProvider;
import com.example.platformauth.exception.EncryptionException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Crypto-at-rest for session payloads.
 *
 * AES-256-GCM with the key held in the local keystore. When the keystore is unavailable both
 * directions pass data through unchanged and callers record the payload as plaintext.
 * {@link #decrypt(String)} never throws.
 */
@Slf4j
@Service
public class EncryptionService {

  private static final int GCM_TAG_LENGTH = 128;
  private static final int GCM_IV_LENGTH = 12;
  private static final int AES_256_KEY_BYTES = 32;
  private static final String ENCRYPTION_ALGORITHM = "AES/GCM/NoPadding";
  private static final SecureRandom secureRandom = new SecureRandom();

  private final KeyStoreSessionKeyProvider keyProvider;
  private final AtomicBoolean unavailableWarned = new AtomicBoolean();

  private volatile SecretKey currentKey;
  private volatile boolean keyLoaded;

  public EncryptionService(KeyStoreSessionKeyProvider keyProvider) {
    this.keyProvider = keyProvider;
  }

  @PostConstruct
  public void initialize() {
    loadEncryptionKey();
  }

  public boolean isEncryptionAvailable() {
    return getEncryptionKey() != null;
  }

  /**
   * Encrypt data using AES-256-GCM. Returns null for null or empty input and the input itself
   * when secure storage is unavailable.
   */
  public String encrypt(String plaintext) {
    if (plaintext == null || plaintext.isEmpty()) {
      return null;
    }
    SecretKey key = getEncryptionKey();
    if (key == null) {
      warnUnavailable();
      return plaintext;
    }
    try {
      byte[] iv = new byte[GCM_IV_LENGTH];
      secureRandom.nextBytes(iv);

      Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGORITHM);
      cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
      byte[] encrypted = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

      byte[] combined = new byte[iv.length + encrypted.length];
      System.arraycopy(iv, 0, combined, 0, iv.length);
      System.arraycopy(encrypted, 0, combined, iv.length, encrypted.length);

      return Base64.getEncoder().encodeToString(combined);

    } catch (GeneralSecurityException e) {
      log.error("Encryption failed", e);
      throw new EncryptionException("Failed to encrypt data", e);
    }
  }

  /**
   * Decrypt data using AES-256-GCM. Malformed or foreign input yields null.
   */
  public String decrypt(String encryptedData) {
    if (encryptedData == null || encryptedData.isEmpty()) {
      return null;
    }
    SecretKey key = getEncryptionKey();
    if (key == null) {
      warnUnavailable();
      return encryptedData;
    }
    try {
      byte[] combined = Base64.getDecoder().decode(encryptedData);
      if (combined.length <= GCM_IV_LENGTH) {
        log.warn("Decryption skipped: payload too short");
        return null;
      }

      byte[] iv = new byte[GCM_IV_LENGTH];
      byte[] encrypted = new byte[combined.length - GCM_IV_LENGTH];
      System.arraycopy(combined, 0, iv, 0, GCM_IV_LENGTH);
      System.arraycopy(combined, GCM_IV_LENGTH, encrypted, 0, encrypted.length);

      Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGORITHM);
      cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));

      return new String(cipher.doFinal(encrypted), StandardCharsets.UTF_8);

    } catch (IllegalArgumentException | GeneralSecurityException e) {
      log.warn("Decryption failed: {}", e.getClass().getSimpleName());
      return null;
    }
  }

  private SecretKey getEncryptionKey() {
    if (!keyLoaded) {
      synchronized (this) {
        if (!keyLoaded) {
          loadEncryptionKey();
        }
      }
    }
    return currentKey;
  }

  private synchronized void loadEncryptionKey() {
    currentKey = keyProvider.loadKey()
        .filter(key -> {
          byte[] encoded = key.getEncoded();
          if (encoded == null || encoded.length != AES_256_KEY_BYTES) {
            log.error("Invalid session key length: expected 256 bits");
            return false;
          }
          return true;
        })
        .orElse(null);
    keyLoaded = true;
    if (currentKey != null) {
      log.info("Session encryption enabled");
    }
  }

  private void warnUnavailable() {
    if (unavailableWarned.compareAndSet(false, true)) {
      log.warn("Secure storage unavailable, session payloads are stored as plaintext");
    }
  }
}
