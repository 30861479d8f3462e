package com.example.platformauth.adapter.keystore;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import javax.crypto.SecretKey;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class KeyStoreSessionKeyProviderTest {

  @TempDir
  Path tempDir;

  @Test
  void firstUse_createsKeystoreAndReusesKey() {
    Path keystore = tempDir.resolve("nested").resolve("keys.p12");

    Optional<SecretKey> created = new KeyStoreSessionKeyProvider(keystore, "secret", "session").loadKey();
    Optional<SecretKey> reloaded = new KeyStoreSessionKeyProvider(keystore, "secret", "session").loadKey();

    assertThat(Files.exists(keystore)).isTrue();
    assertThat(created).isPresent();
    assertThat(created.get().getEncoded()).hasSize(32);
    assertThat(reloaded).isPresent();
    assertThat(reloaded.get().getEncoded()).isEqualTo(created.get().getEncoded());
  }

  @Test
  void missingPassword_meansNoKey() {
    assertThat(new KeyStoreSessionKeyProvider(tempDir.resolve("keys.p12"), "", "session").loadKey()).isEmpty();
    assertThat(new KeyStoreSessionKeyProvider(tempDir.resolve("keys.p12"), null, "session").loadKey()).isEmpty();
    assertThat(Files.exists(tempDir.resolve("keys.p12"))).isFalse();
  }

  @Test
  void wrongPassword_meansNoKey() {
    Path keystore = tempDir.resolve("keys.p12");
    new KeyStoreSessionKeyProvider(keystore, "secret", "session").loadKey();

    assertThat(new KeyStoreSessionKeyProvider(keystore, "other", "session").loadKey()).isEmpty();
  }
}
