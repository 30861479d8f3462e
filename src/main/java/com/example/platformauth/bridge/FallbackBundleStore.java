package com.example.platformauth.bridge;

import com.example.platformauth.domain.entity.CookieBundle;
import com.example.platformauth.service.EncryptionService;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;

/**
 * Local holding area for cookie bundles that could not be delivered. One file
 * {@code cookies_<platformId>.json} per platform; a newer bundle replaces an older one. The cookie
 * header inside is encrypted when secure storage is available.
 */
@Slf4j
public class FallbackBundleStore {

  public static final String KEY_PREFIX = "cookies_";
  private static final String FILE_SUFFIX = ".json";

  private final Path directory;
  private final ObjectMapper objectMapper;
  private final EncryptionService encryptionService;

  public FallbackBundleStore(Path directory, ObjectMapper objectMapper, EncryptionService encryptionService) {
    this.directory = directory;
    this.objectMapper = objectMapper;
    this.encryptionService = encryptionService;
  }

  /**
   * @return true when the bundle is on disk
   */
  public boolean write(String platformId, CookieBundle bundle) {
    boolean encrypted = encryptionService.isEncryptionAvailable();
    StoredBundle stored = new StoredBundle(
        encrypted ? encryptionService.encrypt(bundle.cookies()) : bundle.cookies(),
        bundle.timestamp(),
        encrypted);
    Path target = file(platformId);
    try {
      Files.createDirectories(directory);
      Path temp = Files.createTempFile(directory, KEY_PREFIX, ".tmp");
      objectMapper.writeValue(temp.toFile(), stored);
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      log.info("Saved {} to fallback storage", KEY_PREFIX + platformId);
      return true;
    } catch (IOException e) {
      log.error("Could not write fallback bundle for {}", platformId, e);
      return false;
    }
  }

  public Optional<CookieBundle> read(String platformId) {
    Path source = file(platformId);
    if (!Files.exists(source)) {
      return Optional.empty();
    }
    try {
      StoredBundle stored = objectMapper.readValue(source.toFile(), StoredBundle.class);
      String cookies = stored.encrypted() ? encryptionService.decrypt(stored.cookies()) : stored.cookies();
      if (cookies == null || cookies.isBlank()) {
        log.warn("Fallback bundle for {} is unreadable, discarding it", platformId);
        remove(platformId);
        return Optional.empty();
      }
      return Optional.of(new CookieBundle(cookies, stored.timestamp()));
    } catch (IOException e) {
      log.warn("Fallback bundle for {} is corrupt, discarding it: {}", platformId, e.getMessage());
      remove(platformId);
      return Optional.empty();
    }
  }

  /**
   * Every pending bundle keyed by platform id.
   */
  public Map<String, CookieBundle> pending() {
    Map<String, CookieBundle> bundles = new TreeMap<>();
    if (!Files.isDirectory(directory)) {
      return bundles;
    }
    try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, KEY_PREFIX + "*" + FILE_SUFFIX)) {
      for (Path path : files) {
        String name = path.getFileName().toString();
        String platformId = name.substring(KEY_PREFIX.length(), name.length() - FILE_SUFFIX.length());
        read(platformId).ifPresent(bundle -> bundles.put(platformId, bundle));
      }
    } catch (IOException e) {
      log.warn("Could not list fallback bundles: {}", e.getMessage());
    }
    return bundles;
  }

  public void remove(String platformId) {
    try {
      Files.deleteIfExists(file(platformId));
    } catch (IOException e) {
      log.warn("Could not remove fallback bundle for {}: {}", platformId, e.getMessage());
    }
  }

  private Path file(String platformId) {
    return directory.resolve(KEY_PREFIX + platformId + FILE_SUFFIX);
  }

  public record StoredBundle(String cookies, long timestamp, boolean encrypted) {}
}
