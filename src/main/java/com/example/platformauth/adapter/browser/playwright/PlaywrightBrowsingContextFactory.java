package com.example.platformauth.adapter.browser.playwright;

import com.example.platformauth.adapter.browser.BrowsingContext;
import com.example.platformauth.adapter.browser.BrowsingContextFactory;
import com.example.platformauth.adapter.browser.BrowsingContextListener;
import com.example.platformauth.adapter.browser.playwright.PlaywrightBrowsingContext.PlaywrightLaunchOptions;
import com.example.platformauth.exception.BrowserLaunchException;
import com.example.platformauth.properties.ApplicationProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.FileSystemUtils;

/**
 * Opens each partition as a persistent Chromium profile under the configured profile directory,
 * so a partition keeps its cookie jar across restarts and never shares it with another.
 */
@Slf4j
public class PlaywrightBrowsingContextFactory implements BrowsingContextFactory {

  private final Path profileRoot;
  private final PlaywrightLaunchOptions launchOptions;

  public PlaywrightBrowsingContextFactory(ApplicationProperties.CaptureProperties capture) {
    this.profileRoot = Path.of(capture.profileDir());
    this.launchOptions = new PlaywrightLaunchOptions(
        capture.headless(),
        capture.windowWidth(),
        capture.windowHeight(),
        capture.pumpInterval(),
        capture.launchTimeout());
  }

  @Override
  public BrowsingContext open(String partition, String startUrl, BrowsingContextListener listener) {
    Path profileDir = profileDir(partition);
    try {
      Files.createDirectories(profileDir);
    } catch (IOException e) {
      throw new BrowserLaunchException("Cannot create profile directory " + profileDir, e);
    }
    PlaywrightBrowsingContext context =
        new PlaywrightBrowsingContext(partition, profileDir, startUrl, launchOptions, listener);
    context.start();
    return context;
  }

  @Override
  public void clearPartition(String partition) {
    Path profileDir = profileDir(partition);
    try {
      if (FileSystemUtils.deleteRecursively(profileDir)) {
        log.info("Cleared browser profile of {}", partition);
      }
    } catch (IOException e) {
      log.warn("Could not clear browser profile of {}: {}", partition, e.getMessage());
    }
  }

  private Path profileDir(String partition) {
    Path resolved = profileRoot.resolve(partition).normalize();
    if (!resolved.startsWith(profileRoot.normalize())) {
      throw new IllegalArgumentException("Invalid partition name: " + partition);
    }
    return resolved;
  }
}
