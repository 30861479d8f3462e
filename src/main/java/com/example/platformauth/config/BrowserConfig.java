package com.example.platformauth.config;

import com.example.platformauth.adapter.browser.BrowsingContextFactory;
import com.example.platformauth.adapter.browser.playwright.PlaywrightBrowsingContextFactory;
import com.example.platformauth.properties.ApplicationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods = false)
public class BrowserConfig {

  /**
   * Headed Chromium windows for interactive logins, one persistent profile per partition.
   */
  @Bean
  public BrowsingContextFactory browsingContextFactory(ApplicationProperties properties) {
    return new PlaywrightBrowsingContextFactory(properties.capture());
  }
}
