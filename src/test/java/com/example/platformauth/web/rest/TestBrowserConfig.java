package com.example.platformauth.web.rest;

import com.example.platformauth.adapter.browser.FakeBrowsingContextFactory;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

/**
 * Replaces the Chromium-backed factory so login windows can be driven from tests.
 */
@TestConfiguration(proxyBeanMethods = false)
public class TestBrowserConfig {

  @Bean
  @Primary
  public FakeBrowsingContextFactory fakeBrowsingContextFactory() {
    return new FakeBrowsingContextFactory();
  }
}
