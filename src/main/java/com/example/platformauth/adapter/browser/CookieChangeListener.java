package com.example.platformauth.adapter.browser;

@FunctionalInterface
public interface CookieChangeListener {

  /**
   * Must return quickly; it runs on the cookie source's own thread.
   */
  void onCookieChanged(CookieChangeEvent event);
}
