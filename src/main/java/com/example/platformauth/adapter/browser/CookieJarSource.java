package com.example.platformauth.adapter.browser;

import com.example.platformauth.domain.entity.BrowserCookie;
import java.util.List;

/**
 * Read access to the cookie jar of the user's everyday browser. Queries throw
 * {@link com.example.platformauth.exception.CookieJarUnavailableException} when the browser cannot
 * be reached.
 */
public interface CookieJarSource {

  /**
   * Cookies the browser would send to {@code url}, including secure and partitioned ones.
   */
  List<BrowserCookie> cookiesForUrl(String url);

  /**
   * Cookies whose domain equals {@code domain} or is a subdomain of it.
   */
  List<BrowserCookie> cookiesForDomain(String domain);

  void addListener(CookieChangeListener listener);

  boolean isConnected();
}
