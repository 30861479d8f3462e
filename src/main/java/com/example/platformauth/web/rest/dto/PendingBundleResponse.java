package com.example.platformauth.web.rest.dto;

import com.example.platformauth.domain.entity.CookieBundle;
import com.example.platformauth.util.CookieUtil;

/**
 * A bundle waiting in the bridge's fallback storage. Cookie values are not exposed.
 */
public record PendingBundleResponse(long timestamp, int cookieCount) {

  public static PendingBundleResponse from(CookieBundle bundle) {
    return new PendingBundleResponse(bundle.timestamp(), CookieUtil.countCookies(bundle.cookies()));
  }
}
