package com.example.platformauth.adapter.browser;

import com.example.platformauth.domain.entity.BrowserCookie;

public record CookieChangeEvent(BrowserCookie cookie, boolean removed) {}
