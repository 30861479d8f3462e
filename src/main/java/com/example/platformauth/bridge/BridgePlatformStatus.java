package com.example.platformauth.bridge;

/**
 * What the bridge sees of one platform in the everyday browser.
 */
public record BridgePlatformStatus(boolean authenticated, int cookieCount) {}
