package com.example.platformauth.domain.entity;

/**
 * A cookie header captured by the bridge, waiting to be delivered to the store.
 *
 * @param cookies   serialized cookie header
 * @param timestamp capture time in epoch millis
 */
public record CookieBundle(String cookies, long timestamp) {}
