package com.example.platformauth.domain.entity;

/**
 * Durable form of a {@link SessionRecord}. The payload is ciphertext when {@code encrypted} is
 * set, otherwise the plain cookie header.
 */
public record StoredSession(
    String platformId,
    String payload,
    long capturedAtEpochMillis,
    String channel,
    boolean encrypted
) {}
