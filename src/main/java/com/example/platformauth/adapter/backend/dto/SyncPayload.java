package com.example.platformauth.adapter.backend.dto;

/**
 * Body posted to the sync endpoint.
 */
public record SyncPayload(String platform, String cookies, long timestamp) {}
