package com.example.platformauth.adapter.backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SyncAcknowledgement(boolean success, String platform, Long capturedAt, boolean applied) {}
