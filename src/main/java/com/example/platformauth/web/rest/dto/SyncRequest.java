package com.example.platformauth.web.rest.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Cookie bundle pushed by the sync bridge. {@code timestamp} is the capture time in epoch millis;
 * the receive time is used when it is absent.
 */
public record SyncRequest(
    @NotBlank(message = "platform is required") String platform,
    @NotBlank(message = "cookies are required") String cookies,
    @PositiveOrZero(message = "timestamp must not be negative") Long timestamp
) {}
