package com.example.platformauth.web.rest.dto;

import com.example.platformauth.domain.entity.SaveResult;

/**
 * Answer to a sync push. {@code applied} is false when the store already held a newer capture;
 * {@code capturedAt} is then the capture time of the record that was kept.
 */
public record SyncResponse(boolean success, String platform, long capturedAt, boolean applied) {

  public static SyncResponse from(String platform, SaveResult result) {
    return new SyncResponse(true, platform, result.record().capturedAt().toEpochMilli(), result.applied());
  }
}
