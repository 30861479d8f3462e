package com.example.platformauth.bridge;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of a manual sync from the bridge.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BridgeSyncResult(String platform, boolean success, String error) {

  public static final String ERROR_NOT_AUTHENTICATED = "Not authenticated";
  public static final String ERROR_SAVED_LOCALLY = "Backend unreachable, saved locally";

  public static BridgeSyncResult synced(String platform) {
    return new BridgeSyncResult(platform, true, null);
  }

  public static BridgeSyncResult failed(String platform, String error) {
    return new BridgeSyncResult(platform, false, error);
  }
}
