package com.example.platformauth.exception;

public class UnknownPlatformException extends RuntimeException {

  private final String platformId;

  public UnknownPlatformException(String platformId) {
    super("Unknown platform: " + platformId);
    this.platformId = platformId;
  }

  public String getPlatformId() {
    return platformId;
  }
}
