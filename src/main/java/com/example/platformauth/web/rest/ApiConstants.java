package com.example.platformauth.web.rest;

public final class ApiConstants {

  public static final class ApiPath {
    // Base paths
    public static final String API_BASE = "/api";
    public static final String HEALTH_BASE = "/health";
    public static final String BRIDGE_BASE = "/bridge";

    // Platform paths
    public static final String PLATFORMS = "/platforms";
    public static final String PLATFORM_ID = "/{platformId}";
    public static final String STATUS = "/status";
    public static final String COOKIES = "/cookies";
    public static final String LOGIN = "/login";
    public static final String SESSION = "/session";
    public static final String SESSIONS = "/sessions";
    public static final String LOGINS = "/logins";

    // Sync paths
    public static final String SYNC = "/sync";

    // Bridge paths
    public static final String PENDING = "/pending";

    // Health paths
    public static final String LIVE = "/live";
    public static final String READY = "/ready";

    private ApiPath() {}
  }

  private ApiConstants() {}
}
