package com.example.platformauth.adapter.backend.client;

import com.example.platformauth.adapter.backend.dto.SyncAcknowledgement;
import com.example.platformauth.adapter.backend.dto.SyncPayload;
import com.example.platformauth.exception.SyncNetworkException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * HTTP client of the session store's network sync endpoint.
 */
@Slf4j
public class SessionSyncClient {

  public static final String SYNC_PATH = "api/sync/cookies";
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final OkHttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final HttpUrl syncUrl;
  private final String tokenHeader;
  private final String token;

  public SessionSyncClient(OkHttpClient httpClient, ObjectMapper objectMapper, String backendUrl,
                           String tokenHeader, String token) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    HttpUrl base = HttpUrl.parse(backendUrl);
    if (base == null) {
      throw new IllegalArgumentException("Invalid backend URL: " + backendUrl);
    }
    this.syncUrl = base.resolve(SYNC_PATH);
    this.tokenHeader = tokenHeader;
    this.token = token;
  }

  /**
   * Posts one cookie bundle.
   *
   * @throws SyncNetworkException on transport failure or any non-2xx response
   */
  public SyncAcknowledgement push(SyncPayload payload) {
    String body;
    try {
      body = objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      throw new SyncNetworkException("Failed to serialize sync payload", e);
    }

    Request.Builder request = new Request.Builder()
        .url(syncUrl)
        .post(RequestBody.create(body, JSON));
    if (token != null && !token.isBlank()) {
      request.header(tokenHeader, token);
    }

    try (Response response = httpClient.newCall(request.build()).execute()) {
      if (!response.isSuccessful()) {
        throw new SyncNetworkException(
            "Sync of " + payload.platform() + " rejected with HTTP " + response.code(), response.code());
      }
      ResponseBody responseBody = response.body();
      if (responseBody == null) {
        return new SyncAcknowledgement(true, payload.platform(), null, true);
      }
      return objectMapper.readValue(responseBody.string(), SyncAcknowledgement.class);
    } catch (IOException e) {
      throw new SyncNetworkException("Sync of " + payload.platform() + " failed: " + e.getMessage(), e);
    }
  }
}
