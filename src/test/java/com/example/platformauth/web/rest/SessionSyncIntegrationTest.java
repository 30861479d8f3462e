package com.example.platformauth.web.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.platformauth.adapter.backend.client.SessionSyncClient;
import com.example.platformauth.adapter.backend.dto.SyncAcknowledgement;
import com.example.platformauth.adapter.backend.dto.SyncPayload;
import com.example.platformauth.exception.SyncNetworkException;
import com.example.platformauth.service.SessionStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@Import(TestBrowserConfig.class)
class SessionSyncIntegrationTest {

  private static final String TOKEN_HEADER = "X-Sync-Token";
  private static final String TOKEN = "test-sync-secret";

  @LocalServerPort
  int port;

  @Autowired
  ObjectMapper objectMapper;

  @Autowired
  SessionStore sessionStore;

  private final HttpClient httpClient = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();

  @BeforeEach
  void setUp() {
    sessionStore.deleteAll();
  }

  @Test
  void sync_storesSessionVisibleToStatusAndCookieReads() throws Exception {
    HttpResponse<String> sync = postSync(
        "{\"platform\":\"leetcode\",\"cookies\":\"LEETCODE_SESSION=abc; csrftoken=xyz\",\"timestamp\":%d}"
            .formatted(System.currentTimeMillis()), TOKEN);

    assertThat(sync.statusCode()).isEqualTo(200);
    JsonNode body = objectMapper.readTree(sync.body());
    assertThat(body.get("success").asBoolean()).isTrue();
    assertThat(body.get("applied").asBoolean()).isTrue();
    assertThat(body.get("platform").asText()).isEqualTo("leetcode");

    JsonNode status = objectMapper.readTree(get("/api/platforms/leetcode/status").body());
    assertThat(status.get("authenticated").asBoolean()).isTrue();
    assertThat(status.get("timestamp").asLong()).isEqualTo(body.get("capturedAt").asLong());

    JsonNode cookies = objectMapper.readTree(get("/api/platforms/leetcode/cookies").body());
    assertThat(cookies.get("cookies").asText()).isEqualTo("LEETCODE_SESSION=abc; csrftoken=xyz");
  }

  @Test
  void sync_olderBundleIsAcknowledgedButNotApplied() throws Exception {
    long now = System.currentTimeMillis();
    postSync("{\"platform\":\"coderpad\",\"cookies\":\"new=1\",\"timestamp\":%d}".formatted(now), TOKEN);

    HttpResponse<String> stale = postSync(
        "{\"platform\":\"coderpad\",\"cookies\":\"old=1\",\"timestamp\":%d}".formatted(now - 60_000), TOKEN);

    assertThat(stale.statusCode()).isEqualTo(200);
    JsonNode body = objectMapper.readTree(stale.body());
    assertThat(body.get("applied").asBoolean()).isFalse();
    assertThat(body.get("capturedAt").asLong()).isEqualTo(now);
    assertThat(objectMapper.readTree(get("/api/platforms/coderpad/cookies").body()).get("cookies").asText())
        .isEqualTo("new=1");
  }

  @Test
  void sync_withoutTimestampUsesReceiveTime() throws Exception {
    long before = System.currentTimeMillis();

    HttpResponse<String> response = postSync("{\"platform\":\"glider\",\"cookies\":\"session=1\"}", TOKEN);

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(objectMapper.readTree(response.body()).get("capturedAt").asLong()).isGreaterThanOrEqualTo(before);
  }

  @Test
  void sync_missingOrWrongTokenIsUnauthorized() throws Exception {
    String body = "{\"platform\":\"leetcode\",\"cookies\":\"a=1\"}";

    HttpResponse<String> missing = postSync(body, null);
    HttpResponse<String> wrong = postSync(body, "guess");

    assertThat(missing.statusCode()).isEqualTo(401);
    assertThat(objectMapper.readTree(missing.body()).get("error").asText()).isEqualTo("not_authenticated");
    assertThat(wrong.statusCode()).isEqualTo(401);
    assertThat(get("/api/platforms/leetcode/cookies").statusCode()).isEqualTo(204);
  }

  @Test
  void sync_missingFieldsAreRejected() throws Exception {
    HttpResponse<String> response = postSync("{\"platform\":\"leetcode\",\"cookies\":\"\"}", TOKEN);

    assertThat(response.statusCode()).isEqualTo(400);
    JsonNode body = objectMapper.readTree(response.body());
    assertThat(body.get("error").asText()).isEqualTo("validation_error");
    assertThat(body.get("message").asText()).contains("cookies are required");
  }

  @Test
  void sync_unknownPlatformIsRejected() throws Exception {
    HttpResponse<String> response = postSync("{\"platform\":\"myspace\",\"cookies\":\"a=1\"}", TOKEN);

    assertThat(response.statusCode()).isEqualTo(400);
    JsonNode body = objectMapper.readTree(response.body());
    assertThat(body.get("error").asText()).isEqualTo("unknown_platform");
    assertThat(body.get("message").asText()).isEqualTo("Unknown platform: myspace");
  }

  @Test
  void sync_malformedJsonIsRejected() throws Exception {
    HttpResponse<String> response = postSync("{\"platform\":", TOKEN);

    assertThat(response.statusCode()).isEqualTo(400);
    assertThat(objectMapper.readTree(response.body()).get("error").asText()).isEqualTo("invalid_request");
  }

  @Test
  void bridgeClient_deliversBundleToStore() {
    long capturedAt = System.currentTimeMillis() - 5_000;
    SessionSyncClient client = new SessionSyncClient(
        new OkHttpClient(), objectMapper, "http://localhost:" + port, TOKEN_HEADER, TOKEN);

    SyncAcknowledgement ack = client.push(new SyncPayload("lark", "biz_token=t", capturedAt));

    assertThat(ack.success()).isTrue();
    assertThat(ack.applied()).isTrue();
    assertThat(ack.capturedAt()).isEqualTo(capturedAt);
    assertThat(sessionStore.load("lark")).isPresent();
  }

  @Test
  void bridgeClient_rejectedTokenSurfacesStatus() {
    SessionSyncClient client = new SessionSyncClient(
        new OkHttpClient(), objectMapper, "http://localhost:" + port, TOKEN_HEADER, "guess");

    assertThatThrownBy(() -> client.push(new SyncPayload("lark", "biz_token=t", 1_000L)))
        .isInstanceOf(SyncNetworkException.class)
        .extracting(e -> ((SyncNetworkException) e).getStatusCode())
        .isEqualTo(401);
  }

  private HttpResponse<String> postSync(String json, String token) throws IOException, InterruptedException {
    HttpRequest.Builder request = HttpRequest.newBuilder(uri("/api/sync/cookies"))
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(json));
    if (token != null) {
      request.header(TOKEN_HEADER, token);
    }
    return httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
  }

  private HttpResponse<String> get(String path) throws IOException, InterruptedException {
    return httpClient.send(HttpRequest.newBuilder(uri(path)).GET().build(), HttpResponse.BodyHandlers.ofString());
  }

  private URI uri(String path) {
    return URI.create("http://localhost:" + port + path);
  }
}
