package com.gentoro.graphguard.http;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import okhttp3.Headers;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InterceptorsTest {

  private MockWebServer server;

  @BeforeEach
  void setUp() throws IOException {
    server = new MockWebServer();
    server.start();
  }

  @AfterEach
  void tearDown() throws IOException {
    server.shutdown();
  }

  private String authorizationSent(String apiKey, Request request) throws Exception {
    OkHttpClient client =
        new OkHttpClient.Builder()
            .addInterceptor(new ApiKeyInterceptor(apiKey))
            .addInterceptor(new LoggingInterceptor())
            .build();
    server.enqueue(new MockResponse().setBody("[]"));
    try (Response ignored = client.newCall(request).execute()) {
      return server.takeRequest().getHeader("Authorization");
    }
  }

  @Test
  void addsApiKeyHeader() throws Exception {
    Request request = new Request.Builder().url(server.url("/x")).build();
    assertEquals("Api-Key k-123", authorizationSent("k-123", request));
  }

  @Test
  void keepsExplicitAuthorization() throws Exception {
    Request request =
        new Request.Builder().url(server.url("/x")).header("Authorization", "Bearer t").build();
    assertEquals("Bearer t", authorizationSent("k-123", request));
  }

  @Test
  void sendsNothingWithoutKey() throws Exception {
    Request request = new Request.Builder().url(server.url("/x")).build();
    assertNull(authorizationSent(null, request));
  }

  @Test
  void redactsAuthorizationInLogs() {
    String logged =
        LoggingInterceptor.redact(
            Headers.of("Authorization", "Api-Key k-123", "Accept", "application/json"));
    assertFalse(logged.contains("k-123"));
    assertTrue(logged.contains("Authorization: <redacted>"));
    assertTrue(logged.contains("Accept: application/json"));
  }
}
