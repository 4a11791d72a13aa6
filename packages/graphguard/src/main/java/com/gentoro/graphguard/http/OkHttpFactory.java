package com.gentoro.graphguard.http;

import com.gentoro.graphguard.config.GraphGuardSettings;
import okhttp3.OkHttpClient;

public class OkHttpFactory {

  public static OkHttpClient create(GraphGuardSettings settings) {
    return new OkHttpClient.Builder()
        .connectTimeout(settings.connectTimeout())
        .readTimeout(settings.readTimeout())
        .callTimeout(settings.callTimeout())
        // Retries are decided by RetryPolicy, not by the transport
        .retryOnConnectionFailure(false)
        .addInterceptor(new ApiKeyInterceptor(settings.apiKey()))
        .addInterceptor(new LoggingInterceptor())
        .build();
  }
}
