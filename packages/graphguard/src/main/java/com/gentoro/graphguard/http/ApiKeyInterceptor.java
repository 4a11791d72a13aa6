package com.gentoro.graphguard.http;

import java.io.IOException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;

/** Adds the Zep {@code Authorization: Api-Key <key>} header to every outgoing request. */
public class ApiKeyInterceptor implements Interceptor {
  private final String apiKey;

  public ApiKeyInterceptor(String apiKey) {
    this.apiKey = apiKey;
  }

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request original = chain.request();
    if (apiKey == null || apiKey.isBlank() || original.header("Authorization") != null) {
      return chain.proceed(original);
    }
    Request authorized =
        original.newBuilder().header("Authorization", "Api-Key " + apiKey).build();
    return chain.proceed(authorized);
  }
}
