package com.gentoro.graphguard.http;

import java.io.IOException;
import okhttp3.Headers;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;
import org.jetbrains.annotations.NotNull;

public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.graphguard.logging.LoggingService.getLogger(LoggingInterceptor.class);

  private static final long MAX_LOGGED_BODY = 64 * 1024;

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();

    long startTime = System.nanoTime();
    if (log.isDebugEnabled()) {
      log.debug(
          "Sending {} {}\nHeaders:\n{}\nBody:\n{}",
          request.method(),
          request.url(),
          redact(request.headers()),
          bodyToString(request));
    }

    Response response = chain.proceed(request);

    long endTime = System.nanoTime();
    log.debug(
        "Received response for {} {} in {} ms, status {}",
        request.method(),
        response.request().url(),
        String.format("%.1f", (endTime - startTime) / 1e6d),
        response.code());

    if (log.isTraceEnabled()) {
      ResponseBody responseBody = response.peekBody(MAX_LOGGED_BODY);
      log.trace("Response body:\n{}", responseBody.string());
    }
    return response;
  }

  static String redact(Headers headers) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < headers.size(); i++) {
      String name = headers.name(i);
      String value = "Authorization".equalsIgnoreCase(name) ? "<redacted>" : headers.value(i);
      sb.append(name).append(": ").append(value).append('\n');
    }
    return sb.toString();
  }

  private static String bodyToString(Request request) {
    try {
      Request copy = request.newBuilder().build();
      Buffer buffer = new Buffer();
      if (copy.body() != null) copy.body().writeTo(buffer);
      return buffer.readUtf8();
    } catch (IOException e) {
      return "(error reading body)";
    }
  }
}
