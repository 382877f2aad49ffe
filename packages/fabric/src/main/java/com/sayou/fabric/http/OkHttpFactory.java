package com.sayou.fabric.http;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;

/** Builds the OkHttp clients used by HTTP adapters. */
public class OkHttpFactory {
  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
  public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(20);

  public static OkHttpClient create(
      Duration connectTimeout,
      Duration readTimeout,
      String userAgent,
      Map<String, String> headers) {
    Duration connect = connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout;
    Duration read = readTimeout == null ? DEFAULT_READ_TIMEOUT : readTimeout;
    return new OkHttpClient.Builder()
        .connectTimeout(connect.toMillis(), TimeUnit.MILLISECONDS)
        .readTimeout(read.toMillis(), TimeUnit.MILLISECONDS)
        .followRedirects(true)
        .addInterceptor(new DefaultHeadersInterceptor(userAgent, headers))
        .addInterceptor(new LoggingInterceptor())
        .build();
  }

  public static OkHttpClient create() {
    return create(null, null, null, Map.of());
  }
}
