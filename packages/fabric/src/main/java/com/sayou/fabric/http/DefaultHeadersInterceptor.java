package com.sayou.fabric.http;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;

/** Adds the configured user agent and headers to requests that do not set them already. */
public class DefaultHeadersInterceptor implements Interceptor {
  public static final String DEFAULT_USER_AGENT = "sayou-fabric/1.0";

  private final Map<String, String> headers = new LinkedHashMap<>();

  public DefaultHeadersInterceptor(String userAgent, Map<String, String> headers) {
    if (headers != null) this.headers.putAll(headers);
    this.headers.putIfAbsent(
        "User-Agent", userAgent == null || userAgent.isBlank() ? DEFAULT_USER_AGENT : userAgent);
  }

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request original = chain.request();
    Request.Builder builder = original.newBuilder();
    headers.forEach(
        (name, value) -> {
          if (original.header(name) == null) builder.header(name, value);
        });
    return chain.proceed(builder.build());
  }
}
