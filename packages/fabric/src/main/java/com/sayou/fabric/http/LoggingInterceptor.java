package com.sayou.fabric.http;

import java.io.IOException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;

public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.sayou.fabric.logging.LoggingService.getLogger(LoggingInterceptor.class);

  private static final long MAX_LOGGED_BODY = 4096;

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();
    long startTime = System.nanoTime();
    log.debug("Sending {} {}\nHeaders:\n{}", request.method(), request.url(), request.headers());

    Response response;
    try {
      response = chain.proceed(request);
    } catch (IOException e) {
      log.debug(
          "{} {} failed after {} ms: {}",
          request.method(),
          request.url(),
          String.format("%.1f", (System.nanoTime() - startTime) / 1e6d),
          e.toString());
      throw e;
    }

    log.debug(
        "Received {} for {} in {} ms\nHeaders:\n{}",
        response.code(),
        response.request().url(),
        String.format("%.1f", (System.nanoTime() - startTime) / 1e6d),
        response.headers());
    if (log.isTraceEnabled()) {
      log.trace("Response body (truncated):\n{}", response.peekBody(MAX_LOGGED_BODY).string());
    }
    return response;
  }
}
