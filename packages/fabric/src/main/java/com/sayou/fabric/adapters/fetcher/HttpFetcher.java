package com.sayou.fabric.adapters.fetcher;

import com.sayou.fabric.component.AbstractFetcher;
import com.sayou.fabric.component.ComponentOptions;
import com.sayou.fabric.component.RawPayload;
import com.sayou.fabric.exception.FetcherException;
import com.sayou.fabric.exception.NetworkException;
import com.sayou.fabric.http.OkHttpFactory;
import com.sayou.fabric.resilience.CallContext;
import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Fetches {@code http} and {@code https} identifiers with OkHttp.
 *
 * <p>Options:
 *
 * <ul>
 *   <li>{@code headers} (map): extra request headers
 *   <li>{@code user_agent} (string)
 *   <li>{@code connect_timeout_ms} (default 10000), {@code read_timeout_ms} (default 20000)
 * </ul>
 *
 * <p>The advisory call timeout of the current retry attempt, when present, bounds the whole
 * call. Server errors, 408 and 429 are reported as retryable; other 4xx statuses are not. A 204
 * or 404 response yields an empty payload.
 */
public class HttpFetcher extends AbstractFetcher {
  private static final org.slf4j.Logger log =
      com.sayou.fabric.logging.LoggingService.getLogger(HttpFetcher.class);

  public static final String NAME = "http";

  private OkHttpClient client;

  public HttpFetcher() {
    super(NAME);
  }

  @Override
  protected void onInitialize(ComponentOptions options) {
    client =
        OkHttpFactory.create(
            Duration.ofMillis(options.getLong("connect_timeout_ms", 10_000L)),
            Duration.ofMillis(options.getLong("read_timeout_ms", 20_000L)),
            options.getString("user_agent"),
            options.getStringMap("headers"));
  }

  @Override
  protected void validate(String identifier) {
    super.validate(identifier);
    if (HttpUrl.parse(identifier.trim()) == null) {
      throw new IllegalArgumentException("not an http(s) URL: " + identifier);
    }
  }

  @Override
  protected RawPayload doFetch(String identifier) {
    Request request = new Request.Builder().url(identifier.trim()).get().build();
    Call call = client.newCall(request);
    CallContext.current()
        .map(CallContext::callTimeout)
        .ifPresent(timeout -> call.timeout().timeout(timeout.toMillis(), TimeUnit.MILLISECONDS));

    try (Response response = call.execute()) {
      int code = response.code();
      if (code == 204 || code == 404) {
        log.debug("{} returned {}; nothing to fetch", identifier, code);
        return RawPayload.empty(identifier);
      }
      if (code >= 500 || code == 408 || code == 429) {
        throw new NetworkException("HTTP %d from %s".formatted(code, identifier));
      }
      if (!response.isSuccessful()) {
        throw new FetcherException("HTTP %d from %s".formatted(code, identifier), null, false);
      }

      ResponseBody body = response.body();
      String content = body == null ? "" : body.string();
      Map<String, Object> metadata = new LinkedHashMap<>();
      metadata.put("status", code);
      metadata.put("url", response.request().url().toString());
      String contentType = response.header("Content-Type");
      if (contentType != null) metadata.put("content_type", contentType);
      return new RawPayload(identifier, MediaTypes.strip(contentType), content, metadata);
    } catch (IOException e) {
      throw new NetworkException("Failed to fetch " + identifier, e);
    }
  }

  @Override
  protected void onClose() {
    if (client != null) {
      client.dispatcher().executorService().shutdown();
      client.connectionPool().evictAll();
    }
  }
}
