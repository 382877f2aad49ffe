package com.sayou.fabric.component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * What a fetcher returns for one identifier.
 *
 * @param identifier the identifier that was fetched
 * @param mediaType MIME type when known (e.g. {@code text/html}), otherwise {@code null}
 * @param content text, bytes or structured content; {@code null} when there was nothing to fetch
 * @param metadata fetch metadata such as the HTTP status or the file size
 */
public record RawPayload(
    String identifier, String mediaType, Object content, Map<String, Object> metadata) {

  public RawPayload {
    Objects.requireNonNull(identifier, "identifier");
    metadata =
        metadata == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public static RawPayload of(String identifier, String mediaType, Object content) {
    return new RawPayload(identifier, mediaType, content, null);
  }

  public static RawPayload empty(String identifier) {
    return new RawPayload(identifier, null, null, null);
  }

  public boolean isEmpty() {
    return content == null
        || (content instanceof CharSequence cs && cs.length() == 0)
        || (content instanceof byte[] bytes && bytes.length == 0);
  }

  /** Content as text; bytes are decoded as UTF-8. */
  public String text() {
    if (content == null) return "";
    if (content instanceof byte[] bytes) {
      return new String(bytes, java.nio.charset.StandardCharsets.UTF_8);
    }
    return content.toString();
  }
}
