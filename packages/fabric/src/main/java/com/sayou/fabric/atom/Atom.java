package com.sayou.fabric.atom;

import com.sayou.fabric.exception.SchemaException;
import com.sayou.fabric.utility.JacksonUtility;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * The standard record exchanged between pipeline stages.
 *
 * <p>An atom is immutable: {@code atomId} and {@code timestamp} are fixed at construction and the
 * payload is copied into an unmodifiable map. The payload shape is determined by {@code type} and
 * is opaque to the core. Stages never edit atoms; they emit new ones (see {@link #derive}).
 *
 * @param source where the record came from (an identifier, a path, a URL)
 * @param type payload discriminator (e.g. {@code raw}, {@code chunk}, {@code node})
 * @param payload type specific content, shallowly immutable
 * @param atomId globally unique identifier
 * @param timestamp creation instant, rendered as RFC 3339 text in records
 */
public record Atom(
    String source, String type, Map<String, Object> payload, UUID atomId, Instant timestamp) {

  public static final String SOURCE = "source";
  public static final String TYPE = "type";
  public static final String PAYLOAD = "payload";
  public static final String ATOM_ID = "atom_id";
  public static final String TIMESTAMP = "timestamp";

  public Atom {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(atomId, "atomId");
    Objects.requireNonNull(timestamp, "timestamp");
    payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
  }

  /** Create a new atom with a fresh id and the current instant. */
  public static Atom create(String source, String type, Map<String, ?> payload) {
    return new Atom(source, type, copy(payload), UUID.randomUUID(), Instant.now());
  }

  /** A new atom from the same source, e.g. the output of a transformation of this one. */
  public Atom derive(String newType, Map<String, ?> newPayload) {
    return create(source, newType, newPayload);
  }

  /**
   * Rebuild an atom from its record form.
   *
   * <p>{@code source}, {@code type} and {@code payload} are mandatory. When {@code atom_id} or
   * {@code timestamp} are absent a fresh value is generated; when present they must parse.
   *
   * @throws SchemaException if a mandatory field is missing or a field is malformed
   */
  public static Atom fromRecord(Map<String, ?> record) {
    if (record == null
        || !record.containsKey(SOURCE)
        || !record.containsKey(TYPE)
        || !record.containsKey(PAYLOAD)) {
      throw new SchemaException(
          "Missing required fields (source, type, payload) in record",
          Map.of("keys", record == null ? "null" : String.valueOf(record.keySet())));
    }
    Object source = record.get(SOURCE);
    Object type = record.get(TYPE);
    Object payload = record.get(PAYLOAD);
    if (source == null || type == null) {
      throw new SchemaException("Fields 'source' and 'type' must not be null");
    }
    if (!(payload instanceof Map<?, ?> payloadMap)) {
      throw new SchemaException(
          "Field 'payload' must be a map but was "
              + (payload == null ? "null" : payload.getClass().getSimpleName()));
    }
    return new Atom(
        source.toString(),
        type.toString(),
        copy(payloadMap),
        parseId(record.get(ATOM_ID)),
        parseTimestamp(record.get(TIMESTAMP)));
  }

  /** Record form: {@code source, type, payload, atom_id, timestamp}; id and time as strings. */
  public Map<String, Object> toRecord() {
    Map<String, Object> record = new LinkedHashMap<>();
    record.put(SOURCE, source);
    record.put(TYPE, type);
    record.put(PAYLOAD, payload);
    record.put(ATOM_ID, atomId.toString());
    record.put(TIMESTAMP, timestamp.toString());
    return record;
  }

  public String toJson() {
    return JacksonUtility.toJson(toRecord());
  }

  public static Atom fromJson(String json) {
    return fromRecord(JacksonUtility.toMap(json));
  }

  /** Payload value as text, or {@code null} when absent. */
  public String payloadText(String key) {
    Object value = payload.get(key);
    return value == null ? null : value.toString();
  }

  public boolean isType(String candidate) {
    return type.equals(candidate);
  }

  private static UUID parseId(Object value) {
    if (value == null) return UUID.randomUUID();
    if (value instanceof UUID uuid) return uuid;
    try {
      return UUID.fromString(value.toString());
    } catch (IllegalArgumentException e) {
      throw new SchemaException("Field 'atom_id' is not a UUID: " + value, e);
    }
  }

  private static Instant parseTimestamp(Object value) {
    if (value == null) return Instant.now();
    if (value instanceof Instant instant) return instant;
    try {
      return OffsetDateTime.parse(value.toString()).toInstant();
    } catch (DateTimeParseException e) {
      throw new SchemaException("Field 'timestamp' is not an RFC 3339 date-time: " + value, e);
    }
  }

  private static Map<String, Object> copy(Map<?, ?> input) {
    Map<String, Object> m = new LinkedHashMap<>();
    if (input != null) input.forEach((k, v) -> m.put(String.valueOf(k), v));
    return m;
  }
}
