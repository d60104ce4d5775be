package courier.queue;

import courier.Envelope;
import courier.Priority;
import courier.util.JsonCodec;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Serializes envelopes for the durable side-store as flat JSON objects.
 */
public final class EnvelopeCodec {
  private final JsonCodec json;

  public EnvelopeCodec() {
    this(JsonCodec.getDefault());
  }

  public EnvelopeCodec(JsonCodec json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  public String encode(Envelope envelope) {
    return json.toJson(fields(envelope));
  }

  /**
   * Encodes an in-flight copy tagged with the connection holding it, so that removing it
   * leaves copies held by the principal's other connections untouched.
   */
  public String encodeInFlight(Envelope envelope, String connectionId) {
    Map<String, Object> fields = fields(envelope);
    fields.put("connectionId", connectionId);
    return json.toJson(fields);
  }

  private static Map<String, Object> fields(Envelope envelope) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("envelopeId", envelope.envelopeId());
    fields.put("event", envelope.event());
    fields.put("payload", envelope.payload());
    fields.put("priority", envelope.priority().name());
    fields.put("createdAt", envelope.createdAt().toEpochMilli());
    fields.put("expiresAt", envelope.expiresAt().toEpochMilli());
    fields.put("requiresAck", envelope.requiresAck());
    fields.put("retryCount", envelope.retryCount());
    fields.put("maxRetries", envelope.maxRetries());
    fields.put("principalId", envelope.principalId());
    return fields;
  }

  /**
   * @throws IllegalArgumentException if the value is not an encoded envelope
   */
  public Envelope decode(String value) {
    Map<String, String> fields = json.parseObject(value);
    return Envelope.builder(required(fields, "event"))
        .envelopeId(required(fields, "envelopeId"))
        .payload(fields.getOrDefault("payload", ""))
        .priority(Priority.valueOf(fields.getOrDefault("priority", Priority.NORMAL.name())))
        .createdAt(Instant.ofEpochMilli(Long.parseLong(required(fields, "createdAt"))))
        .expiresAt(Instant.ofEpochMilli(Long.parseLong(required(fields, "expiresAt"))))
        .requiresAck(Boolean.parseBoolean(required(fields, "requiresAck")))
        .retryCount(Integer.parseInt(fields.getOrDefault("retryCount", "0")))
        .maxRetries(Integer.parseInt(required(fields, "maxRetries")))
        .principalId(fields.get("principalId"))
        .build();
  }

  /**
   * Extracts the envelope id without building the envelope, or {@code null} if the value
   * cannot be parsed.
   */
  public String envelopeIdOf(String value) {
    return field(value, "envelopeId");
  }

  /**
   * Extracts the connection tag of an in-flight copy, or {@code null}.
   */
  public String connectionIdOf(String value) {
    return field(value, "connectionId");
  }

  private String field(String value, String name) {
    try {
      return json.parseObject(value).get(name);
    } catch (IllegalArgumentException e) {
      return null;
    }
  }

  private static String required(Map<String, String> fields, String name) {
    String value = fields.get(name);
    if (value == null) {
      throw new IllegalArgumentException("Missing envelope field: " + name);
    }
    return value;
  }
}
