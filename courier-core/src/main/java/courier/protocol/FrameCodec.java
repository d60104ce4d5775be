package courier.protocol;

import courier.FailureReason;
import courier.Priority;
import courier.util.JsonCodec;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Encodes {@link Frame}s as flat JSON objects discriminated by a {@code type} member.
 * Timestamps travel as epoch milliseconds.
 *
 * <pre>{@code
 * {"type":"deliver","envelopeId":"01J...","event":"notify","payload":"{\"x\":1}",
 *  "requiresAck":true,"priority":"NORMAL","createdAt":1718000000000,"sentAt":1718000000005}
 * {"type":"ack","envelopeId":"01J..."}
 * {"type":"ping","sentAt":1718000000000}
 * }</pre>
 *
 * <p>A {@link Frame.Batch} travels as a JSON array of deliver objects.
 */
public final class FrameCodec {
  private final JsonCodec json;

  public FrameCodec() {
    this(JsonCodec.getDefault());
  }

  public FrameCodec(JsonCodec json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  public String encode(Frame frame) {
    Objects.requireNonNull(frame, "frame");
    if (frame instanceof Frame.Batch batch) {
      List<Map<String, Object>> entries = new ArrayList<>(batch.entries().size());
      for (Frame.Deliver deliver : batch.entries()) {
        entries.add(deliverFields(deliver));
      }
      return json.toJsonArray(entries);
    }
    if (frame instanceof Frame.Deliver d) {
      return json.toJson(deliverFields(d));
    }
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("type", frame.type());
    if (frame instanceof Frame.Ack a) {
      fields.put("envelopeId", a.envelopeId());
    } else if (frame instanceof Frame.Ping p) {
      fields.put("sentAt", p.sentAt().toEpochMilli());
    } else if (frame instanceof Frame.Pong p) {
      fields.put("sentAt", p.sentAt().toEpochMilli());
    } else if (frame instanceof Frame.Resume r) {
      fields.put("since", r.since() == null ? null : r.since().toEpochMilli());
    } else if (frame instanceof Frame.DeliveryFailed f) {
      fields.put("envelopeId", f.envelopeId());
      fields.put("reason", f.reason().name());
    }
    return json.toJson(fields);
  }

  private static Map<String, Object> deliverFields(Frame.Deliver d) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("type", d.type());
    fields.put("envelopeId", d.envelopeId());
    fields.put("event", d.event());
    fields.put("payload", d.payload());
    fields.put("requiresAck", d.requiresAck());
    fields.put("priority", d.priority().name());
    fields.put("createdAt", d.createdAt().toEpochMilli());
    fields.put("sentAt", d.sentAt().toEpochMilli());
    return fields;
  }

  /**
   * Decodes a frame.
   *
   * @throws MalformedFrameException if the text is not a known, well-formed frame
   */
  public Frame decode(String text) {
    if (text != null && text.trim().startsWith("[")) {
      return decodeBatch(text);
    }
    Map<String, String> fields;
    try {
      fields = json.parseObject(text);
    } catch (IllegalArgumentException e) {
      throw new MalformedFrameException("Invalid frame JSON", e);
    }
    String type = required(fields, "type");
    try {
      return switch (type) {
        case "deliver" -> deliver(fields);
        case "ack" -> new Frame.Ack(required(fields, "envelopeId"));
        case "ping" -> new Frame.Ping(instant(required(fields, "sentAt")));
        case "pong" -> new Frame.Pong(instant(required(fields, "sentAt")));
        case "resume" -> new Frame.Resume(fields.containsKey("since") ? instant(fields.get("since")) : null);
        case "delivery_failed" -> new Frame.DeliveryFailed(
            required(fields, "envelopeId"),
            FailureReason.valueOf(required(fields, "reason")));
        default -> throw new MalformedFrameException("Unknown frame type: " + type);
      };
    } catch (IllegalArgumentException e) {
      throw new MalformedFrameException("Invalid " + type + " frame", e);
    }
  }

  private Frame.Batch decodeBatch(String text) {
    List<Map<String, String>> elements;
    try {
      elements = json.parseArray(text);
    } catch (IllegalArgumentException e) {
      throw new MalformedFrameException("Invalid batch JSON", e);
    }
    if (elements.isEmpty()) {
      throw new MalformedFrameException("Empty message_batch frame");
    }
    List<Frame.Deliver> entries = new ArrayList<>(elements.size());
    for (Map<String, String> fields : elements) {
      if (!"deliver".equals(fields.get("type"))) {
        throw new MalformedFrameException("message_batch entries must be deliver frames");
      }
      try {
        entries.add(deliver(fields));
      } catch (IllegalArgumentException e) {
        throw new MalformedFrameException("Invalid message_batch entry", e);
      }
    }
    return new Frame.Batch(entries);
  }

  private static Frame.Deliver deliver(Map<String, String> fields) {
    return new Frame.Deliver(
        required(fields, "envelopeId"),
        required(fields, "event"),
        fields.getOrDefault("payload", ""),
        Boolean.parseBoolean(required(fields, "requiresAck")),
        Priority.valueOf(fields.getOrDefault("priority", Priority.NORMAL.name())),
        instant(required(fields, "createdAt")),
        instant(required(fields, "sentAt")));
  }

  private static String required(Map<String, String> fields, String name) {
    String value = fields.get(name);
    if (value == null) {
      throw new MalformedFrameException("Missing frame member: " + name);
    }
    return value;
  }

  private static Instant instant(String epochMillis) {
    return Instant.ofEpochMilli(Long.parseLong(epochMillis));
  }
}
