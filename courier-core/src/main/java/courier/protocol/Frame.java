package courier.protocol;

import courier.Envelope;
import courier.FailureReason;
import courier.Priority;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Logical protocol frames exchanged over a connection. Byte framing belongs to the
 * transport; {@link FrameCodec} maps frames to flat JSON objects.
 */
public sealed interface Frame
    permits Frame.Deliver, Frame.Batch, Frame.Ack, Frame.Ping, Frame.Pong, Frame.Resume,
    Frame.DeliveryFailed {

  /** Wire value of the {@code type} member. */
  String type();

  /** Server to client: one envelope. */
  record Deliver(String envelopeId, String event, String payload, boolean requiresAck,
      Priority priority, Instant createdAt, Instant sentAt) implements Frame {
    public Deliver {
      Objects.requireNonNull(envelopeId, "envelopeId");
      Objects.requireNonNull(event, "event");
      Objects.requireNonNull(payload, "payload");
      Objects.requireNonNull(priority, "priority");
      Objects.requireNonNull(createdAt, "createdAt");
      Objects.requireNonNull(sentAt, "sentAt");
    }

    public static Deliver of(Envelope envelope, Instant sentAt) {
      return new Deliver(envelope.envelopeId(), envelope.event(), envelope.payload(),
          envelope.requiresAck(), envelope.priority(), envelope.createdAt(), sentAt);
    }

    @Override
    public String type() {
      return "deliver";
    }
  }

  /**
   * Server to client: several envelopes in one frame, in send order. Each entry is acked
   * on its own.
   */
  record Batch(List<Deliver> entries) implements Frame {
    public Batch {
      entries = List.copyOf(Objects.requireNonNull(entries, "entries"));
      if (entries.isEmpty()) {
        throw new IllegalArgumentException("entries must not be empty");
      }
    }

    @Override
    public String type() {
      return "message_batch";
    }
  }

  /** Client to server: receipt of a deliver frame. */
  record Ack(String envelopeId) implements Frame {
    public Ack {
      Objects.requireNonNull(envelopeId, "envelopeId");
    }

    @Override
    public String type() {
      return "ack";
    }
  }

  /** Liveness probe, sent by either side. */
  record Ping(Instant sentAt) implements Frame {
    public Ping {
      Objects.requireNonNull(sentAt, "sentAt");
    }

    @Override
    public String type() {
      return "ping";
    }
  }

  /** Liveness response echoing the probe timestamp. */
  record Pong(Instant sentAt) implements Frame {
    public Pong {
      Objects.requireNonNull(sentAt, "sentAt");
    }

    @Override
    public String type() {
      return "pong";
    }
  }

  /**
   * Client to server after (re)connecting: replay anything queued after {@code since}.
   * A {@code null} timestamp asks for the whole queue.
   */
  record Resume(Instant since) implements Frame {
    @Override
    public String type() {
      return "resume";
    }
  }

  /** Server to client: an envelope addressed to this connection was terminally failed. */
  record DeliveryFailed(String envelopeId, FailureReason reason) implements Frame {
    public DeliveryFailed {
      Objects.requireNonNull(envelopeId, "envelopeId");
      Objects.requireNonNull(reason, "reason");
    }

    @Override
    public String type() {
      return "delivery_failed";
    }
  }
}
