package courier;

import courier.protocol.Frame;
import courier.spi.TransportHandle;

import java.util.ArrayList;
import java.util.List;

/** Server-side transport handle that records frames. */
public final class RecordingTransport implements TransportHandle {
  private final List<Frame> frames = new ArrayList<>();
  private boolean accepting = true;
  private String closedReason;

  @Override
  public synchronized boolean send(Frame frame) {
    if (!accepting) {
      return false;
    }
    frames.add(frame);
    return true;
  }

  @Override
  public synchronized void close(String reason) {
    closedReason = reason;
  }

  public synchronized List<Frame> frames() {
    return List.copyOf(frames);
  }

  public synchronized <T extends Frame> List<T> frames(Class<T> type) {
    List<T> result = new ArrayList<>();
    for (Frame frame : frames) {
      if (type.isInstance(frame)) {
        result.add(type.cast(frame));
      }
    }
    return result;
  }

  public synchronized List<String> deliveredIds() {
    List<String> ids = new ArrayList<>();
    for (Frame frame : frames) {
      if (frame instanceof Frame.Deliver) {
        ids.add(((Frame.Deliver) frame).envelopeId());
      } else if (frame instanceof Frame.Batch) {
        for (Frame.Deliver deliver : ((Frame.Batch) frame).entries()) {
          ids.add(deliver.envelopeId());
        }
      }
    }
    return ids;
  }

  public synchronized void clear() {
    frames.clear();
  }

  public synchronized void setAccepting(boolean accepting) {
    this.accepting = accepting;
  }

  public synchronized String closedReason() {
    return closedReason;
  }
}
