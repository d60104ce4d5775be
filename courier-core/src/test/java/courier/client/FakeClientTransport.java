package courier.client;

import courier.protocol.Frame;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/** Scriptable client transport; every {@link #open} is one session. */
final class FakeClientTransport implements ClientTransport {
  boolean openSucceeds = true;
  boolean stallSends;
  int closes;
  final List<Listener> sessions = new ArrayList<>();
  private final List<Frame> sent = new ArrayList<>();

  @Override
  public CompletableFuture<Void> open(Listener listener) {
    sessions.add(listener);
    return openSucceeds
        ? CompletableFuture.completedFuture(null)
        : CompletableFuture.failedFuture(new IOException("connection refused"));
  }

  @Override
  public CompletableFuture<Void> send(Frame frame) {
    if (stallSends) {
      return new CompletableFuture<>();
    }
    sent.add(frame);
    return CompletableFuture.completedFuture(null);
  }

  @Override
  public void close() {
    closes++;
  }

  Listener session() {
    return sessions.get(sessions.size() - 1);
  }

  int opens() {
    return sessions.size();
  }

  List<Frame> sent() {
    return List.copyOf(sent);
  }

  <T extends Frame> List<T> sent(Class<T> type) {
    List<T> result = new ArrayList<>();
    for (Frame frame : sent) {
      if (type.isInstance(frame)) {
        result.add(type.cast(frame));
      }
    }
    return result;
  }
}
