package courier.client;

/**
 * Hints from the host environment that the network may be usable again.
 */
public enum EnvironmentSignal {
  REACHABILITY_RESTORED,
  FOREGROUND
}
