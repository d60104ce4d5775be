package courier;

import java.util.Objects;

/**
 * Addressee of an emit: one specific connection, or every live connection of a principal.
 *
 * @param kind the addressing mode
 * @param id   connection-id or principal-id depending on {@code kind}
 */
public record DeliveryTarget(Kind kind, String id) {

  public enum Kind {
    CONNECTION,
    PRINCIPAL
  }

  public DeliveryTarget {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(id, "id");
    if (id.isEmpty()) {
      throw new IllegalArgumentException("id cannot be empty");
    }
  }

  public static DeliveryTarget connection(String connectionId) {
    return new DeliveryTarget(Kind.CONNECTION, connectionId);
  }

  public static DeliveryTarget principal(String principalId) {
    return new DeliveryTarget(Kind.PRINCIPAL, principalId);
  }
}
