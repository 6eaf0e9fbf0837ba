package io.treematch.access;

/**
 * How are equal keys of two documents interpreted?
 */
public enum CollisionPolicy {
  /** Equal keys are a match. Fast, with a tiny chance of a false positive. */
  TRUST_KEYS,
  /**
   * Equal keys are confirmed by an exact, order-insensitive structural comparison of both trees.
   */
  VERIFY_STRUCTURE;

  public static CollisionPolicy fromString(final String string) {
    for (final CollisionPolicy policy : values()) {
      if (policy.name().equalsIgnoreCase(string)) {
        return policy;
      }
    }
    throw new IllegalArgumentException("No constant with name " + string + " found");
  }
}
