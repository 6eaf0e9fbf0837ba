package io.treematch.examples;

import static java.util.Objects.requireNonNull;

/**
 * A pair of documents together with the expected verdict of loosely matching them.
 *
 * @param lhs name of the left document
 * @param rhs name of the right document
 * @param expectedEquivalency {@code true} if both documents are expected to match
 */
public record MatchCase(String lhs, String rhs, boolean expectedEquivalency) {

  public MatchCase {
    requireNonNull(lhs);
    requireNonNull(rhs);
  }

  /**
   * Describe the case the way the suite prints it, for example {@code [1.xml] == [2.xml]}.
   *
   * @return the description
   */
  public String describe() {
    return "[" + lhs + "] " + (expectedEquivalency ? "==" : "!=") + " [" + rhs + "]";
  }
}
