package io.treematch.access;

import io.treematch.api.DocumentView;
import io.treematch.api.NodeView;
import io.treematch.key.Keys;
import io.treematch.key.NodeKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Decides whether two documents are structurally equivalent up to the order of attributes and the
 * order of sibling elements.
 *
 * <p>
 * The decision compares the {@link NodeKeys#nodeKey(NodeView) keys} of both document elements.
 * Different keys prove that the documents differ. Equal keys only mean that the documents are
 * <em>probably</em> equivalent: two different trees may fold to the same 64 bit key. Besides random
 * collisions of the text hash, the loose combination cancels pairs of identical siblings, so
 * {@code <r/>} and {@code <r><x/><x/></r>} share a key. Callers which can not accept such false
 * positives configure {@link CollisionPolicy#VERIFY_STRUCTURE}, which confirms equal keys with an
 * exact comparison.
 * </p>
 *
 * <p>
 * A matcher holds no mutable state and may be used from any number of threads concurrently.
 * </p>
 */
public final class DocumentMatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(DocumentMatcher.class);

  /** The configuration. */
  private final MatcherConfiguration config;

  /** Computes the node keys. */
  private final NodeKeys nodeKeys;

  /** Confirms equal keys, if configured. */
  private final StructuralVerifier verifier;

  /**
   * Constructor.
   *
   * @param config the configuration
   */
  public DocumentMatcher(final MatcherConfiguration config) {
    this.config = requireNonNull(config);
    nodeKeys = new NodeKeys(config.textHashType);
    verifier = new StructuralVerifier(nodeKeys);
  }

  /**
   * Get a matcher with the default configuration.
   *
   * @return a new matcher
   */
  public static DocumentMatcher withDefaults() {
    return new DocumentMatcher(MatcherConfiguration.defaults());
  }

  /**
   * Compute the key of a document, that is the key of its document element.
   *
   * @param document the document
   * @return the document key
   */
  public long computeKey(final DocumentView document) {
    return nodeKeys.nodeKey(requireNonNull(document.getRoot()));
  }

  /**
   * Match two documents loosely.
   *
   * @param lhs the left document
   * @param rhs the right document
   * @return {@code true} if the documents are (probably, see above) equivalent, {@code false} if they
   *         differ
   */
  public boolean matchLoosely(final DocumentView lhs, final DocumentView rhs) {
    final NodeView lhsRoot = requireNonNull(requireNonNull(lhs).getRoot());
    final NodeView rhsRoot = requireNonNull(requireNonNull(rhs).getRoot());

    final long lhsKey = nodeKeys.nodeKey(lhsRoot);
    final long rhsKey = nodeKeys.nodeKey(rhsRoot);

    LOGGER.debug("Document keys: {} / {}", Keys.toHexString(lhsKey), Keys.toHexString(rhsKey));

    if (lhsKey != rhsKey) {
      return false;
    }

    return switch (config.collisionPolicy) {
      case TRUST_KEYS -> true;
      case VERIFY_STRUCTURE -> verify(lhsRoot, rhsRoot, lhsKey);
    };
  }

  private boolean verify(final NodeView lhsRoot, final NodeView rhsRoot, final long key) {
    final boolean equivalent = verifier.equivalent(lhsRoot, rhsRoot);
    if (!equivalent) {
      LOGGER.warn("Key collision detected: different documents share key {}", Keys.toHexString(key));
    }
    return equivalent;
  }

  /**
   * Get the configuration.
   *
   * @return the configuration
   */
  public MatcherConfiguration getConfiguration() {
    return config;
  }
}
