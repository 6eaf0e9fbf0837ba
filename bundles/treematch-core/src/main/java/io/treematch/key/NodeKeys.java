package io.treematch.key;

import io.treematch.api.AttributeView;
import io.treematch.api.NodeView;

import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Computes the fingerprint key of a node and its subtree.
 *
 * <p>
 * The four facets of a node (tag name, direct text, attribute set, child set) are combined
 * {@link Keys#combineUniquely(long, long, long, long) uniquely}, whereas the members of the
 * attribute set and of the child set are combined {@link Keys#combineLoosely(long, long) loosely}.
 * Hence reordering attributes or siblings never changes a key, while changing a name, a text or an
 * attribute value anywhere in the subtree does (barring hash collisions).
 * </p>
 *
 * <p>
 * Instances are immutable and may be shared between threads. The traversal is read-only and
 * recursive, its depth equals the depth of the tree. The tree must be acyclic, which is not checked.
 * </p>
 */
public final class NodeKeys {

  /**
   * The text hash primitive.
   */
  private final TextHashType hashType;

  /**
   * Constructor.
   *
   * @param hashType the text hash primitive
   */
  public NodeKeys(final TextHashType hashType) {
    this.hashType = requireNonNull(hashType);
  }

  /**
   * Get the key of a single attribute, sensitive to the roles of name and value.
   *
   * @param attribute the attribute
   * @return the attribute key
   */
  public long keyOf(final AttributeView attribute) {
    return Keys.combineUniquely(hash(attribute.getName()), hash(attribute.getValue()));
  }

  /**
   * Get the key of the attribute set of a node, independent of the attribute order.
   *
   * @param node the node
   * @return the attribute set key, {@link Keys#IDENTITY} if there are no attributes
   */
  public long attributesKey(final NodeView node) {
    long result = Keys.IDENTITY;
    for (final AttributeView attribute : node.getAttributes()) {
      result = Keys.combineLoosely(result, keyOf(attribute));
    }
    return result;
  }

  /**
   * Get the key of a node including its whole subtree.
   *
   * @param node the node
   * @return the node key
   */
  public long nodeKey(final NodeView node) {
    long childrenKey = Keys.IDENTITY;
    for (final NodeView child : node.getChildren()) {
      childrenKey = Keys.combineLoosely(childrenKey, nodeKey(child));
    }

    return combine(node, childrenKey);
  }

  /**
   * Get the key of a node including its whole subtree, and record the key of every node of the
   * subtree on the way.
   *
   * @param node the node
   * @param keys receives the key of each visited node, typically an {@link java.util.IdentityHashMap}
   * @return the node key
   */
  public long nodeKey(final NodeView node, final Map<NodeView, Long> keys) {
    long childrenKey = Keys.IDENTITY;
    for (final NodeView child : node.getChildren()) {
      childrenKey = Keys.combineLoosely(childrenKey, nodeKey(child, keys));
    }

    final long key = combine(node, childrenKey);
    keys.put(node, key);
    return key;
  }

  private long combine(final NodeView node, final long childrenKey) {
    return Keys.combineUniquely(hash(node.getName()), hash(node.getText()), attributesKey(node), childrenKey);
  }

  /**
   * Hash a text with the configured primitive.
   *
   * @param text the text
   * @return the text key
   */
  public long hash(final String text) {
    return hashType.hash(text);
  }

  /**
   * Get the text hash primitive.
   *
   * @return the hash type
   */
  public TextHashType getHashType() {
    return hashType;
  }
}
