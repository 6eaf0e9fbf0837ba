package io.treematch.access;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.HashMultiset;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Maps;
import com.google.common.collect.Multiset;
import io.treematch.api.AttributeView;
import io.treematch.api.NodeView;
import io.treematch.key.NodeKeys;

import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Exact comparison of two trees up to attribute order and sibling order. Used to confirm that equal
 * keys are no collision.
 *
 * <p>
 * The keys of all nodes of both trees are computed once per verification. Children of the right
 * node are bucketed by their keys, so only children with equal keys are compared recursively.
 * Structural equivalence is an equivalence relation, hence pairing each left child with the first
 * equivalent unpaired right child in its bucket never misses a pairing.
 * </p>
 */
final class StructuralVerifier {

  /** Computes the keys used to bucket children. */
  private final NodeKeys nodeKeys;

  StructuralVerifier(final NodeKeys nodeKeys) {
    this.nodeKeys = requireNonNull(nodeKeys);
  }

  /**
   * Determines if two subtrees are structurally equivalent.
   *
   * @param lhs the left node
   * @param rhs the right node
   * @return {@code true} iff tag names, texts, attribute sets and child sets are equal, recursively
   */
  boolean equivalent(final NodeView lhs, final NodeView rhs) {
    final Map<NodeView, Long> keys = new IdentityHashMap<>();
    nodeKeys.nodeKey(lhs, keys);
    nodeKeys.nodeKey(rhs, keys);
    return equivalent(lhs, rhs, keys);
  }

  private boolean equivalent(final NodeView lhs, final NodeView rhs, final Map<NodeView, Long> keys) {
    if (!lhs.getName().equals(rhs.getName()) || !lhs.getText().equals(rhs.getText())) {
      return false;
    }
    if (!attributes(lhs).equals(attributes(rhs))) {
      return false;
    }
    return childrenEquivalent(lhs, rhs, keys);
  }

  private static Multiset<Map.Entry<String, String>> attributes(final NodeView node) {
    final Multiset<Map.Entry<String, String>> attributes = HashMultiset.create();
    for (final AttributeView attribute : node.getAttributes()) {
      attributes.add(Maps.immutableEntry(attribute.getName(), attribute.getValue()));
    }
    return attributes;
  }

  private boolean childrenEquivalent(final NodeView lhs, final NodeView rhs, final Map<NodeView, Long> keys) {
    final ListMultimap<Long, NodeView> unpaired = ArrayListMultimap.create();
    for (final NodeView child : rhs.getChildren()) {
      unpaired.put(keys.get(child), child);
    }

    for (final NodeView child : lhs.getChildren()) {
      if (!pair(child, unpaired.get(keys.get(child)), keys)) {
        return false;
      }
    }

    return unpaired.isEmpty();
  }

  private boolean pair(final NodeView child, final List<NodeView> candidates, final Map<NodeView, Long> keys) {
    for (final Iterator<NodeView> it = candidates.iterator(); it.hasNext();) {
      if (equivalent(child, it.next(), keys)) {
        it.remove();
        return true;
      }
    }
    return false;
  }
}
