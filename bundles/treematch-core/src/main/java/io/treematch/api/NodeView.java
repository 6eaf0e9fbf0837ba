package io.treematch.api;

/**
 * Read-only view of an element node of an acyclic markup tree.
 *
 * <p>
 * Both the attributes and the children are exposed in document order, but neither order is part
 * of the identity of a node as far as fingerprinting is concerned. Implementations must not return
 * {@code null} from any method; absent text is the empty string.
 * </p>
 */
public interface NodeView {

  /**
   * Get the qualified tag name.
   *
   * @return the tag name
   */
  String getName();

  /**
   * Get the direct text content of the node, excluding the text of descendants.
   *
   * @return the direct text, possibly empty
   */
  String getText();

  /**
   * Get the attributes of the node.
   *
   * @return the attributes, possibly empty
   */
  Iterable<? extends AttributeView> getAttributes();

  /**
   * Get the element children of the node.
   *
   * @return the children, possibly empty
   */
  Iterable<? extends NodeView> getChildren();
}
