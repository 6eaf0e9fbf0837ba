package io.treematch.api;

/**
 * Read-only view of a single attribute of a {@link NodeView}.
 */
public interface AttributeView {

  /**
   * Get the qualified attribute name, as written in the source.
   *
   * @return the attribute name
   */
  String getName();

  /**
   * Get the attribute value with entities replaced.
   *
   * @return the attribute value
   */
  String getValue();
}
