package io.treematch.api;

/**
 * Read-only handle on a parsed document.
 */
public interface DocumentView {

  /**
   * Get the document element.
   *
   * @return the root element, never {@code null}
   */
  NodeView getRoot();
}
