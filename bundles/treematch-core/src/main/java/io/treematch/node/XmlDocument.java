package io.treematch.node;

import com.google.common.base.MoreObjects;
import io.treematch.api.DocumentView;

import static java.util.Objects.requireNonNull;

/**
 * Immutable document, holding the document element and the name of the source it has been loaded
 * from.
 */
public final class XmlDocument implements DocumentView {

  /** Name of the source, for diagnostics only. */
  private final String source;

  /** The document element. */
  private final ElementNode root;

  /**
   * Constructor.
   *
   * @param source name of the source, for instance a file name
   * @param root the document element
   */
  public XmlDocument(final String source, final ElementNode root) {
    this.source = requireNonNull(source);
    this.root = requireNonNull(root);
  }

  /**
   * Create a document which does not stem from a named source.
   *
   * @param root the document element
   * @return the document
   */
  public static XmlDocument of(final ElementNode root) {
    return new XmlDocument("<memory>", root);
  }

  @Override
  public ElementNode getRoot() {
    return root;
  }

  /**
   * Get the name of the source.
   *
   * @return the source name
   */
  public String getSource() {
    return source;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("source", source).add("root", root.getName()).toString();
  }
}
