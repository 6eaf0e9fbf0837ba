package io.treematch.node;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import io.treematch.api.NodeView;

import static java.util.Objects.requireNonNull;

/**
 * Immutable element node. Attributes and children keep their document order.
 */
public final class ElementNode implements NodeView {

  /** The qualified tag name. */
  private final String name;

  /** The direct text content. */
  private final String text;

  /** The attributes in document order. */
  private final ImmutableList<AttributeNode> attributes;

  /** The element children in document order. */
  private final ImmutableList<ElementNode> children;

  private ElementNode(final Builder builder) {
    name = builder.name;
    text = builder.text.toString();
    attributes = builder.attributes.build();
    children = builder.children.build();
  }

  /**
   * Create a new builder.
   *
   * @param name the qualified tag name
   * @return a new builder instance
   */
  public static Builder newBuilder(final String name) {
    return new Builder(name);
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public String getText() {
    return text;
  }

  @Override
  public ImmutableList<AttributeNode> getAttributes() {
    return attributes;
  }

  @Override
  public ImmutableList<ElementNode> getChildren() {
    return children;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("name", name)
                      .add("text", text)
                      .add("attributes", attributes.size())
                      .add("children", children.size())
                      .toString();
  }

  /**
   * Builder to build an {@link ElementNode} instance.
   */
  public static final class Builder {

    /** The qualified tag name. */
    private final String name;

    /** Direct text collected so far. */
    private final StringBuilder text = new StringBuilder();

    /** Attributes collected so far. */
    private final ImmutableList.Builder<AttributeNode> attributes = ImmutableList.builder();

    /** Children collected so far. */
    private final ImmutableList.Builder<ElementNode> children = ImmutableList.builder();

    /**
     * Constructor.
     *
     * @param name the qualified tag name
     */
    public Builder(final String name) {
      this.name = requireNonNull(name);
    }

    /**
     * Append direct text.
     *
     * @param text the text to append
     * @return this builder instance
     */
    public Builder text(final String text) {
      this.text.append(requireNonNull(text));
      return this;
    }

    /**
     * Add an attribute.
     *
     * @param name the qualified attribute name
     * @param value the attribute value
     * @return this builder instance
     */
    public Builder attribute(final String name, final String value) {
      attributes.add(new AttributeNode(name, value));
      return this;
    }

    /**
     * Add an element child.
     *
     * @param child the child
     * @return this builder instance
     */
    public Builder child(final ElementNode child) {
      children.add(requireNonNull(child));
      return this;
    }

    /**
     * Add an element child.
     *
     * @param child the builder of the child, built immediately
     * @return this builder instance
     */
    public Builder child(final Builder child) {
      return child(child.build());
    }

    /**
     * Build an instance.
     *
     * @return {@link ElementNode} instance
     */
    public ElementNode build() {
      return new ElementNode(this);
    }
  }
}
