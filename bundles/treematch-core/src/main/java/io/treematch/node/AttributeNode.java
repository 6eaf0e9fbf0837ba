package io.treematch.node;

import com.google.common.base.MoreObjects;
import io.treematch.api.AttributeView;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Immutable attribute.
 */
public final class AttributeNode implements AttributeView {

  /** The qualified name. */
  private final String name;

  /** The value. */
  private final String value;

  /**
   * Constructor.
   *
   * @param name the qualified name
   * @param value the value
   */
  public AttributeNode(final String name, final String value) {
    this.name = requireNonNull(name);
    this.value = requireNonNull(value);
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public String getValue() {
    return value;
  }

  @Override
  public boolean equals(final @Nullable Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof AttributeNode other)) {
      return false;
    }
    return name.equals(other.name) && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, value);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("name", name).add("value", value).toString();
  }
}
