package io.treematch.access;

import com.google.common.base.MoreObjects;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import io.treematch.exception.TreeMatchException;
import io.treematch.exception.TreeMatchIOException;
import io.treematch.key.TextHashType;
import io.treematch.settings.Constants;
import org.checkerframework.checker.index.qual.Positive;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Holds the settings of a {@link DocumentMatcher} and of the XML parser feeding it. Instances are
 * immutable and built with a {@link Builder}.
 */
public final class MatcherConfiguration {

  /** Default text hash primitive. */
  public static final TextHashType TEXT_HASH_TYPE = TextHashType.XXH3;

  /** Default collision policy. */
  public static final CollisionPolicy COLLISION_POLICY = CollisionPolicy.TRUST_KEYS;

  /** The text hash primitive. */
  public final TextHashType textHashType;

  /** How equal keys are interpreted. */
  public final CollisionPolicy collisionPolicy;

  /** Maximum element nesting accepted by the parser. */
  public final int maxDepth;

  /** Determines if namespace declarations are fingerprinted as attributes. */
  public final boolean includeNamespaceDeclarations;

  private MatcherConfiguration(final Builder builder) {
    textHashType = builder.textHashType;
    collisionPolicy = builder.collisionPolicy;
    maxDepth = builder.maxDepth;
    includeNamespaceDeclarations = builder.includeNamespaceDeclarations;
  }

  /**
   * Get a configuration with all defaults.
   *
   * @return the default configuration
   */
  public static MatcherConfiguration defaults() {
    return newBuilder().build();
  }

  /**
   * Get a new builder instance.
   *
   * @return a new builder with default settings
   */
  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Get a builder initialized with the settings of this configuration.
   *
   * @return a new builder
   */
  public Builder toBuilder() {
    return newBuilder().textHashType(textHashType)
                       .collisionPolicy(collisionPolicy)
                       .maxDepth(maxDepth)
                       .includeNamespaceDeclarations(includeNamespaceDeclarations);
  }

  @Override
  public boolean equals(final @Nullable Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof MatcherConfiguration other)) {
      return false;
    }
    return textHashType == other.textHashType && collisionPolicy == other.collisionPolicy
        && maxDepth == other.maxDepth && includeNamespaceDeclarations == other.includeNamespaceDeclarations;
  }

  @Override
  public int hashCode() {
    return Objects.hash(textHashType, collisionPolicy, maxDepth, includeNamespaceDeclarations);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("textHashType", textHashType)
                      .add("collisionPolicy", collisionPolicy)
                      .add("maxDepth", maxDepth)
                      .add("includeNamespaceDeclarations", includeNamespaceDeclarations)
                      .toString();
  }

  /**
   * Serializing a {@link MatcherConfiguration} to a json file.
   *
   * @param config to be serialized
   * @param file the target file, overwritten if it exists
   * @throws TreeMatchIOException if an I/O error occurs
   */
  public static void serialize(final MatcherConfiguration config, final Path file) {
    requireNonNull(config);
    try (final Writer writer = Files.newBufferedWriter(file, Constants.DEFAULT_ENCODING);
         final JsonWriter jsonWriter = new JsonWriter(writer)) {
      jsonWriter.setIndent("  ");
      jsonWriter.beginObject();
      jsonWriter.name("textHashType").value(config.textHashType.name());
      jsonWriter.name("collisionPolicy").value(config.collisionPolicy.name());
      jsonWriter.name("maxDepth").value(config.maxDepth);
      jsonWriter.name("includeNamespaceDeclarations").value(config.includeNamespaceDeclarations);
      jsonWriter.endObject();
    } catch (final IOException e) {
      throw TreeMatchIOException.onWrite(file.toString(), e);
    }
  }

  /**
   * Generate a {@link MatcherConfiguration} out of a json file. Settings missing in the file keep
   * their defaults.
   *
   * @param file the json file
   * @return a new {@link MatcherConfiguration} instance
   * @throws TreeMatchIOException if the file can not be read or is no valid json
   * @throws TreeMatchException if the file contains unknown or invalid settings
   */
  public static MatcherConfiguration deserialize(final Path file) {
    try (final Reader reader = Files.newBufferedReader(file, Constants.DEFAULT_ENCODING);
         final JsonReader jsonReader = new JsonReader(reader)) {
      final Builder builder = newBuilder();
      jsonReader.beginObject();
      while (jsonReader.hasNext()) {
        final String name = jsonReader.nextName();
        switch (name) {
          case "textHashType" -> builder.textHashType(TextHashType.fromString(jsonReader.nextString()));
          case "collisionPolicy" -> builder.collisionPolicy(CollisionPolicy.fromString(jsonReader.nextString()));
          case "maxDepth" -> builder.maxDepth(jsonReader.nextInt());
          case "includeNamespaceDeclarations" -> builder.includeNamespaceDeclarations(jsonReader.nextBoolean());
          default -> throw new TreeMatchException("Unknown setting `%s` in %s", name, file);
        }
      }
      jsonReader.endObject();
      return builder.build();
    } catch (final IOException e) {
      throw new TreeMatchIOException(file.toString(), e);
    } catch (final IllegalArgumentException | IllegalStateException e) {
      throw new TreeMatchException(e, "Invalid configuration %s: %s", file, e.getMessage());
    }
  }

  /**
   * Builder setting up a {@link MatcherConfiguration}.
   */
  public static final class Builder {

    /** The text hash primitive. */
    private TextHashType textHashType = TEXT_HASH_TYPE;

    /** How equal keys are interpreted. */
    private CollisionPolicy collisionPolicy = COLLISION_POLICY;

    /** Maximum element nesting. */
    private int maxDepth = Constants.DEFAULT_MAX_DEPTH;

    /** Determines if namespace declarations are fingerprinted. */
    private boolean includeNamespaceDeclarations = true;

    private Builder() {
    }

    /**
     * Set the text hash primitive.
     *
     * @param textHashType the hash type
     * @return reference to the builder object
     */
    public Builder textHashType(final TextHashType textHashType) {
      this.textHashType = requireNonNull(textHashType);
      return this;
    }

    /**
     * Set the collision policy.
     *
     * @param collisionPolicy the policy
     * @return reference to the builder object
     */
    public Builder collisionPolicy(final CollisionPolicy collisionPolicy) {
      this.collisionPolicy = requireNonNull(collisionPolicy);
      return this;
    }

    /**
     * Set the maximum element nesting accepted by the parser.
     *
     * @param maxDepth the maximum depth, the document element has depth one
     * @return reference to the builder object
     * @throws IllegalArgumentException if {@code maxDepth} is not positive
     */
    public Builder maxDepth(final @Positive int maxDepth) {
      checkArgument(maxDepth > 0, "maxDepth must be > 0: %s", maxDepth);
      this.maxDepth = maxDepth;
      return this;
    }

    /**
     * Include namespace declarations as attributes or not (default: yes).
     *
     * @param include include namespace declarations
     * @return reference to the builder object
     */
    public Builder includeNamespaceDeclarations(final boolean include) {
      includeNamespaceDeclarations = include;
      return this;
    }

    /**
     * Building a new {@link MatcherConfiguration} with immutable fields.
     *
     * @return a new {@link MatcherConfiguration} instance
     */
    public MatcherConfiguration build() {
      return new MatcherConfiguration(this);
    }
  }
}
