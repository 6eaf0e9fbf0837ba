package io.treematch.access;

import io.treematch.exception.TreeMatchException;
import io.treematch.exception.TreeMatchIOException;
import io.treematch.key.TextHashType;
import io.treematch.settings.Constants;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link MatcherConfiguration}.
 */
@DisplayName("MatcherConfiguration")
class MatcherConfigurationTest {

  @TempDir
  Path tempDir;

  @Test
  @DisplayName("defaults")
  void testDefaults() {
    final MatcherConfiguration config = MatcherConfiguration.defaults();
    assertEquals(TextHashType.XXH3, config.textHashType);
    assertEquals(CollisionPolicy.TRUST_KEYS, config.collisionPolicy);
    assertEquals(Constants.DEFAULT_MAX_DEPTH, config.maxDepth);
    assertTrue(config.includeNamespaceDeclarations);
  }

  @Test
  @DisplayName("serialized settings are read back")
  void testSerializeDeserialize() {
    final MatcherConfiguration config = MatcherConfiguration.newBuilder()
                                                            .textHashType(TextHashType.SIP24)
                                                            .collisionPolicy(CollisionPolicy.VERIFY_STRUCTURE)
                                                            .maxDepth(32)
                                                            .includeNamespaceDeclarations(false)
                                                            .build();
    final Path file = tempDir.resolve("treematch.json");
    MatcherConfiguration.serialize(config, file);
    assertEquals(config, MatcherConfiguration.deserialize(file));
    assertEquals(config, config.toBuilder().build());
  }

  @Test
  @DisplayName("missing settings keep their defaults")
  void testPartialFile() throws IOException {
    final Path file = tempDir.resolve("partial.json");
    Files.writeString(file, "{ \"collisionPolicy\": \"verify_structure\" }");
    final MatcherConfiguration config = MatcherConfiguration.deserialize(file);
    assertEquals(CollisionPolicy.VERIFY_STRUCTURE, config.collisionPolicy);
    assertEquals(MatcherConfiguration.TEXT_HASH_TYPE, config.textHashType);
  }

  @Test
  @DisplayName("invalid settings are rejected")
  void testInvalidSettings() throws IOException {
    final Path unknown = tempDir.resolve("unknown.json");
    Files.writeString(unknown, "{ \"hashKind\": \"ROLLING\" }");
    assertThrows(TreeMatchException.class, () -> MatcherConfiguration.deserialize(unknown));

    final Path badEnum = tempDir.resolve("enum.json");
    Files.writeString(badEnum, "{ \"textHashType\": \"MD5\" }");
    assertThrows(TreeMatchException.class, () -> MatcherConfiguration.deserialize(badEnum));

    final Path badDepth = tempDir.resolve("depth.json");
    Files.writeString(badDepth, "{ \"maxDepth\": 0 }");
    assertThrows(TreeMatchException.class, () -> MatcherConfiguration.deserialize(badDepth));

    final Path badType = tempDir.resolve("type.json");
    Files.writeString(badType, "{ \"includeNamespaceDeclarations\": [] }");
    assertThrows(TreeMatchException.class, () -> MatcherConfiguration.deserialize(badType));
  }

  @Test
  @DisplayName("unreadable files are reported with their name")
  void testUnreadable() throws IOException {
    final Path missing = tempDir.resolve("missing.json");
    final TreeMatchIOException e = assertThrows(TreeMatchIOException.class, () -> MatcherConfiguration.deserialize(missing));
    assertEquals(missing.toString(), e.getSource());
    assertTrue(e.getMessage().startsWith("Failed to load `" + missing + "`"), e.getMessage());

    final Path malformed = tempDir.resolve("malformed.json");
    Files.writeString(malformed, "{ \"maxDepth\": ");
    assertThrows(TreeMatchIOException.class, () -> MatcherConfiguration.deserialize(malformed));
  }

  @Test
  @DisplayName("unwritable files are reported as write failures")
  void testUnwritable() throws IOException {
    final Path notADirectory = Files.writeString(tempDir.resolve("plain.txt"), "");
    final Path target = notADirectory.resolve("treematch.json");
    final TreeMatchIOException e = assertThrows(TreeMatchIOException.class,
        () -> MatcherConfiguration.serialize(MatcherConfiguration.defaults(), target));
    assertEquals(target.toString(), e.getSource());
    assertTrue(e.getMessage().startsWith("Failed to write `" + target + "`"), e.getMessage());
  }

  @Test
  @DisplayName("depth must be positive")
  void testMaxDepth() {
    assertThrows(IllegalArgumentException.class, () -> MatcherConfiguration.newBuilder().maxDepth(0));
  }
}
