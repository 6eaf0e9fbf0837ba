package io.treematch.examples;

import io.treematch.access.CollisionPolicy;
import io.treematch.access.MatcherConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests of the {@link TreeMatch} command line.
 */
@DisplayName("TreeMatch command line")
class TreeMatchTest {

  @TempDir
  Path tempDir;

  private final StringWriter out = new StringWriter();

  private final StringWriter err = new StringWriter();

  private CommandLine commandLine;

  @BeforeEach
  void setUp() {
    commandLine = TreeMatch.newCommandLine();
    commandLine.setOut(new PrintWriter(out));
    commandLine.setErr(new PrintWriter(err));
  }

  private Path write(final String name, final String xml) throws IOException {
    return Files.writeString(tempDir.resolve(name), xml);
  }

  @Test
  @DisplayName("compare prints the verdict")
  void testCompare() throws IOException {
    final Path lhs = write("a.xml", "<r a=\"1\" b=\"2\"><x/><y/></r>");
    final Path rhs = write("b.xml", "<r b=\"2\" a=\"1\"><y/><x/></r>");
    assertEquals(TreeMatch.OK, commandLine.execute("compare", lhs.toString(), rhs.toString()));
    assertEquals("[" + lhs + "] == [" + rhs + "]", out.toString().strip());
  }

  @Test
  @DisplayName("compare checks an expected verdict")
  void testCompareExpect() throws IOException {
    final Path lhs = write("a.xml", "<r>hello</r>");
    final Path rhs = write("b.xml", "<r>world</r>");
    assertEquals(TreeMatch.OK, commandLine.execute("compare", lhs.toString(), rhs.toString(), "--expect", "false"));
    assertTrue(out.toString().strip().endsWith("---> PASSED"));
    assertEquals(TreeMatch.ERR_MISMATCH,
        commandLine.execute("compare", lhs.toString(), rhs.toString(), "--expect", "true"));
    assertTrue(out.toString().strip().endsWith("---> FAILED"));
  }

  @Test
  @DisplayName("compare takes the expected verdict as a separate argument")
  void testCompareExpectSeparateValue() throws IOException {
    final Path lhs = write("a.xml", "<r a=\"1\" b=\"2\"/>");
    final Path rhs = write("b.xml", "<r b=\"2\" a=\"1\"/>");
    assertEquals(TreeMatch.OK, commandLine.execute("compare", lhs.toString(), rhs.toString(), "--expect", "true"));
    assertEquals("[" + lhs + "] == [" + rhs + "] ---> PASSED", out.toString().strip());
    assertEquals(TreeMatch.OK, commandLine.execute("compare", lhs.toString(), rhs.toString(), "--expect=true"));
  }

  @Test
  @DisplayName("compare rejects --expect without a verdict")
  void testCompareExpectWithoutValue() throws IOException {
    final Path lhs = write("a.xml", "<r/>");
    final Path rhs = write("b.xml", "<r/>");
    assertEquals(CommandLine.ExitCode.USAGE, commandLine.execute("compare", lhs.toString(), rhs.toString(), "--expect"));
    assertTrue(out.toString().isEmpty());
  }

  @Test
  @DisplayName("unparsable documents exit with an I/O error")
  void testBrokenDocument() throws IOException {
    final Path lhs = write("a.xml", "<r>");
    final Path rhs = write("b.xml", "<r/>");
    assertEquals(TreeMatch.ERR_IO, commandLine.execute("compare", lhs.toString(), rhs.toString()));
    assertTrue(err.toString().contains(lhs.toString()));
  }

  @Test
  @DisplayName("the suite passes on the bundled test data")
  void testSuite() {
    assertEquals(TreeMatch.OK, commandLine.execute("suite"));
    assertEquals(MatchSuite.DEFAULT_CASES.size(), out.toString().strip().split("\\R").length);
  }

  @Test
  @DisplayName("the suite reads a data directory and a configuration")
  void testSuiteWithDataDirectory() throws IOException {
    for (final MatchCase matchCase : MatchSuite.DEFAULT_CASES) {
      for (final String name : new String[] { matchCase.lhs(), matchCase.rhs() }) {
        try (var in = TreeMatchTest.class.getResourceAsStream(SuiteCommand.BUNDLED_TEST_DATA + name)) {
          Files.copy(in, tempDir.resolve(name));
        }
      }
    }
    final Path config = tempDir.resolve("treematch.json");
    MatcherConfiguration.serialize(
        MatcherConfiguration.newBuilder().collisionPolicy(CollisionPolicy.VERIFY_STRUCTURE).build(), config);

    assertEquals(TreeMatch.OK,
        commandLine.execute("--config", config.toString(), "suite", "--data-dir", tempDir.toString()));

    Files.delete(tempDir.resolve("18.xml"));
    assertEquals(TreeMatch.ERR_IO, commandLine.execute("suite", "--data-dir", tempDir.toString()));
  }
}
