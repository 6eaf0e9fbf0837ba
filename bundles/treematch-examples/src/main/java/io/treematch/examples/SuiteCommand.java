package io.treematch.examples;

import io.treematch.access.MatcherConfiguration;
import io.treematch.node.XmlDocument;
import io.treematch.service.xml.XmlDocumentLoader;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Runs the fixed test-case pairs.
 */
@Command(
    name = "suite",
    description = "Runs the fixed suite of document pairs and prints PASSED or FAILED per pair")
class SuiteCommand implements Callable<Integer> {

  /** Classpath location of the bundled test data. */
  static final String BUNDLED_TEST_DATA = "/test_data/";

  @ParentCommand
  private TreeMatch parent;

  @Spec
  private CommandSpec spec;

  @Option(
      names = { "-d", "--data-dir" },
      paramLabel = "DIR",
      description = "directory holding 1.xml to 18.xml (default: the bundled test data)")
  private Path dataDirectory;

  @Override
  public Integer call() {
    final MatcherConfiguration config = parent.configuration();
    final XmlDocumentLoader loader = parent.newLoader(config);

    final Function<String, XmlDocument> documents = dataDirectory == null
        ? name -> loader.loadResource(BUNDLED_TEST_DATA + name)
        : name -> loader.load(dataDirectory.resolve(name));

    final PrintWriter out = spec.commandLine().getOut();
    out.println();
    final int failed = new MatchSuite(documents, parent.newMatcher(config), out).run(MatchSuite.DEFAULT_CASES);
    out.println();
    out.flush();

    return failed == 0 ? TreeMatch.OK : TreeMatch.ERR_MISMATCH;
  }
}
