package io.treematch.examples;

import io.treematch.access.DocumentMatcher;
import io.treematch.access.MatcherConfiguration;
import io.treematch.node.XmlDocument;
import io.treematch.service.xml.XmlDocumentLoader;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Compares two XML files.
 */
@Command(
    name = "compare",
    description = "Loosely matches two XML files and prints the verdict")
class CompareCommand implements Callable<Integer> {

  @ParentCommand
  private TreeMatch parent;

  @Spec
  private CommandSpec spec;

  @Parameters(index = "0", paramLabel = "LHS", description = "the left XML file")
  private Path lhs;

  @Parameters(index = "1", paramLabel = "RHS", description = "the right XML file")
  private Path rhs;

  @Option(
      names = "--expect",
      arity = "1",
      paramLabel = "BOOL",
      description = "expected verdict; prints PASSED or FAILED and sets the exit code accordingly")
  private Boolean expected;

  @Override
  public Integer call() {
    final MatcherConfiguration config = parent.configuration();
    final XmlDocumentLoader loader = parent.newLoader(config);
    final DocumentMatcher matcher = parent.newMatcher(config);

    final XmlDocument lhsDocument = loader.load(lhs);
    final XmlDocument rhsDocument = loader.load(rhs);
    final boolean match = matcher.matchLoosely(lhsDocument, rhsDocument);

    final PrintWriter out = spec.commandLine().getOut();
    if (expected == null) {
      out.println("[" + lhs + "] " + (match ? "==" : "!=") + " [" + rhs + "]");
      out.flush();
      return match ? TreeMatch.OK : TreeMatch.ERR_MISMATCH;
    }

    final boolean passed = match == expected;
    out.println(new MatchCase(lhs.toString(), rhs.toString(), expected).describe() + " ---> "
        + (passed ? "PASSED" : "FAILED"));
    out.flush();
    return passed ? TreeMatch.OK : TreeMatch.ERR_MISMATCH;
  }
}
