package io.treematch.examples;

import com.google.common.collect.ImmutableList;
import io.treematch.access.DocumentMatcher;
import io.treematch.key.Keys;
import io.treematch.node.XmlDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.util.List;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * Runs {@link MatchCase}s and prints one line per case, for example
 * {@code [1.xml] == [2.xml] ---> PASSED}.
 */
public final class MatchSuite {

  private static final Logger LOGGER = LoggerFactory.getLogger(MatchSuite.class);

  /**
   * The fixed cases run against the bundled test data.
   */
  public static final List<MatchCase> DEFAULT_CASES = ImmutableList.of(new MatchCase("1.xml", "2.xml", true),
                                                                       new MatchCase("3.xml", "4.xml", false),
                                                                       new MatchCase("5.xml", "6.xml", true),
                                                                       new MatchCase("7.xml", "8.xml", true),
                                                                       new MatchCase("9.xml", "10.xml", true),
                                                                       new MatchCase("11.xml", "12.xml", false),
                                                                       new MatchCase("13.xml", "14.xml", true),
                                                                       new MatchCase("15.xml", "16.xml", true),
                                                                       new MatchCase("17.xml", "18.xml", false));

  /** Resolves a document name to a loaded document. */
  private final Function<String, XmlDocument> documents;

  /** The matcher under test. */
  private final DocumentMatcher matcher;

  /** Where the results are printed. */
  private final PrintWriter out;

  /**
   * Constructor.
   *
   * @param documents resolves document names, throwing if a document can not be loaded
   * @param matcher the matcher
   * @param out where the results are printed
   */
  public MatchSuite(final Function<String, XmlDocument> documents, final DocumentMatcher matcher,
      final PrintWriter out) {
    this.documents = requireNonNull(documents);
    this.matcher = requireNonNull(matcher);
    this.out = requireNonNull(out);
  }

  /**
   * Execute a single case.
   *
   * @param matchCase the case
   * @return {@code true} if the verdict equals the expected one
   */
  public boolean execute(final MatchCase matchCase) {
    final XmlDocument lhs = documents.apply(matchCase.lhs());
    final XmlDocument rhs = documents.apply(matchCase.rhs());

    out.print(matchCase.describe() + " ---> ");

    final boolean passed = matcher.matchLoosely(lhs, rhs) == matchCase.expectedEquivalency();
    out.println(passed ? "PASSED" : "FAILED");
    out.flush();
    if (!passed) {
      LOGGER.debug("Keys of failed case {}: {} / {}", matchCase, Keys.toHexString(matcher.computeKey(lhs)),
          Keys.toHexString(matcher.computeKey(rhs)));
    }
    return passed;
  }

  /**
   * Execute all cases.
   *
   * @param cases the cases
   * @return the number of failed cases
   */
  public int run(final List<MatchCase> cases) {
    int failed = 0;
    for (final MatchCase matchCase : cases) {
      if (!execute(matchCase)) {
        failed++;
      }
    }
    LOGGER.info("{} of {} cases passed", cases.size() - failed, cases.size());
    return failed;
  }
}
