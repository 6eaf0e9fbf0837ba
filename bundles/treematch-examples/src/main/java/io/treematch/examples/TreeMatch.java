package io.treematch.examples;

import io.treematch.access.DocumentMatcher;
import io.treematch.access.MatcherConfiguration;
import io.treematch.exception.TreeMatchException;
import io.treematch.exception.TreeMatchIOException;
import io.treematch.service.xml.XmlDocumentLoader;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Console harness loosely matching XML documents.
 *
 * <pre>
 * treematch compare a.xml b.xml --expect true
 * treematch --config treematch.json suite --data-dir test_data
 * </pre>
 */
@Command(
    name = "treematch",
    mixinStandardHelpOptions = true,
    version = "treematch 0.1",
    description = "Matches XML documents ignoring the order of attributes and sibling elements.",
    subcommands = {
        HelpCommand.class,
        CompareCommand.class,
        SuiteCommand.class,
    })
public class TreeMatch {

  static final int OK = 0;
  /** A case failed or documents do not match as expected. */
  static final int ERR_MISMATCH = 1;
  static final int ERR_USER = 2;
  static final int ERR_IO = 4;

  @Option(
      names = { "-c", "--config" },
      paramLabel = "FILE",
      description = "JSON matcher configuration (text hash, collision policy, depth limit)")
  Path configFile;

  public static void main(String[] args) {
    System.exit(newCommandLine().execute(args));
  }

  /**
   * Create the command line, mapping loader failures to {@link #ERR_IO}.
   *
   * @return the command line
   */
  static CommandLine newCommandLine() {
    return new CommandLine(new TreeMatch()).setExecutionExceptionHandler((e, commandLine, parseResult) -> {
      commandLine.getErr().println(e.getMessage());
      if (e instanceof TreeMatchIOException) {
        return ERR_IO;
      }
      if (e instanceof TreeMatchException) {
        return ERR_USER;
      }
      throw e;
    });
  }

  /**
   * Get the configuration given on the command line, or the defaults.
   *
   * @return the configuration
   */
  MatcherConfiguration configuration() {
    return configFile == null
        ? MatcherConfiguration.defaults()
        : MatcherConfiguration.deserialize(configFile);
  }

  XmlDocumentLoader newLoader(final MatcherConfiguration config) {
    return new XmlDocumentLoader(config);
  }

  DocumentMatcher newMatcher(final MatcherConfiguration config) {
    return new DocumentMatcher(config);
  }
}
