package io.treematch.exception;

/**
 * Thrown if a document or a configuration can not be read, written or parsed.
 */
public final class TreeMatchIOException extends TreeMatchException {

  private static final long serialVersionUID = 1L;

  /**
   * Name of the source which failed, for instance a file path or a resource name.
   */
  private final String source;

  /**
   * Constructor.
   *
   * @param source name of the failing source
   * @param message message
   */
  public TreeMatchIOException(final String source, final String message) {
    super("Failed to load `%s`: %s", source, message);
    this.source = source;
  }

  /**
   * Constructor.
   *
   * @param source name of the failing source
   * @param cause the underlying failure
   */
  public TreeMatchIOException(final String source, final Throwable cause) {
    this(source, cause, "load");
  }

  private TreeMatchIOException(final String source, final Throwable cause, final String action) {
    super(cause, "Failed to %s `%s`: %s", action, source, cause.getMessage());
    this.source = source;
  }

  /**
   * Create an exception for a target which could not be written.
   *
   * @param target name of the failing target
   * @param cause the underlying failure
   * @return the exception
   */
  public static TreeMatchIOException onWrite(final String target, final Throwable cause) {
    return new TreeMatchIOException(target, cause, "write");
  }

  /**
   * Get the name of the source or target which failed.
   *
   * @return the source name
   */
  public String getSource() {
    return source;
  }
}
