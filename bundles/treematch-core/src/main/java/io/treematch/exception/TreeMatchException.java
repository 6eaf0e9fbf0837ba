package io.treematch.exception;

/**
 * Exception to hold all relevant failures upcoming from treematch.
 */
public class TreeMatchException extends RuntimeException {

  /** General ID. */
  private static final long serialVersionUID = 1L;

  /**
   * Constructor to encapsulate parsing.
   *
   * @param throwable to encapsulate
   */
  public TreeMatchException(final Throwable throwable) {
    super(throwable);
  }

  /**
   * Constructor.
   *
   * @param message message
   */
  public TreeMatchException(final String message) {
    super(message);
  }

  /**
   * Constructor with a {@link String#format(String, Object...)} style message.
   *
   * @param message the format string
   * @param args the format arguments
   */
  public TreeMatchException(final String message, final Object... args) {
    super(String.format(message, args));
  }

  /**
   * Constructor.
   *
   * @param message message
   * @param throwable the cause
   */
  public TreeMatchException(final String message, final Throwable throwable) {
    super(message, throwable);
  }

  /**
   * Constructor with a cause and a {@link String#format(String, Object...)} style message.
   *
   * @param cause the cause
   * @param message the format string
   * @param args the format arguments
   */
  public TreeMatchException(final Throwable cause, final String message, final Object... args) {
    super(String.format(message, args), cause);
  }
}
