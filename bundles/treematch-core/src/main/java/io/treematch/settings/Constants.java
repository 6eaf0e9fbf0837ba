package io.treematch.settings;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Global constants.
 */
public final class Constants {

  /** Default encoding of documents and configuration files. */
  public static final Charset DEFAULT_ENCODING = StandardCharsets.UTF_8;

  /** Default maximum element nesting accepted by the parser. */
  public static final int DEFAULT_MAX_DEPTH = 512;

  /** Name of the attribute under which the default namespace is declared. */
  public static final String XMLNS = "xmlns";

  private Constants() {
    throw new AssertionError("May never be instantiated!");
  }
}
