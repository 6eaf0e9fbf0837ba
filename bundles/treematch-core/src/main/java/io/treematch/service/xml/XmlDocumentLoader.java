package io.treematch.service.xml;

import io.treematch.access.MatcherConfiguration;
import io.treematch.exception.TreeMatchIOException;
import io.treematch.node.XmlDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.XMLEventReader;
import javax.xml.stream.XMLStreamException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.util.Objects.requireNonNull;

/**
 * Loads {@link XmlDocument}s from named sources: files, classpath resources and strings.
 *
 * <p>
 * Failures are thrown as {@link TreeMatchIOException}s naming the source, and are not logged above
 * {@code debug}.
 * </p>
 */
public final class XmlDocumentLoader {

  private static final Logger LOGGER = LoggerFactory.getLogger(XmlDocumentLoader.class);

  /** The configuration, providing the parser settings. */
  private final MatcherConfiguration config;

  /**
   * Constructor.
   *
   * @param config the configuration
   */
  public XmlDocumentLoader(final MatcherConfiguration config) {
    this.config = requireNonNull(config);
  }

  /**
   * Load a document from a file.
   *
   * @param file the file
   * @return the document, named after the file
   * @throws TreeMatchIOException if the file can not be read or parsed
   */
  public XmlDocument load(final Path file) {
    final String source = file.toString();
    try (final InputStream in = Files.newInputStream(file)) {
      return parse(XmlDocumentParser.createStreamReader(in, source), source);
    } catch (final IOException e) {
      throw failed(new TreeMatchIOException(source, e));
    }
  }

  /**
   * Load a document from the classpath.
   *
   * @param resource the absolute resource name
   * @return the document, named after the resource
   * @throws TreeMatchIOException if the resource does not exist or can not be parsed
   */
  public XmlDocument loadResource(final String resource) {
    try (final InputStream in = XmlDocumentLoader.class.getResourceAsStream(resource)) {
      if (in == null) {
        throw failed(new TreeMatchIOException(resource, "resource not found"));
      }
      return parse(XmlDocumentParser.createStreamReader(in, resource), resource);
    } catch (final IOException e) {
      throw failed(new TreeMatchIOException(resource, e));
    }
  }

  /**
   * Load a document from a string.
   *
   * @param source name of the document, for error messages
   * @param xml the document
   * @return the document
   * @throws TreeMatchIOException if the string can not be parsed
   */
  public XmlDocument loadString(final String source, final String xml) {
    return parse(XmlDocumentParser.createStringReader(xml, source), source);
  }

  private XmlDocument parse(final XMLEventReader reader, final String source) {
    try {
      final XmlDocument document =
          new XmlDocumentParser.Builder(reader, source).maxDepth(config.maxDepth)
                                                      .includeNamespaceDeclarations(
                                                          config.includeNamespaceDeclarations)
                                                      .build()
                                                      .call();
      LOGGER.debug("Loaded {}", document);
      return document;
    } catch (final TreeMatchIOException e) {
      throw failed(e);
    } finally {
      close(reader, source);
    }
  }

  private static void close(final XMLEventReader reader, final String source) {
    try {
      reader.close();
    } catch (final XMLStreamException e) {
      LOGGER.warn("Failed to close reader on {}", source, e);
    }
  }

  /**
   * The failure is reported by whoever handles the exception, only traced here.
   */
  private static TreeMatchIOException failed(final TreeMatchIOException e) {
    LOGGER.debug("Load failed", e);
    return e;
  }
}
