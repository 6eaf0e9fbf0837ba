package io.treematch.service.xml;

import com.google.common.base.CharMatcher;
import io.treematch.exception.TreeMatchIOException;
import io.treematch.node.ElementNode;
import io.treematch.node.XmlDocument;
import io.treematch.settings.Constants;
import org.checkerframework.checker.index.qual.Positive;

import javax.xml.namespace.QName;
import javax.xml.stream.XMLEventReader;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.events.Attribute;
import javax.xml.stream.events.Namespace;
import javax.xml.stream.events.StartElement;
import javax.xml.stream.events.XMLEvent;
import java.io.InputStream;
import java.io.StringReader;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.concurrent.Callable;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Builds an immutable {@link XmlDocument} from an {@link XMLEventReader}.
 *
 * <p>
 * Element and attribute names are kept as written, including their prefixes. The direct text of an
 * element is the concatenation of its character and CDATA runs, where runs consisting of whitespace
 * only are dropped as indentation. Comments, processing instructions and the prolog are skipped.
 * </p>
 *
 * <p>
 * Parsing is namespace aware, so a prefix without a namespace declaration in scope makes the
 * document malformed.
 * </p>
 */
public final class XmlDocumentParser implements Callable<XmlDocument> {

  /** Whitespace as defined by the XML specification. */
  private static final CharMatcher XML_WHITESPACE = CharMatcher.anyOf(" \t\r\n");

  /** {@link XMLEventReader} implementation. */
  private final XMLEventReader reader;

  /** Name of the source, for error messages. */
  private final String source;

  /** Maximum element nesting. */
  private final int maxDepth;

  /** Determines if namespace declarations are added as attributes. */
  private final boolean includeNamespaceDeclarations;

  /**
   * Builder to build an {@link XmlDocumentParser} instance.
   */
  public static class Builder {

    /** {@link XMLEventReader} implementation. */
    private final XMLEventReader reader;

    /** Name of the source. */
    private final String source;

    /** Maximum element nesting. */
    private int maxDepth = Constants.DEFAULT_MAX_DEPTH;

    /** Determines if namespace declarations are added as attributes. */
    private boolean includeNamespaceDeclarations = true;

    /**
     * Constructor.
     *
     * @param reader {@link XMLEventReader} implementation
     * @param source name of the source, used in error messages
     */
    public Builder(final XMLEventReader reader, final String source) {
      this.reader = requireNonNull(reader);
      this.source = requireNonNull(source);
    }

    /**
     * Set the maximum element nesting, the document element has depth one.
     *
     * @param maxDepth the maximum depth
     * @return this builder instance
     */
    public Builder maxDepth(final @Positive int maxDepth) {
      checkArgument(maxDepth > 0, "maxDepth must be > 0: %s", maxDepth);
      this.maxDepth = maxDepth;
      return this;
    }

    /**
     * Include namespace declarations as {@code xmlns} attributes or not (default: yes).
     *
     * @param include include namespace declarations
     * @return this builder instance
     */
    public Builder includeNamespaceDeclarations(final boolean include) {
      includeNamespaceDeclarations = include;
      return this;
    }

    /**
     * Build an instance.
     *
     * @return {@link XmlDocumentParser} instance
     */
    public XmlDocumentParser build() {
      return new XmlDocumentParser(this);
    }
  }

  private XmlDocumentParser(final Builder builder) {
    reader = builder.reader;
    source = builder.source;
    maxDepth = builder.maxDepth;
    includeNamespaceDeclarations = builder.includeNamespaceDeclarations;
  }

  /**
   * An element under construction.
   */
  private static final class OpenElement {
    final ElementNode.Builder builder;

    /** The current text run, not yet known to be content. */
    final StringBuilder run = new StringBuilder();

    OpenElement(final ElementNode.Builder builder) {
      this.builder = builder;
    }

    void flushRun() {
      if (!XML_WHITESPACE.matchesAllOf(run)) {
        builder.text(run.toString());
      }
      run.setLength(0);
    }
  }

  /**
   * Parse the whole document.
   *
   * @return the parsed document
   * @throws TreeMatchIOException if the document is malformed, has no document element or is nested
   *         too deeply
   */
  @Override
  public XmlDocument call() {
    try {
      final Deque<OpenElement> open = new ArrayDeque<>();
      ElementNode root = null;

      while (reader.hasNext()) {
        final XMLEvent event = reader.nextEvent();

        switch (event.getEventType()) {
          case XMLStreamConstants.START_ELEMENT -> {
            if (open.size() == maxDepth) {
              throw new TreeMatchIOException(source, "maximum element depth of " + maxDepth + " exceeded");
            }
            if (!open.isEmpty()) {
              open.peek().flushRun();
            }
            open.push(new OpenElement(newElement(event.asStartElement())));
          }
          case XMLStreamConstants.END_ELEMENT -> {
            final OpenElement closed = open.pop();
            closed.flushRun();
            final ElementNode element = closed.builder.build();
            if (open.isEmpty()) {
              root = element;
            } else {
              open.peek().builder.child(element);
            }
          }
          case XMLStreamConstants.CHARACTERS, XMLStreamConstants.CDATA, XMLStreamConstants.SPACE -> {
            if (!open.isEmpty()) {
              open.peek().run.append(event.asCharacters().getData());
            }
          }
          default -> {
            // Comments, processing instructions and the prolog do not take part.
          }
        }
      }

      if (root == null) {
        throw new TreeMatchIOException(source, "no document element");
      }
      return new XmlDocument(source, root);
    } catch (final XMLStreamException e) {
      throw new TreeMatchIOException(source, e);
    }
  }

  private ElementNode.Builder newElement(final StartElement event) {
    final ElementNode.Builder builder = ElementNode.newBuilder(qualifiedName(event.getName()));

    if (includeNamespaceDeclarations) {
      for (final Iterator<Namespace> it = event.getNamespaces(); it.hasNext();) {
        final Namespace namespace = it.next();
        final String prefix = namespace.getPrefix();
        builder.attribute(prefix == null || prefix.isEmpty()
            ? Constants.XMLNS
            : Constants.XMLNS + ":" + prefix, namespace.getNamespaceURI());
      }
    }

    for (final Iterator<Attribute> it = event.getAttributes(); it.hasNext();) {
      final Attribute attribute = it.next();
      builder.attribute(qualifiedName(attribute.getName()), attribute.getValue());
    }

    return builder;
  }

  private static String qualifiedName(final QName name) {
    final String prefix = name.getPrefix();
    return prefix == null || prefix.isEmpty()
        ? name.getLocalPart()
        : prefix + ":" + name.getLocalPart();
  }

  /**
   * Create a new {@link XMLEventReader} instance on a stream.
   *
   * @param in the input stream, not closed by the reader
   * @param source name of the source, for error messages
   * @return an {@link XMLEventReader}
   * @throws TreeMatchIOException if creating the xml event reader fails
   */
  public static XMLEventReader createStreamReader(final InputStream in, final String source) {
    requireNonNull(in);
    try {
      return newInputFactory().createXMLEventReader(in);
    } catch (final XMLStreamException e) {
      throw new TreeMatchIOException(source, e);
    }
  }

  /**
   * Create a new {@link XMLEventReader} instance on a string.
   *
   * @param xmlString the XML document as a string to parse
   * @param source name of the source, for error messages
   * @return an {@link XMLEventReader}
   * @throws TreeMatchIOException if creating the xml event reader fails
   */
  public static XMLEventReader createStringReader(final String xmlString, final String source) {
    requireNonNull(xmlString);
    try {
      return newInputFactory().createXMLEventReader(new StringReader(xmlString));
    } catch (final XMLStreamException e) {
      throw new TreeMatchIOException(source, e);
    }
  }

  private static XMLInputFactory newInputFactory() {
    final XMLInputFactory factory = XMLInputFactory.newInstance();
    factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, true);
    factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
    factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
    factory.setProperty(XMLInputFactory.IS_REPLACING_ENTITY_REFERENCES, true);
    factory.setProperty(XMLInputFactory.IS_COALESCING, true);
    return factory;
  }
}
