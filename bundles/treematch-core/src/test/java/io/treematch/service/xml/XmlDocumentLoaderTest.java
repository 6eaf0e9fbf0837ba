package io.treematch.service.xml;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.treematch.access.DocumentMatcher;
import io.treematch.access.MatcherConfiguration;
import io.treematch.exception.TreeMatchIOException;
import io.treematch.node.XmlDocument;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class XmlDocumentLoaderTest {

  private final XmlDocumentLoader loader = new XmlDocumentLoader(MatcherConfiguration.defaults());

  @TempDir
  Path tempDir;

  @Test
  public void testLoadResources() {
    final XmlDocument settings = loader.loadResource("/documents/settings.xml");
    final XmlDocument reordered = loader.loadResource("/documents/settings-reordered.xml");
    assertEquals("/documents/settings.xml", settings.getSource());
    assertEquals("settings", settings.getRoot().getName());
    assertTrue(DocumentMatcher.withDefaults().matchLoosely(settings, reordered));
  }

  @Test
  public void testLoadFile() throws IOException {
    final Path file = tempDir.resolve("doc.xml");
    Files.writeString(file, "<r a=\"1\"><x/></r>");
    final XmlDocument document = loader.load(file);
    assertEquals(file.toString(), document.getSource());
    assertTrue(DocumentMatcher.withDefaults().matchLoosely(document, loader.loadString("inline", "<r a='1'><x></x></r>")));
  }

  @Test
  public void testBrokenResource() {
    final TreeMatchIOException e =
        assertThrows(TreeMatchIOException.class, () -> loader.loadResource("/documents/broken.xml"));
    assertEquals("/documents/broken.xml", e.getSource());
  }

  @Test
  public void testFailuresAreLeftToTheCaller() {
    final Logger logger = (Logger) LoggerFactory.getLogger(XmlDocumentLoader.class);
    final Level level = logger.getLevel();
    final ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    logger.setLevel(Level.DEBUG);
    try {
      assertThrows(TreeMatchIOException.class, () -> loader.loadResource("/documents/broken.xml"));
      assertThrows(TreeMatchIOException.class, () -> loader.load(tempDir.resolve("missing.xml")));
    } finally {
      logger.detachAppender(appender);
      logger.setLevel(level);
    }

    assertEquals(2, appender.list.size());
    assertTrue(appender.list.stream().allMatch(event -> event.getLevel() == Level.DEBUG));
  }

  @Test
  public void testMissingSources() {
    assertThrows(TreeMatchIOException.class, () -> loader.loadResource("/documents/missing.xml"));
    assertThrows(TreeMatchIOException.class, () -> loader.load(tempDir.resolve("missing.xml")));
  }

  @Test
  public void testDepthFromConfiguration() {
    final XmlDocumentLoader shallow = new XmlDocumentLoader(MatcherConfiguration.newBuilder().maxDepth(1).build());
    assertThrows(TreeMatchIOException.class, () -> shallow.loadString("nested", "<r><x/></r>"));
  }
}
