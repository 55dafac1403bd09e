package org.integratedmodelling.ogc.capabilities;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Doubles;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.apache.commons.jxpath.JXPathContext;
import org.apache.commons.jxpath.Pointer;
import org.integratedmodelling.ogc.catalog.BoundingBox;
import org.integratedmodelling.ogc.exceptions.MalformedDocumentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * DOM and JXPath helpers shared by the capabilities parsers. OGC documents mix namespace prefixes
 * freely across versions and servers, so every lookup matches on the local element name only.
 */
public final class CapabilitiesXml {

  private static final Splitter WHITESPACE = Splitter.onPattern("\\s+").omitEmptyStrings();

  private static final Logger logger = LoggerFactory.getLogger(CapabilitiesXml.class);

  // the default handler prints to stderr before throwing
  private static final ErrorHandler ERROR_HANDLER =
      new ErrorHandler() {
        @Override
        public void warning(SAXParseException exception) {
          logger.debug("XML warning: {}", exception.getMessage());
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
          throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
          throw exception;
        }
      };

  private static final Set<String> EXCEPTION_REPORTS =
      Set.of("ServiceExceptionReport", "ExceptionReport");

  private CapabilitiesXml() {}

  /**
   * Parse a capabilities response. External DTDs and entities are never loaded: WMS 1.1.1
   * documents routinely declare a remote DTD.
   *
   * @throws MalformedDocumentException if the bytes are not well-formed XML or hold an OGC
   *     exception report instead of a capabilities document
   */
  public static Document parse(byte[] content) {
    Document document;
    try {
      DocumentBuilder builder = newFactory().newDocumentBuilder();
      builder.setErrorHandler(ERROR_HANDLER);
      document = builder.parse(new ByteArrayInputStream(content));
    } catch (SAXException | IOException e) {
      throw new MalformedDocumentException("Invalid capabilities document: " + e.getMessage(), e);
    } catch (ParserConfigurationException e) {
      throw new IllegalStateException("XML parser cannot be configured", e);
    }

    Element root = document.getDocumentElement();
    if (root == null) {
      throw new MalformedDocumentException("Capabilities document is empty");
    }
    if (EXCEPTION_REPORTS.contains(localName(root))) {
      List<String> messages = new ArrayList<>();
      for (Element exception : descendants(root, "ServiceException")) {
        messages.add(text(exception));
      }
      for (Element exception : descendants(root, "ExceptionText")) {
        messages.add(text(exception));
      }
      throw new MalformedDocumentException(
          "Service returned an exception report"
              + (messages.isEmpty() ? "" : ": " + String.join("; ", messages)));
    }
    return document;
  }

  private static DocumentBuilderFactory newFactory() throws ParserConfigurationException {
    DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
    factory.setNamespaceAware(true);
    factory.setValidating(false);
    factory.setExpandEntityReferences(false);
    factory.setXIncludeAware(false);
    factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
    factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
    factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
    factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
    return factory;
  }

  /** The version attribute of the root element, if any. */
  public static Optional<String> version(Document document) {
    Element root = document.getDocumentElement();
    String ret = root.getAttribute("version");
    if (ret.isBlank()) {
      ret = root.getAttribute("Version");
    }
    return ret.isBlank() ? Optional.empty() : Optional.of(ret.trim());
  }

  /** The node itself or its first descendant with the given local name, in document order. */
  public static Optional<Element> first(Node node, String localName) {
    Iterator<?> it = select(node, "descendant-or-self::*[local-name()='" + localName + "']");
    return it.hasNext() ? Optional.of((Element) ((Pointer) it.next()).getNode()) : Optional.empty();
  }

  /** The node itself and all its descendants with the given local name, in document order. */
  public static List<Element> descendants(Node node, String localName) {
    return collect(select(node, "descendant-or-self::*[local-name()='" + localName + "']"));
  }

  /** Direct children with the given local name, in document order. */
  public static List<Element> children(Node node, String localName) {
    return collect(select(node, "*[local-name()='" + localName + "']"));
  }

  /** All element children regardless of name. */
  public static List<Element> children(Node node) {
    return collect(select(node, "*"));
  }

  /** Trimmed text of the first child with the given name, or null if absent or blank. */
  public static String childText(Node node, String localName) {
    List<Element> children = children(node, localName);
    if (children.isEmpty()) {
      return null;
    }
    String ret = text(children.get(0));
    return ret.isEmpty() ? null : ret;
  }

  /** Trimmed text of the first child matching any of the names, in order of preference. */
  public static String childText(Node node, String... localNames) {
    for (String localName : localNames) {
      String ret = childText(node, localName);
      if (ret != null) {
        return ret;
      }
    }
    return null;
  }

  /** Non-blank trimmed texts of all children with the given name. */
  public static List<String> childTexts(Node node, String localName) {
    List<String> ret = new ArrayList<>();
    for (Element child : children(node, localName)) {
      String text = text(child);
      if (!text.isEmpty()) {
        ret.add(text);
      }
    }
    return ret;
  }

  public static String text(Element element) {
    String ret = element.getTextContent();
    return ret == null ? "" : ret.trim();
  }

  public static String localName(Node node) {
    return node.getLocalName() == null ? node.getNodeName() : node.getLocalName();
  }

  /**
   * Parse an OWS corner-pair box ({@code LowerCorner}/{@code UpperCorner} children holding "x y").
   *
   * @return the box, or empty if a corner is missing or not numeric
   */
  public static Optional<BoundingBox> cornerPair(Element box, String lower, String upper) {
    double[] lowerCorner = coordinates(childText(box, lower));
    double[] upperCorner = coordinates(childText(box, upper));
    if (lowerCorner == null || upperCorner == null) {
      return Optional.empty();
    }
    return Optional.of(
        BoundingBox.wgs84(lowerCorner[0], lowerCorner[1], upperCorner[0], upperCorner[1]));
  }

  /** The first two numbers of a whitespace-separated coordinate string, or null. */
  public static double[] coordinates(String text) {
    if (text == null) {
      return null;
    }
    List<String> tokens = WHITESPACE.splitToList(text);
    if (tokens.size() < 2) {
      return null;
    }
    Double x = Doubles.tryParse(tokens.get(0));
    Double y = Doubles.tryParse(tokens.get(1));
    return x == null || y == null ? null : new double[] {x, y};
  }

  /** Parse a number, returning null when absent or malformed. */
  public static Double number(String text) {
    return text == null ? null : Doubles.tryParse(text.trim());
  }

  /** Split a whitespace-separated list of codes. */
  public static List<String> tokens(String text) {
    return text == null ? ImmutableList.of() : WHITESPACE.splitToList(text);
  }

  private static Iterator<?> select(Node node, String xpath) {
    JXPathContext context = JXPathContext.newContext(node);
    context.setLenient(true);
    return context.iteratePointers(xpath);
  }

  private static List<Element> collect(Iterator<?> pointers) {
    List<Element> ret = new ArrayList<>();
    while (pointers.hasNext()) {
      Object node = ((Pointer) pointers.next()).getNode();
      if (node instanceof Element) {
        ret.add((Element) node);
      }
    }
    return ret;
  }
}
