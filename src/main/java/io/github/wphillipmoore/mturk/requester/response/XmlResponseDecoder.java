package io.github.wphillipmoore.mturk.requester.response;

import io.github.wphillipmoore.mturk.requester.TransportResponse;
import io.github.wphillipmoore.mturk.requester.exception.MturkUnclassifiedException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * Converts XML response bodies into generic, ordered trees.
 *
 * <p>The tree is the root element's content: each child element becomes an entry keyed by its
 * local name, in document order. Sibling elements sharing a name collapse into a {@link List}. An
 * element without child elements becomes its trimmed text, or an empty map when it has no text.
 * Attributes are dropped. No schema is checked.
 */
public final class XmlResponseDecoder {

  private static final String DISALLOW_DOCTYPE =
      "http://apache.org/xml/features/disallow-doctype-decl";

  private XmlResponseDecoder() {}

  /**
   * Decodes a response body.
   *
   * @param response the transport response
   * @return the decoded tree, mutable and ordered
   * @throws MturkUnclassifiedException if the body is empty or not well-formed XML
   */
  public static Map<String, Object> decode(TransportResponse response) {
    String body = response.body();
    if (body.isBlank()) {
      throw new MturkUnclassifiedException("Response body is empty", response.statusCode(), body);
    }
    Element root;
    try {
      root =
          newDocumentBuilder().parse(new InputSource(new StringReader(body))).getDocumentElement();
    } catch (SAXException | IOException e) {
      throw new MturkUnclassifiedException(
          "Response body is not well-formed XML", response.statusCode(), body, e);
    }
    Object tree = convert(root);
    if (tree instanceof Map) {
      @SuppressWarnings("unchecked")
      Map<String, Object> result = (Map<String, Object>) tree;
      return result;
    }
    return new LinkedHashMap<>();
  }

  static Object convert(Element element) {
    Map<String, Object> children = new LinkedHashMap<>();
    StringBuilder text = new StringBuilder();
    NodeList nodes = element.getChildNodes();
    for (int i = 0; i < nodes.getLength(); i++) {
      Node node = nodes.item(i);
      if (node instanceof Element child) {
        addChild(children, nameOf(child), convert(child));
      } else if (node.getNodeType() == Node.TEXT_NODE
          || node.getNodeType() == Node.CDATA_SECTION_NODE) {
        text.append(node.getNodeValue());
      }
    }
    if (!children.isEmpty()) {
      return children;
    }
    String trimmed = text.toString().trim();
    return trimmed.isEmpty() ? children : trimmed;
  }

  @SuppressWarnings("unchecked")
  private static void addChild(Map<String, Object> children, String name, Object value) {
    Object existing = children.get(name);
    if (existing == null) {
      children.put(name, value);
    } else if (existing instanceof List) {
      ((List<Object>) existing).add(value);
    } else {
      List<Object> repeated = new ArrayList<>();
      repeated.add(existing);
      repeated.add(value);
      children.put(name, repeated);
    }
  }

  private static String nameOf(Element element) {
    String localName = element.getLocalName();
    return localName != null ? localName : element.getTagName();
  }

  private static DocumentBuilder newDocumentBuilder() {
    try {
      DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
      factory.setNamespaceAware(true);
      factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      factory.setFeature(DISALLOW_DOCTYPE, true);
      factory.setExpandEntityReferences(false);
      factory.setXIncludeAware(false);
      DocumentBuilder builder = factory.newDocumentBuilder();
      builder.setErrorHandler(new FailingErrorHandler());
      return builder;
    } catch (ParserConfigurationException e) {
      throw new IllegalStateException("XML parser unavailable", e);
    }
  }

  /** Turns every parser diagnostic into a parse failure instead of printing it to stderr. */
  static final class FailingErrorHandler implements ErrorHandler {

    @Override
    public void warning(SAXParseException exception) throws SAXException {
      throw exception;
    }

    @Override
    public void error(SAXParseException exception) throws SAXException {
      throw exception;
    }

    @Override
    public void fatalError(SAXParseException exception) throws SAXException {
      throw exception;
    }
  }
}
