package org.folio.xmlstream.util.stream;

import com.fasterxml.aalto.AsyncByteArrayFeeder;
import com.fasterxml.aalto.AsyncXMLInputFactory;
import com.fasterxml.aalto.AsyncXMLStreamReader;
import com.fasterxml.aalto.stax.InputFactoryImpl;
import io.vertx.core.buffer.Buffer;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import org.folio.xmlstream.util.dom.Element;

/**
 * Incremental parser of a single root element carrying a sequence of children.
 *
 * <p>Based on the non-blocking reader of <a href="https://github.com/FasterXML/aalto-xml">Aalto XML</a>.
 * Bytes are fed as they arrive and every call returns the structural events the new bytes
 * completed. Only direct children of the root are reported; deeper elements are part of
 * the tree of the child they belong to.
 *
 * <p>The first failure is final: every later {@link #feed(Buffer)} returns it again
 * without consulting the tokenizer.
 */
public class IncrementalXmlParser {

  private final AsyncXMLStreamReader<AsyncByteArrayFeeder> parser;

  private final Deque<Element> stack = new ArrayDeque<>();

  private Element root;

  private ParseEvent failure;

  /**
   * Create parser for a new stream.
   */
  public IncrementalXmlParser() {
    AsyncXMLInputFactory factory = new InputFactoryImpl();
    parser = factory.createAsyncForByteArray();
  }

  /**
   * Feed next chunk.
   * @param chunk bytes as received; may split any XML construct
   * @return events completed by this chunk, in document order; empty if none
   */
  public List<ParseEvent> feed(Buffer chunk) {
    if (failure != null) {
      return Collections.singletonList(failure);
    }
    byte[] bytes = chunk.getBytes();
    if (bytes.length == 0) {
      return Collections.emptyList();
    }
    List<ParseEvent> events = new ArrayList<>();
    try {
      parser.getInputFeeder().feedInput(bytes, 0, bytes.length);
      int event;
      while ((event = parser.next()) != AsyncXMLStreamReader.EVENT_INCOMPLETE) {
        handle(event, events);
      }
    } catch (XMLStreamException e) {
      fail(new XmlParseException(e), events);
    } catch (XmlParseException e) {
      fail(e, events);
    }
    return events;
  }

  /**
   * Whether the parser has failed and no longer accepts input.
   * @return true after a failure
   */
  public boolean isFailed() {
    return failure != null;
  }

  /**
   * Number of currently open elements, the root included.
   * @return depth
   */
  public int getDepth() {
    return stack.size();
  }

  private void fail(XmlParseException e, List<ParseEvent> events) {
    failure = ParseEvent.failure(e);
    stack.clear();
    events.add(failure);
  }

  private void handle(int event, List<ParseEvent> events) {
    switch (event) {
      case XMLStreamConstants.START_ELEMENT:
        startElement(events);
        break;
      case XMLStreamConstants.END_ELEMENT:
        endElement(events);
        break;
      case XMLStreamConstants.CHARACTERS:
      case XMLStreamConstants.CDATA:
      case XMLStreamConstants.SPACE:
        // text directly under the root is not kept
        if (stack.size() > 1) {
          stack.peek().addText(parser.getText());
        }
        break;
      default:
    }
  }

  private void startElement(List<ParseEvent> events) {
    Element element = new Element(parser.getNamespaceURI(), parser.getLocalName(),
        parser.getPrefix());
    for (int i = 0; i < parser.getNamespaceCount(); i++) {
      String prefix = parser.getNamespacePrefix(i);
      element.declareNamespace(prefix == null ? "" : prefix, parser.getNamespaceURI(i));
    }
    for (int i = 0; i < parser.getAttributeCount(); i++) {
      String prefix = parser.getAttributePrefix(i);
      String localName = parser.getAttributeLocalName(i);
      String qname = prefix == null || prefix.isEmpty() ? localName : prefix + ":" + localName;
      element.setAttribute(qname, parser.getAttributeValue(i));
    }
    if (root == null) {
      root = element;
      stack.push(element);
      events.add(ParseEvent.rootOpened(element));
      return;
    }
    if (stack.isEmpty()) {
      throw new XmlParseException("Only one root element allowed, got <"
          + element.getTagName() + ">");
    }
    // direct children of the root are handed out on completion, not attached to it
    if (stack.size() > 1) {
      stack.peek().addChild(element);
    } else {
      element.inheritNamespaces(root.getNamespaces());
    }
    stack.push(element);
  }

  private void endElement(List<ParseEvent> events) {
    // the tokenizer has already checked that the end tag matches
    Element element = stack.pop();
    if (stack.isEmpty()) {
      events.add(ParseEvent.rootClosed(element));
    } else if (stack.size() == 1) {
      events.add(ParseEvent.childCompleted(element));
    }
  }
}
