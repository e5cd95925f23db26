package org.folio.xmlstream.util.stream;

import org.folio.xmlstream.util.dom.Element;

/**
 * Structural event produced by {@link IncrementalXmlParser}.
 */
public final class ParseEvent {

  public enum Type {
    ROOT_OPENED,
    CHILD_COMPLETED,
    ROOT_CLOSED,
    FAILURE
  }

  private final Type type;

  private final Element element;

  private final XmlParseException failure;

  private ParseEvent(Type type, Element element, XmlParseException failure) {
    this.type = type;
    this.element = element;
    this.failure = failure;
  }

  static ParseEvent rootOpened(Element root) {
    return new ParseEvent(Type.ROOT_OPENED, root, null);
  }

  static ParseEvent childCompleted(Element child) {
    return new ParseEvent(Type.CHILD_COMPLETED, child, null);
  }

  static ParseEvent rootClosed(Element root) {
    return new ParseEvent(Type.ROOT_CLOSED, root, null);
  }

  static ParseEvent failure(XmlParseException e) {
    return new ParseEvent(Type.FAILURE, null, e);
  }

  public Type getType() {
    return type;
  }

  /**
   * Element of the event.
   * @return root for ROOT_OPENED and ROOT_CLOSED; child for CHILD_COMPLETED; null for FAILURE
   */
  public Element getElement() {
    return element;
  }

  public XmlParseException getFailure() {
    return failure;
  }

  @Override
  public String toString() {
    if (type == Type.FAILURE) {
      return type + " " + failure.getMessage();
    }
    if (type == Type.CHILD_COMPLETED) {
      return type + " " + element.toXml();
    }
    return type + " " + element.toStartTag();
  }
}
