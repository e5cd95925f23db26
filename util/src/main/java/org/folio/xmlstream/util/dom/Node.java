package org.folio.xmlstream.util.dom;

/**
 * Child of an {@link Element}: either an element or character data.
 */
public interface Node {

  /**
   * Serialize this node.
   * @return XML string
   */
  String toXml();
}
