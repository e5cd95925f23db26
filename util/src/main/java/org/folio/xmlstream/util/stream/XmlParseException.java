package org.folio.xmlstream.util.stream;

import javax.xml.stream.Location;
import javax.xml.stream.XMLStreamException;

/**
 * Malformed XML on a stream. The stream cannot continue after this.
 */
public class XmlParseException extends RuntimeException {

  private final transient Location location;

  public XmlParseException(XMLStreamException e) {
    super(e.getMessage(), e);
    location = e.getLocation();
  }

  public XmlParseException(String msg) {
    super(msg);
    location = null;
  }

  /**
   * Where in the input the error was detected.
   * @return location or null if not known
   */
  public Location getLocation() {
    return location;
  }
}
