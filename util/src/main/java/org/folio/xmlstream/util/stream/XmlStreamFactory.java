package org.folio.xmlstream.util.stream;

/**
 * Builds {@link XmlStream} instances with this factory's bootstraps installed.
 */
public class XmlStreamFactory extends AbstractProtocolFactory<XmlStream> {

  @Override
  protected XmlStream newProtocol() {
    return new XmlStream();
  }
}
