package org.folio.xmlstream.util.dom;

import org.folio.xmlstream.util.EncodeXmlText;

public class Text implements Node {

  private final StringBuilder data;

  public Text(String data) {
    this.data = new StringBuilder(data);
  }

  void append(String more) {
    data.append(more);
  }

  public String getData() {
    return data.toString();
  }

  @Override
  public String toXml() {
    return EncodeXmlText.encodeText(data.toString());
  }

  @Override
  public String toString() {
    return getData();
  }
}
