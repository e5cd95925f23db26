package org.folio.xmlstream.util.dom;

import java.util.Map;
import javax.xml.namespace.QName;
import org.junit.Assert;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;

public class ElementTest {

  @Test
  public void names() {
    Element e = new Element("http://etherx.jabber.org/streams", "stream", "stream");
    assertThat(e.getTagName(), is("stream:stream"));
    assertThat(e.getQName(), is(new QName("http://etherx.jabber.org/streams", "stream")));
    assertThat(new Element(null, "a", "").getPrefix(), nullValue());
    assertThat(new Element("a").getUri(), is(""));
    Assert.assertThrows(IllegalArgumentException.class, () -> new Element(""));
  }

  @Test
  public void textMerged() {
    Element e = new Element("body");
    e.addText("a").addText("").addText("b");
    e.addElement("br");
    e.addText("c");
    assertThat(e.getChildren(), hasSize(3));
    assertThat(e.getText(), is("abc"));
    assertThat(e.toXml(), is("<body>ab<br/>c</body>"));
  }

  @Test
  public void children() {
    Element message = new Element("jabber:client", "message");
    Element body = message.addElement("body");
    assertThat(body.getParent(), sameInstance(message));
    assertThat(body.getUri(), is("jabber:client"));
    assertThat(message.getElement("body"), sameInstance(body));
    assertThat(message.getElement("subject"), nullValue());
    Assert.assertThrows(IllegalArgumentException.class, () -> new Element("x").addChild(body));
  }

  @Test
  public void serializeNamespaces() {
    Element root = new Element("http://etherx.jabber.org/streams", "stream", "stream")
        .declareNamespace("stream", "http://etherx.jabber.org/streams")
        .declareNamespace("", "jabber:client")
        .setAttribute("to", "example.com");
    assertThat(root.toStartTag(), is("<stream:stream xmlns:stream=\"http://etherx.jabber.org/streams\""
        + " xmlns=\"jabber:client\" to=\"example.com\">"));

    Element iq = new Element("jabber:client", "iq").setAttribute("type", "get");
    iq.addChild(new Element("jabber:iq:roster", "query"));
    iq.addElement("extra");
    assertThat(iq.toXml(), is("<iq xmlns=\"jabber:client\" type=\"get\">"
        + "<query xmlns=\"jabber:iq:roster\"/><extra/></iq>"));
  }

  @Test
  public void serializeEscapes() {
    Element e = new Element("a").setAttribute("v", "\"<&>'");
    e.addText("x < y & \"z\"");
    assertThat(e.toXml(), is("<a v=\"&quot;&lt;&amp;&gt;&apos;\">x &lt; y &amp; \"z\"</a>"));
    assertThat(e.toString(), is(e.toXml()));
  }

  @Test
  public void inheritedBindingsDeclaredWhenUsed() {
    Element features = new Element("http://etherx.jabber.org/streams", "features", "stream")
        .inheritNamespaces(Map.of("", "jabber:client",
            "stream", "http://etherx.jabber.org/streams", "db", "jabber:server:dialback"));
    Element mech = new Element("urn:ietf:params:xml:ns:xmpp-sasl", "mechanisms");
    mech.setAttribute("xml:lang", "en");
    features.addChild(mech);
    assertThat(features.getInheritedNamespaces().keySet(), containsInAnyOrder("stream", "db"));
    assertThat(features.toXml(), is("<stream:features xmlns:stream=\"http://etherx.jabber.org/streams\">"
        + "<mechanisms xmlns=\"urn:ietf:params:xml:ns:xmpp-sasl\" xml:lang=\"en\"/>"
        + "</stream:features>"));
    assertThat(features.toStartTag(),
        is("<stream:features xmlns:stream=\"http://etherx.jabber.org/streams\">"));
  }

  @Test
  public void inheritedBindingsForAttributesAndDescendants() {
    Element message = new Element("jabber:client", "message")
        .inheritNamespaces(Map.of("db", "jabber:server:dialback"))
        .declareNamespace("x", "urn:x");
    message.addChild(new Element("jabber:server:dialback", "result", "db"))
        .setAttribute("x:kind", "valid");
    assertThat(message.toXml(), is("<message xmlns=\"jabber:client\""
        + " xmlns:db=\"jabber:server:dialback\" xmlns:x=\"urn:x\">"
        + "<db:result x:kind=\"valid\"/></message>"));
  }
}
