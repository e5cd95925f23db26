package org.folio.xmlstream.util.dom;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.xml.namespace.QName;
import org.folio.xmlstream.util.EncodeXmlText;

/**
 * Minimal XML element tree.
 *
 * <p>An element has a namespace URI, a local name and optionally the prefix it was read
 * with. Attributes are kept in document order, keyed by their qualified name as written
 * (for example {@code xml:lang}). Namespace declarations made on the element are kept
 * separately so that a parsed tree serializes back with the same bindings.
 */
public class Element implements Node {

  private final String uri;

  private final String name;

  private final String prefix;

  private final Map<String, String> attributes = new LinkedHashMap<>();

  private final Map<String, String> namespaces = new LinkedHashMap<>();

  private final Map<String, String> inherited = new LinkedHashMap<>();

  private final List<Node> children = new ArrayList<>();

  private Element parent;

  /**
   * Element without namespace.
   * @param name local name
   */
  public Element(String name) {
    this("", name, null);
  }

  public Element(String uri, String name) {
    this(uri, name, null);
  }

  /**
   * Create element.
   * @param uri namespace URI; null is treated as no namespace
   * @param name local name
   * @param prefix prefix as written; null or empty for unprefixed
   */
  public Element(String uri, String name, String prefix) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("Element name must not be empty");
    }
    this.uri = uri == null ? "" : uri;
    this.name = name;
    this.prefix = prefix == null || prefix.isEmpty() ? null : prefix;
  }

  public String getUri() {
    return uri;
  }

  public String getName() {
    return name;
  }

  public String getPrefix() {
    return prefix;
  }

  public QName getQName() {
    return new QName(uri, name, prefix == null ? "" : prefix);
  }

  /**
   * Name as written in a tag.
   * @return prefix:name or name
   */
  public String getTagName() {
    return prefix == null ? name : prefix + ":" + name;
  }

  public Element getParent() {
    return parent;
  }

  public Element setAttribute(String qname, String value) {
    attributes.put(qname, value);
    return this;
  }

  public String getAttribute(String qname) {
    return attributes.get(qname);
  }

  public Map<String, String> getAttributes() {
    return Collections.unmodifiableMap(attributes);
  }

  /**
   * Declare namespace on this element.
   * @param nsPrefix prefix; empty string for the default namespace
   * @param nsUri namespace URI
   * @return this element
   */
  public Element declareNamespace(String nsPrefix, String nsUri) {
    namespaces.put(nsPrefix == null ? "" : nsPrefix, nsUri);
    return this;
  }

  public Map<String, String> getNamespaces() {
    return Collections.unmodifiableMap(namespaces);
  }

  /**
   * Remember prefix bindings that were in scope where this element was read but are
   * declared on an ancestor it is no longer attached to. When this element is serialized
   * as the top of a document, the bindings its subtree uses are declared on it.
   * @param bindings prefix to URI; the default namespace entry is ignored
   * @return this element
   */
  public Element inheritNamespaces(Map<String, String> bindings) {
    for (Map.Entry<String, String> binding : bindings.entrySet()) {
      if (!binding.getKey().isEmpty()) {
        inherited.put(binding.getKey(), binding.getValue());
      }
    }
    return this;
  }

  public Map<String, String> getInheritedNamespaces() {
    return Collections.unmodifiableMap(inherited);
  }

  /**
   * Append child element.
   * @param child element; must not already have a parent
   * @return the child
   */
  public Element addChild(Element child) {
    if (child.parent != null) {
      throw new IllegalArgumentException("Element <" + child.getTagName() + "> already has a parent");
    }
    child.parent = this;
    children.add(child);
    return child;
  }

  /**
   * Create and append child element in the namespace of this element.
   * @param childName local name
   * @return the new child
   */
  public Element addElement(String childName) {
    return addChild(new Element(uri, childName));
  }

  /**
   * Append character data. Merged with a directly preceding text node.
   * @param data text
   * @return this element
   */
  public Element addText(String data) {
    if (data.isEmpty()) {
      return this;
    }
    if (!children.isEmpty() && children.get(children.size() - 1) instanceof Text) {
      ((Text) children.get(children.size() - 1)).append(data);
    } else {
      children.add(new Text(data));
    }
    return this;
  }

  public List<Node> getChildren() {
    return Collections.unmodifiableList(children);
  }

  /**
   * Child elements, text skipped.
   * @return elements in document order
   */
  public List<Element> getElements() {
    List<Element> elements = new ArrayList<>();
    for (Node node : children) {
      if (node instanceof Element) {
        elements.add((Element) node);
      }
    }
    return elements;
  }

  /**
   * First child element with local name.
   * @param childName local name
   * @return element or null if not found
   */
  public Element getElement(String childName) {
    for (Node node : children) {
      if (node instanceof Element && ((Element) node).name.equals(childName)) {
        return (Element) node;
      }
    }
    return null;
  }

  /**
   * Concatenated direct character data.
   * @return text; empty if none
   */
  public String getText() {
    StringBuilder sb = new StringBuilder();
    for (Node node : children) {
      if (node instanceof Text) {
        sb.append(((Text) node).getData());
      }
    }
    return sb.toString();
  }

  /**
   * Serialize the opening tag only.
   *
   * <p>Used for the header of a stream whose root is never closed by the serializer.
   * @return start tag
   */
  public String toStartTag() {
    StringBuilder sb = new StringBuilder();
    startTag(sb, null, true);
    sb.append('>');
    return sb.toString();
  }

  @Override
  public String toXml() {
    StringBuilder sb = new StringBuilder();
    serialize(sb, null, true);
    return sb.toString();
  }

  @Override
  public String toString() {
    return toXml();
  }

  private void serialize(StringBuilder sb, String defaultUri, boolean top) {
    String inScope = startTag(sb, defaultUri, top);
    if (children.isEmpty()) {
      sb.append("/>");
      return;
    }
    sb.append('>');
    for (Node node : children) {
      if (node instanceof Element) {
        ((Element) node).serialize(sb, inScope, false);
      } else {
        sb.append(node.toXml());
      }
    }
    sb.append("</").append(getTagName()).append('>');
  }

  /**
   * Write start tag without the closing angle bracket.
   * @return default namespace in scope for children
   */
  private String startTag(StringBuilder sb, String defaultUri, boolean top) {
    sb.append('<').append(getTagName());
    String inScope = defaultUri;
    if (namespaces.containsKey("")) {
      inScope = namespaces.get("");
    } else if (prefix == null && !uri.equals(defaultUri == null ? "" : defaultUri)) {
      sb.append(" xmlns=\"").append(EncodeXmlText.encodeAttribute(uri)).append('"');
      inScope = uri;
    }
    if (top && !inherited.isEmpty()) {
      Set<String> used = new LinkedHashSet<>();
      usedPrefixes(used);
      for (String p : used) {
        String nsUri = inherited.get(p);
        if (nsUri != null && !namespaces.containsKey(p)) {
          sb.append(" xmlns:").append(p).append("=\"")
              .append(EncodeXmlText.encodeAttribute(nsUri))
              .append('"');
        }
      }
    }
    for (Map.Entry<String, String> ns : namespaces.entrySet()) {
      sb.append(ns.getKey().isEmpty() ? " xmlns" : " xmlns:" + ns.getKey())
          .append("=\"")
          .append(EncodeXmlText.encodeAttribute(ns.getValue()))
          .append('"');
    }
    for (Map.Entry<String, String> attribute : attributes.entrySet()) {
      sb.append(' ')
          .append(attribute.getKey())
          .append("=\"")
          .append(EncodeXmlText.encodeAttribute(attribute.getValue()))
          .append('"');
    }
    return inScope;
  }

  private void usedPrefixes(Set<String> used) {
    if (prefix != null) {
      used.add(prefix);
    }
    for (String qname : attributes.keySet()) {
      int colon = qname.indexOf(':');
      if (colon > 0) {
        String p = qname.substring(0, colon);
        if (!"xml".equals(p) && !"xmlns".equals(p)) {
          used.add(p);
        }
      }
    }
    for (Node node : children) {
      if (node instanceof Element) {
        ((Element) node).usedPrefixes(used);
      }
    }
  }
}
