package org.folio.xmlstream.util;

public final class EncodeXmlText {

  private EncodeXmlText() { }

  private static final char REPLACEMENT_CHAR = '\uFFFD';

  /**
   * Encode character data for use in element content.
   * @param s string
   * @return encoded string
   */
  public static String encodeText(String s) {
    return encode(s, false);
  }

  /**
   * Encode character data for use in a quoted attribute value.
   * @param s string
   * @return encoded string
   */
  public static String encodeAttribute(String s) {
    return encode(s, true);
  }

  private static String encode(String s, boolean attribute) {
    StringBuilder sb = new StringBuilder(s.length());
    int len = s.length();
    for (int i = 0; i < len;) {
      int c = s.codePointAt(i);
      i += Character.charCount(c);
      if (c < 0x20) {
        if (c == '\t' || c == '\n' || c == '\r') {
          if (attribute) {
            // keep through attribute value normalization
            sb.append("&#x").append(Integer.toHexString(c)).append(';');
          } else {
            sb.append((char) c);
          }
        } else {
          sb.append(REPLACEMENT_CHAR);
        }
        continue;
      }
      switch (c) {
        case '&':
          sb.append("&amp;");
          break;
        case '<':
          sb.append("&lt;");
          break;
        case '>':
          sb.append("&gt;");
          break;
        case '"':
          sb.append(attribute ? "&quot;" : "\"");
          break;
        case '\'':
          sb.append(attribute ? "&apos;" : "'");
          break;
        default:
          if ((c >= 0xd800 && c <= 0xdfff) || c == 0xfffe || c == 0xffff) {
            // lone surrogate or non-character
            sb.append(REPLACEMENT_CHAR);
          } else {
            sb.appendCodePoint(c);
          }
      }
    }
    return sb.toString();
  }
}
