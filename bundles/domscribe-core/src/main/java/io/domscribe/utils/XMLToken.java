/**
 * Copyright (c) 2011, University of Konstanz, Distributed Systems Group All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without modification, are permitted
 * provided that the following conditions are met: * Redistributions of source code must retain the
 * above copyright notice, this list of conditions and the following disclaimer. * Redistributions
 * in binary form must reproduce the above copyright notice, this list of conditions and the
 * following disclaimer in the documentation and/or other materials provided with the distribution.
 * * Neither the name of the University of Konstanz nor the names of its contributors may be used to
 * endorse or promote products derived from this software without specific prior written permission.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND ANY EXPRESS OR
 * IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED WARRANTIES OF MERCHANTABILITY AND
 * FITNESS FOR A PARTICULAR PURPOSE ARE DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE
 * FOR ANY DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING,
 * BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS OF USE, DATA, OR PROFITS;
 * OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT,
 * STRICT LIABILITY, OR TORT (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE
 * OF THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */

package io.domscribe.utils;

import static java.util.Objects.requireNonNull;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility methods for XML names and the escaping of XML text.
 *
 * @author Christian Gruen, University of Konstanz
 * @author Johannes Lichtenberger, University of Konstanz
 */
public final class XMLToken {

  /** An {@code &} which starts an entity or character reference. */
  private static final Pattern REFERENCE =
      Pattern.compile("&(?:[A-Za-z_:][A-Za-z0-9_:.\\-]*|#[0-9]+|#x[0-9A-Fa-f]+);");

  /**
   * Private constructor.
   */
  private XMLToken() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Checks if the specified character is a name start character, as required e.g. by QName and
   * NCName.
   *
   * @param ch character
   * @return result of check
   */
  public static boolean isNCStartChar(final int ch) {
    return ch < 0x80
        ? ch >= 'A' && ch <= 'Z' || ch >= 'a' && ch <= 'z' || ch == '_'
        : ch < 0x300
            ? ch >= 0xC0 && ch != 0xD7 && ch != 0xF7
            : ch >= 0x370 && ch <= 0x37D || ch >= 0x37F && ch <= 0x1FFF
                || ch >= 0x200C && ch <= 0x200D || ch >= 0x2070 && ch <= 0x218F
                || ch >= 0x2C00 && ch <= 0x2EFF || ch >= 0x3001 && ch <= 0xD7FF
                || ch >= 0xF900 && ch <= 0xFDCF || ch >= 0xFDF0 && ch <= 0xFFFD
                || ch >= 0x10000 && ch <= 0xEFFFF;
  }

  /**
   * Checks if the specified character is an XML letter.
   *
   * @param ch character
   * @return result of check
   */
  public static boolean isNCChar(final int ch) {
    return isNCStartChar(ch) || (ch < 0x100
        ? digit(ch) || ch == '-' || ch == '.' || ch == 0xB7
        : ch >= 0x300 && ch <= 0x36F || ch == 0x203F || ch == 0x2040);
  }

  /**
   * Checks if the specified character is an XML first-letter.
   *
   * @param ch the letter to be checked
   * @return result of comparison
   */
  public static boolean isStartChar(final int ch) {
    return isNCStartChar(ch) || ch == ':';
  }

  /**
   * Checks if the specified character is an XML letter.
   *
   * @param ch the letter to be checked
   * @return result of comparison
   */
  public static boolean isChar(final int ch) {
    return isNCChar(ch) || ch == ':';
  }

  /**
   * Checks if the specified token is a valid NCName.
   *
   * @param value value to be checked
   * @return result of check
   */
  public static boolean isNCName(final String value) {
    final int length = value.length();
    return length != 0 && ncName(value, 0) == length;
  }

  /**
   * Checks if the specified token matches the {@code Name} production.
   *
   * @param value value to be checked
   * @return result of check
   */
  public static boolean isName(final String value) {
    final int length = value.length();
    for (int i = 0; i < length; i += Character.charCount(value.codePointAt(i))) {
      final int c = value.codePointAt(i);
      if (i == 0 ? !isStartChar(c) : !isChar(c)) {
        return false;
      }
    }
    return length != 0;
  }

  /**
   * Checks if the specified token matches the {@code QName} production, i.e. an NCName or two
   * NCNames separated by exactly one colon.
   *
   * @param value value to be checked
   * @return result of check
   */
  public static boolean isQName(final String value) {
    final int length = value.length();
    if (length == 0) {
      return false;
    }
    final int i = ncName(value, 0);
    if (i == length) {
      return true;
    }
    if (i == 0 || value.charAt(i) != ':') {
      return false;
    }
    final int j = ncName(value, i + 1);
    return j != i + 1 && j == length;
  }

  /**
   * Checks the specified token as an NCName.
   *
   * @param value value to be checked
   * @param start start position
   * @return end position
   */
  private static int ncName(final String value, final int start) {
    final int length = value.length();
    for (int i = start; i < length; i += Character.charCount(value.codePointAt(i))) {
      final int c = value.codePointAt(i);
      if (i == start ? !isNCStartChar(c) : !isNCChar(c)) {
        return i;
      }
    }
    return length;
  }

  /**
   * Checks if the specified character is a digit (0 - 9).
   *
   * @param ch the letter to be checked
   * @return result of comparison
   */
  public static boolean digit(final int ch) {
    return ch >= '0' && ch <= '9';
  }

  /**
   * Escape characters not allowed in attribute values.
   *
   * @param value the string value to escape
   * @param noDoubleEncoding leave existing entity and character references alone
   * @return escaped value
   * @throws NullPointerException if {@code value} is {@code null}
   */
  public static String escapeAttribute(final String value, final boolean noDoubleEncoding) {
    requireNonNull(value);
    final StringBuilder escape = new StringBuilder(value.length() + 16);
    for (int i = 0, length = value.length(); i < length; i++) {
      final char ch = value.charAt(i);
      switch (ch) {
        case '&' -> escapeAmpersand(value, i, noDoubleEncoding, escape);
        case '<' -> escape.append("&lt;");
        case '>' -> escape.append("&gt;");
        case '"' -> escape.append("&quot;");
        case '\t' -> escape.append("&#x9;");
        case '\n' -> escape.append("&#xA;");
        case '\r' -> escape.append("&#xD;");
        default -> escape.append(ch);
      }
    }
    return escape.toString();
  }

  /**
   * Escape characters not allowed text content.
   *
   * @param value the string value to escape
   * @param noDoubleEncoding leave existing entity and character references alone
   * @return escaped value
   * @throws NullPointerException if {@code value} is {@code null}
   */
  public static String escapeContent(final String value, final boolean noDoubleEncoding) {
    requireNonNull(value);
    final StringBuilder escape = new StringBuilder(value.length() + 16);
    for (int i = 0, length = value.length(); i < length; i++) {
      final char ch = value.charAt(i);
      switch (ch) {
        case '&' -> escapeAmpersand(value, i, noDoubleEncoding, escape);
        case '<' -> escape.append("&lt;");
        case '>' -> escape.append("&gt;");
        case '\r' -> escape.append("&#xD;");
        default -> escape.append(ch);
      }
    }
    return escape.toString();
  }

  private static void escapeAmpersand(final String value, final int index, final boolean noDoubleEncoding,
      final StringBuilder escape) {
    if (noDoubleEncoding) {
      final Matcher matcher = REFERENCE.matcher(value).region(index, value.length());
      if (matcher.lookingAt()) {
        escape.append('&');
        return;
      }
    }
    escape.append("&amp;");
  }
}
