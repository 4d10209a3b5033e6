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

package io.domscribe.settings;

/**
 * Holding all markup fragments for building up XML text.
 *
 * @author Sebastian Graf, University of Konstanz
 *
 */
public enum CharsForSerializing {

  /** " ". */
  SPACE(" "),

  /** "&lt;". */
  OPEN("<"),

  /** "&gt;". */
  CLOSE(">"),

  /** "/". */
  SLASH("/"),

  /** "=". */
  EQUAL("="),

  /** "\"". */
  QUOTE("\""),

  /** "=\"". */
  EQUAL_QUOTE(EQUAL.toString(), QUOTE.toString()),

  /** "&lt;/". */
  OPEN_SLASH(OPEN.toString(), SLASH.toString()),

  /** "/&gt;". */
  SLASH_CLOSE(SLASH.toString(), CLOSE.toString()),

  /** " /&gt;". */
  SPACE_SLASH_CLOSE(SPACE.toString(), SLASH.toString(), CLOSE.toString()),

  /** "&lt;!--". */
  OPENCOMMENT(OPEN.toString(), "!--"),

  /** "--&gt;". */
  CLOSECOMMENT("--", CLOSE.toString()),

  /** "&lt;?". */
  OPENPI(OPEN.toString(), "?"),

  /** "?&gt;". */
  CLOSEPI("?", CLOSE.toString()),

  /** "&lt;![CDATA[". */
  OPENCDATA(OPEN.toString(), "![CDATA["),

  /** "]]&gt;". */
  CLOSECDATA("]]", CLOSE.toString()),

  /** "&lt;!DOCTYPE ". */
  OPENDOCTYPE(OPEN.toString(), "!DOCTYPE", SPACE.toString()),

  /** "&lt;?xml version=\"". */
  OPENXMLDECL(OPENPI.toString(), "xml version", EQUAL.toString(), QUOTE.toString());

  /** The markup. */
  private final String markup;

  /**
   * Private constructor.
   *
   * @param parts the parts the markup is concatenated from
   */
  CharsForSerializing(final String... parts) {
    markup = String.join("", parts);
  }

  /**
   * Length of the markup in characters.
   *
   * @return the length
   */
  public int length() {
    return markup.length();
  }

  @Override
  public String toString() {
    return markup;
  }
}
