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

package io.domscribe.service.serialize;

import com.google.common.collect.ImmutableMap;

/**
 * Escaping of JSON string contents.
 */
public final class StringValue {

  private static final ImmutableMap<Character, String> SHORT_ESCAPES =
      ImmutableMap.<Character, String>builder()
          .put('"', "\\\"")
          .put('\\', "\\\\")
          .put('\b', "\\b")
          .put('\f', "\\f")
          .put('\n', "\\n")
          .put('\r', "\\r")
          .put('\t', "\\t")
          .build();

  private StringValue() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Escapes quotes, backslashes and all control characters below U+0020.
   *
   * @param value the raw string
   * @return the escaped string, without surrounding quotes
   */
  public static String escape(final String value) {
    final StringBuilder sb = new StringBuilder(value.length());
    for (int i = 0, len = value.length(); i < len; i++) {
      final char ch = value.charAt(i);
      final String escaped = SHORT_ESCAPES.get(ch);
      if (escaped != null) {
        sb.append(escaped);
      } else if (ch < 0x20) {
        final String hex = Integer.toHexString(ch).toUpperCase();
        sb.append("\\u").append("0".repeat(4 - hex.length())).append(hex);
      } else {
        sb.append(ch);
      }
    }
    return sb.toString();
  }
}
