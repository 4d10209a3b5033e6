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

import static java.util.Objects.requireNonNull;

import io.domscribe.node.Node;
import java.util.Iterator;
import java.util.Map;

/**
 * Serializes a subtree into JSON text by rendering the ordered form of the {@link MapWriter}.
 * When pretty printing, a map with at most one scalar below it is written on one line.
 *
 * @author Johannes Lichtenberger
 */
public final class JsonWriter extends AbstractWriter<String> {

  public JsonWriter(final BuilderOptions builderOptions) {
    super(builderOptions);
  }

  @Override
  public String serialize(final Node node, final WriterOptions options) {
    requireNonNull(node);
    final WriterOptions mapOptions = options.toBuilder().format(Format.MAP).build();
    final XmlSerializedValue value = new MapWriter(builderOptions).serialize(node, mapOptions);
    final StringBuilder sb = new StringBuilder(beginLine(options, 0));
    write(sb, value, options, 0);
    return sb.toString();
  }

  private void write(final StringBuilder sb, final XmlSerializedValue value, final WriterOptions options,
      final int level) {
    switch (value.getKind()) {
      case STRING -> writeString(sb, ((XmlSerializedString) value).value());
      case ARRAY -> {
        sb.append('[');
        final Iterator<XmlSerializedValue> items = ((XmlSerializedArray) value).items().iterator();
        while (items.hasNext()) {
          sb.append(endLine(options)).append(beginLine(options, level + 1));
          write(sb, items.next(), options, level + 1);
          if (items.hasNext()) {
            sb.append(',');
          }
        }
        sb.append(endLine(options)).append(beginLine(options, level)).append(']');
      }
      case MAP -> {
        final boolean inline = options.isPrettyPrint() && value.descendantCount() <= 1;
        sb.append('{');
        final Iterator<Map.Entry<String, XmlSerializedValue>> entries =
            ((XmlSerializedMap) value).getEntries().entrySet().iterator();
        while (entries.hasNext()) {
          final Map.Entry<String, XmlSerializedValue> entry = entries.next();
          if (inline) {
            sb.append(' ');
          } else {
            sb.append(endLine(options)).append(beginLine(options, level + 1));
          }
          writeString(sb, entry.getKey());
          sb.append(':');
          if (options.isPrettyPrint()) {
            sb.append(' ');
          }
          write(sb, entry.getValue(), options, level + 1);
          if (entries.hasNext()) {
            sb.append(',');
          }
        }
        if (inline) {
          sb.append(' ');
        } else {
          sb.append(endLine(options)).append(beginLine(options, level));
        }
        sb.append('}');
      }
      default -> throw new AssertionError(value.getKind());
    }
  }

  private static void writeString(final StringBuilder sb, final String value) {
    sb.append('"').append(StringValue.escape(value)).append('"');
  }
}
