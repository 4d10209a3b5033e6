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

import io.domscribe.node.DocumentTypeNode;
import io.domscribe.node.Node;
import io.domscribe.node.NodeKind;
import io.domscribe.settings.CharsForSerializing;
import io.domscribe.utils.XMLToken;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * Serializes a subtree into XML text. Namespace declarations and prefixes come from the
 * {@link PreSerializer}, the XML declaration from the {@link BuilderOptions}.
 * </p>
 *
 * @author Johannes Lichtenberger
 */
public final class XmlStringWriter extends AbstractWriter<String> {

  /** Logger. */
  private static final Logger LOGGER = LoggerFactory.getLogger(XmlStringWriter.class);

  public XmlStringWriter(final BuilderOptions builderOptions) {
    super(builderOptions);
  }

  @Override
  public String serialize(final Node node, final WriterOptions options) {
    requireNonNull(node);
    requireNonNull(options);
    final StringBuilder sb = new StringBuilder();
    emitNode(sb, preSerialize(node), options);

    // Remove the newline ending the last line.
    if (options.isPrettyPrint() && !options.getNewline().isEmpty()) {
      final int start = sb.length() - options.getNewline().length();
      if (start >= 0 && sb.indexOf(options.getNewline(), start) == start) {
        sb.setLength(start);
      }
    }
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("Serialized {} into {} characters.", node.getNodeName(), sb.length());
    }
    return sb.toString();
  }

  /**
   * Serializes a subtree into an OutputStream. The encoding always is UTF-8. Note that the
   * OutputStream internally is wrapped by a BufferedOutputStream.
   *
   * @param node the node to serialize
   * @param options the writer options
   * @param out the stream to write to, which is flushed but not closed
   * @throws UncheckedIOException if writing fails
   */
  public void serialize(final Node node, final WriterOptions options, final OutputStream out) {
    final String xml = serialize(node, options);
    final BufferedOutputStream buffered = new BufferedOutputStream(requireNonNull(out), 4096);
    try {
      buffered.write(xml.getBytes(StandardCharsets.UTF_8));
      buffered.flush();
    } catch (final IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private void emitNode(final StringBuilder sb, final PreSerializedNode node, final WriterOptions options) {
    final int level = node.level();
    switch (node.kind()) {
      case DOCUMENT -> {
        if (!options.isHeadless()) {
          emitDeclaration(sb);
          sb.append(endLine(options));
        }
        emitChildren(sb, node, options);
      }
      case DOCUMENT_FRAGMENT -> emitChildren(sb, node, options);
      case ELEMENT -> emitElement(sb, node, options);
      case TEXT -> sb.append(beginLine(options, level))
                     .append(XMLToken.escapeContent(value(node), options.isNoDoubleEncoding()))
                     .append(endLine(options));
      case CDATA_SECTION -> sb.append(beginLine(options, level))
                              .append(CharsForSerializing.OPENCDATA)
                              .append(value(node).replace("]]>", "]]]]><![CDATA[>"))
                              .append(CharsForSerializing.CLOSECDATA)
                              .append(endLine(options));
      case COMMENT -> sb.append(beginLine(options, level))
                        .append(CharsForSerializing.OPENCOMMENT)
                        .append(value(node))
                        .append(CharsForSerializing.CLOSECOMMENT)
                        .append(endLine(options));
      case PROCESSING_INSTRUCTION -> {
        sb.append(beginLine(options, level)).append(CharsForSerializing.OPENPI).append(node.name());
        if (!value(node).isEmpty()) {
          sb.append(CharsForSerializing.SPACE).append(value(node));
        }
        sb.append(CharsForSerializing.CLOSEPI).append(endLine(options));
      }
      case DOCUMENT_TYPE -> {
        if (!options.isHeadless()) {
          sb.append(beginLine(options, level));
          emitDoctype(sb, (DocumentTypeNode) node.node());
          sb.append(endLine(options));
        }
      }
      case ATTRIBUTE -> sb.append(XMLToken.escapeAttribute(value(node), options.isNoDoubleEncoding()));
      default -> sb.append(node.node());
    }
  }

  private void emitDeclaration(final StringBuilder sb) {
    sb.append(CharsForSerializing.OPENXMLDECL).append(builderOptions.getVersion()).append(CharsForSerializing.QUOTE);
    if (builderOptions.getEncoding() != null) {
      sb.append(" encoding=\"").append(builderOptions.getEncoding()).append(CharsForSerializing.QUOTE);
    }
    if (builderOptions.getStandalone() != null) {
      sb.append(" standalone=\"")
        .append(builderOptions.getStandalone() ? "yes" : "no")
        .append(CharsForSerializing.QUOTE);
    }
    sb.append(CharsForSerializing.CLOSEPI);
  }

  private static void emitDoctype(final StringBuilder sb, final DocumentTypeNode doctype) {
    sb.append(CharsForSerializing.OPENDOCTYPE).append(doctype.getName());
    if (!doctype.getPublicId().isEmpty()) {
      sb.append(" PUBLIC \"").append(doctype.getPublicId()).append(CharsForSerializing.QUOTE);
      if (!doctype.getSystemId().isEmpty()) {
        sb.append(" \"").append(doctype.getSystemId()).append(CharsForSerializing.QUOTE);
      }
    } else if (!doctype.getSystemId().isEmpty()) {
      sb.append(" SYSTEM \"").append(doctype.getSystemId()).append(CharsForSerializing.QUOTE);
    }
    sb.append(CharsForSerializing.CLOSE);
  }

  private void emitElement(final StringBuilder sb, final PreSerializedNode element, final WriterOptions options) {
    final int level = element.level();
    final String name = requireNonNull(element.name());
    sb.append(beginLine(options, level)).append(CharsForSerializing.OPEN).append(name);

    boolean first = true;
    for (final PreSerializedNamespace namespace : element.namespaces()) {
      emitToken(sb, token(namespace.name(), namespace.value(), options), first, level, options);
      first = false;
    }
    for (final PreSerializedAttribute attribute : element.attributes()) {
      emitToken(sb, token(attribute.name(), attribute.value(), options), first, level, options);
      first = false;
    }

    if (element.children().isEmpty()) {
      if (options.isAllowEmptyTags()) {
        sb.append(CharsForSerializing.CLOSE).append(CharsForSerializing.OPEN_SLASH).append(name)
          .append(CharsForSerializing.CLOSE);
      } else if (options.isSpaceBeforeSlash()) {
        sb.append(CharsForSerializing.SPACE_SLASH_CLOSE);
      } else {
        sb.append(CharsForSerializing.SLASH_CLOSE);
      }
    } else if (options.isPrettyPrint() && element.children().size() == 1
        && element.children().get(0).kind() == NodeKind.TEXT) {
      sb.append(CharsForSerializing.CLOSE)
        .append(XMLToken.escapeContent(value(element.children().get(0)), options.isNoDoubleEncoding()))
        .append(CharsForSerializing.OPEN_SLASH)
        .append(name)
        .append(CharsForSerializing.CLOSE);
    } else if (options.isPrettyPrint() && options.isDontPrettyPrintTextNodes()
        && element.children().stream().anyMatch(child -> child.kind() == NodeKind.TEXT)) {
      sb.append(CharsForSerializing.CLOSE);
      final WriterOptions inline = options.toBuilder().prettyPrint(false).build();
      for (final PreSerializedNode child : element.children()) {
        emitNode(sb, child, inline);
      }
      sb.append(CharsForSerializing.OPEN_SLASH).append(name).append(CharsForSerializing.CLOSE);
    } else {
      sb.append(CharsForSerializing.CLOSE).append(endLine(options));
      emitChildren(sb, element, options);
      sb.append(beginLine(options, level)).append(CharsForSerializing.OPEN_SLASH).append(name)
        .append(CharsForSerializing.CLOSE);
    }
    sb.append(endLine(options));
  }

  /**
   * Appends an attribute or namespace token. With pretty printing and a line width, a token which
   * doesn't fit on the current line starts a new line aligned with the element name.
   */
  private static void emitToken(final StringBuilder sb, final String token, final boolean first, final int level,
      final WriterOptions options) {
    if (!first && options.isPrettyPrint() && options.getWidth() > 0
        && currentLineLength(sb, options) + 1 + token.length() > options.getWidth()) {
      sb.append(options.getNewline()).append(beginLine(options, level));
    }
    sb.append(CharsForSerializing.SPACE).append(token);
  }

  private static int currentLineLength(final StringBuilder sb, final WriterOptions options) {
    final String newline = options.getNewline();
    final int lineBreak = newline.isEmpty() ? -1 : sb.lastIndexOf(newline);
    return lineBreak == -1 ? sb.length() : sb.length() - lineBreak - newline.length();
  }

  private static String token(final String name, final String value, final WriterOptions options) {
    return name + CharsForSerializing.EQUAL_QUOTE + XMLToken.escapeAttribute(value, options.isNoDoubleEncoding())
        + CharsForSerializing.QUOTE;
  }

  private void emitChildren(final StringBuilder sb, final PreSerializedNode node, final WriterOptions options) {
    for (final PreSerializedNode child : node.children()) {
      emitNode(sb, child, options);
    }
  }

  private static String value(final PreSerializedNode node) {
    return requireNonNull(node.value());
  }
}
