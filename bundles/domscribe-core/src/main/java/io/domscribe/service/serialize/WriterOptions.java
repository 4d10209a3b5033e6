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

import static com.google.common.base.Preconditions.checkArgument;
import static io.domscribe.service.serialize.WriterProperties.S_ALLOW_EMPTY_TAGS;
import static io.domscribe.service.serialize.WriterProperties.S_DONT_PRETTY_PRINT_TEXT_NODES;
import static io.domscribe.service.serialize.WriterProperties.S_FORMAT;
import static io.domscribe.service.serialize.WriterProperties.S_HEADLESS;
import static io.domscribe.service.serialize.WriterProperties.S_INDENT;
import static io.domscribe.service.serialize.WriterProperties.S_NEWLINE;
import static io.domscribe.service.serialize.WriterProperties.S_NO_DOUBLE_ENCODING;
import static io.domscribe.service.serialize.WriterProperties.S_OFFSET;
import static io.domscribe.service.serialize.WriterProperties.S_PRETTY_PRINT;
import static io.domscribe.service.serialize.WriterProperties.S_SPACE_BEFORE_SLASH;
import static io.domscribe.service.serialize.WriterProperties.S_WIDTH;
import static java.util.Objects.requireNonNull;

import com.google.common.base.MoreObjects;
import java.util.concurrent.ConcurrentMap;
import org.checkerframework.checker.index.qual.NonNegative;

/**
 * Immutable options shared by the writers. Each writer reads the options it understands and
 * ignores the others.
 *
 * @author Johannes Lichtenberger
 */
public final class WriterOptions {

  /** Options with all defaults. */
  public static final WriterOptions DEFAULTS = newBuilder().build();

  private final boolean prettyPrint;

  private final String indent;

  private final String newline;

  private final int offset;

  private final int width;

  private final boolean headless;

  private final boolean allowEmptyTags;

  private final boolean spaceBeforeSlash;

  private final boolean dontPrettyPrintTextNodes;

  private final boolean noDoubleEncoding;

  private final Format format;

  private WriterOptions(final Builder builder) {
    prettyPrint = builder.prettyPrint;
    indent = builder.indent;
    newline = builder.newline;
    offset = builder.offset;
    width = builder.width;
    headless = builder.headless;
    allowEmptyTags = builder.allowEmptyTags;
    spaceBeforeSlash = builder.spaceBeforeSlash;
    dontPrettyPrintTextNodes = builder.dontPrettyPrintTextNodes;
    noDoubleEncoding = builder.noDoubleEncoding;
    format = builder.format;
  }

  /**
   * Get a builder with all defaults.
   *
   * @return a new builder
   */
  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Get a builder initialized from a properties map.
   *
   * @param properties the properties, either the defaults or read from a file
   * @return a new builder
   */
  public static Builder newBuilder(final WriterProperties properties) {
    final ConcurrentMap<String, Object> map = requireNonNull(properties.getProps());
    return new Builder().prettyPrint(requireNonNull((Boolean) map.get(S_PRETTY_PRINT[0])))
                        .indent(requireNonNull((String) map.get(S_INDENT[0])))
                        .newline(requireNonNull((String) map.get(S_NEWLINE[0])))
                        .offset(requireNonNull((Integer) map.get(S_OFFSET[0])))
                        .width(requireNonNull((Integer) map.get(S_WIDTH[0])))
                        .headless(requireNonNull((Boolean) map.get(S_HEADLESS[0])))
                        .allowEmptyTags(requireNonNull((Boolean) map.get(S_ALLOW_EMPTY_TAGS[0])))
                        .spaceBeforeSlash(requireNonNull((Boolean) map.get(S_SPACE_BEFORE_SLASH[0])))
                        .dontPrettyPrintTextNodes(
                            requireNonNull((Boolean) map.get(S_DONT_PRETTY_PRINT_TEXT_NODES[0])))
                        .noDoubleEncoding(requireNonNull((Boolean) map.get(S_NO_DOUBLE_ENCODING[0])))
                        .format(requireNonNull((Format) map.get(S_FORMAT[0])));
  }

  /**
   * Get a builder initialized with these options.
   *
   * @return a new builder
   */
  public Builder toBuilder() {
    return new Builder().prettyPrint(prettyPrint)
                        .indent(indent)
                        .newline(newline)
                        .offset(offset)
                        .width(width)
                        .headless(headless)
                        .allowEmptyTags(allowEmptyTags)
                        .spaceBeforeSlash(spaceBeforeSlash)
                        .dontPrettyPrintTextNodes(dontPrettyPrintTextNodes)
                        .noDoubleEncoding(noDoubleEncoding)
                        .format(format);
  }

  public boolean isPrettyPrint() {
    return prettyPrint;
  }

  public String getIndent() {
    return indent;
  }

  public String getNewline() {
    return newline;
  }

  public int getOffset() {
    return offset;
  }

  /**
   * Maximum line width before attributes wrap, {@code 0} if lines never wrap.
   *
   * @return the line width
   */
  public int getWidth() {
    return width;
  }

  public boolean isHeadless() {
    return headless;
  }

  public boolean isAllowEmptyTags() {
    return allowEmptyTags;
  }

  public boolean isSpaceBeforeSlash() {
    return spaceBeforeSlash;
  }

  public boolean isDontPrettyPrintTextNodes() {
    return dontPrettyPrintTextNodes;
  }

  public boolean isNoDoubleEncoding() {
    return noDoubleEncoding;
  }

  public Format getFormat() {
    return format;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("prettyPrint", prettyPrint)
                      .add("offset", offset)
                      .add("width", width)
                      .add("headless", headless)
                      .add("format", format)
                      .toString();
  }

  /**
   * Builder of {@link WriterOptions}.
   */
  public static final class Builder {

    private boolean prettyPrint;

    private String indent = "  ";

    private String newline = "\n";

    private int offset;

    private int width = 80;

    private boolean headless;

    private boolean allowEmptyTags;

    private boolean spaceBeforeSlash;

    private boolean dontPrettyPrintTextNodes;

    private boolean noDoubleEncoding;

    private Format format = Format.MAP;

    private Builder() {
    }

    /**
     * Pretty prints the output.
     *
     * @return this {@link Builder} instance
     */
    public Builder prettyPrint() {
      return prettyPrint(true);
    }

    public Builder prettyPrint(final boolean prettyPrint) {
      this.prettyPrint = prettyPrint;
      return this;
    }

    public Builder indent(final String indent) {
      this.indent = requireNonNull(indent);
      return this;
    }

    public Builder newline(final String newline) {
      this.newline = requireNonNull(newline);
      return this;
    }

    /**
     * Sets the indentation offset, which is added to the nesting level and may be negative.
     *
     * @param offset the offset
     * @return this {@link Builder} instance
     */
    public Builder offset(final int offset) {
      this.offset = offset;
      return this;
    }

    public Builder width(final @NonNegative int width) {
      checkArgument(width >= 0, "width must be >= 0!");
      this.width = width;
      return this;
    }

    /**
     * Omits the XML declaration and the doctype.
     *
     * @param headless {@code true} to omit them
     * @return this {@link Builder} instance
     */
    public Builder headless(final boolean headless) {
      this.headless = headless;
      return this;
    }

    public Builder allowEmptyTags(final boolean allowEmptyTags) {
      this.allowEmptyTags = allowEmptyTags;
      return this;
    }

    public Builder spaceBeforeSlash(final boolean spaceBeforeSlash) {
      this.spaceBeforeSlash = spaceBeforeSlash;
      return this;
    }

    public Builder dontPrettyPrintTextNodes(final boolean dontPrettyPrintTextNodes) {
      this.dontPrettyPrintTextNodes = dontPrettyPrintTextNodes;
      return this;
    }

    /**
     * Leaves entity and character references in text and attribute values as they are.
     *
     * @param noDoubleEncoding {@code true} to keep existing references
     * @return this {@link Builder} instance
     */
    public Builder noDoubleEncoding(final boolean noDoubleEncoding) {
      this.noDoubleEncoding = noDoubleEncoding;
      return this;
    }

    public Builder format(final Format format) {
      this.format = requireNonNull(format);
      return this;
    }

    public WriterOptions build() {
      return new WriterOptions(this);
    }
  }
}
