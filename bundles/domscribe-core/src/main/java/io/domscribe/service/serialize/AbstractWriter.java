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

/**
 * Base of the writers. A writer is stateless apart from its {@link BuilderOptions} and may be
 * reused.
 *
 * @param <T> the type of the serialized result
 * @author Johannes Lichtenberger
 */
public abstract class AbstractWriter<T> {

  /** Options of the builder the nodes come from. */
  protected final BuilderOptions builderOptions;

  /**
   * Constructor.
   *
   * @param builderOptions options of the builder the nodes come from
   */
  protected AbstractWriter(final BuilderOptions builderOptions) {
    this.builderOptions = requireNonNull(builderOptions);
  }

  /**
   * Serializes a node and its subtree.
   *
   * @param node the node to serialize
   * @param options the writer options
   * @return the serialized form
   */
  public abstract T serialize(Node node, WriterOptions options);

  /**
   * Serializes a node and its subtree with the default writer options.
   *
   * @param node the node to serialize
   * @return the serialized form
   */
  public T serialize(final Node node) {
    return serialize(node, WriterOptions.DEFAULTS);
  }

  public BuilderOptions getBuilderOptions() {
    return builderOptions;
  }

  /**
   * Pre-serializes a node with the null handling of the builder options.
   *
   * @param node the root of the subtree
   * @return the pre-serialized subtree, starting at level 0
   */
  protected PreSerializedNode preSerialize(final Node node) {
    return new PreSerializer(builderOptions.isKeepNullNodes(), builderOptions.isKeepNullAttributes()).serialize(node, 0);
  }

  /**
   * Indentation of a line at the given level. The indentation level is {@code offset + level + 1}
   * and the line starts with one copy of the indent string less than that.
   *
   * @param options the writer options
   * @param level the nesting level
   * @return the indentation, empty unless pretty printing
   */
  protected static String beginLine(final WriterOptions options, final int level) {
    if (!options.isPrettyPrint()) {
      return "";
    }
    final int count = options.getOffset() + level;
    return count > 0 ? options.getIndent().repeat(count) : "";
  }

  /**
   * End of a line.
   *
   * @param options the writer options
   * @return the newline string, empty unless pretty printing
   */
  protected static String endLine(final WriterOptions options) {
    return options.isPrettyPrint() ? options.getNewline() : "";
  }
}
