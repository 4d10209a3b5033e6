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

package io.domscribe.builder;

import io.domscribe.node.DocumentNode;
import io.domscribe.service.serialize.BuilderOptions;
import java.util.Map;

/**
 * Entry points creating builders over new documents and fragments.
 *
 * @author Johannes Lichtenberger
 */
public final class XmlBuilders {

  private XmlBuilders() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Creates a builder of an empty document with the default options.
   *
   * @return a builder of the document
   */
  public static XmlBuilder create() {
    return create(BuilderOptions.DEFAULTS);
  }

  public static XmlBuilder create(final BuilderOptions options) {
    return new XmlBuilderImpl(DocumentNode.create(), options);
  }

  /**
   * Creates a document with a document element.
   *
   * @param rootName the qualified name of the document element
   * @return a builder of the document element
   */
  public static XmlBuilder create(final String rootName) {
    return create(BuilderOptions.DEFAULTS, rootName);
  }

  public static XmlBuilder create(final BuilderOptions options, final String rootName) {
    return create(options).ele(rootName);
  }

  /**
   * Creates a document by expanding a map, see {@link XmlBuilder#ele(Map)}.
   *
   * @param contents the map to expand
   * @return a builder of the last top-level element created, usually the document element
   */
  public static XmlBuilder create(final Map<String, ?> contents) {
    return create(BuilderOptions.DEFAULTS, contents);
  }

  public static XmlBuilder create(final BuilderOptions options, final Map<String, ?> contents) {
    return create(options).ele(contents);
  }

  /**
   * Creates a builder of an empty document fragment with the default options.
   *
   * @return a builder of the fragment
   */
  public static XmlBuilder fragment() {
    return fragment(BuilderOptions.DEFAULTS);
  }

  public static XmlBuilder fragment(final BuilderOptions options) {
    return new XmlBuilderImpl(DocumentNode.create().createDocumentFragment(), options);
  }
}
