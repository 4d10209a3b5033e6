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

import io.domscribe.node.Node;
import io.domscribe.service.serialize.BuilderOptions;
import io.domscribe.service.serialize.WriterOptions;
import io.domscribe.service.serialize.XmlSerializedValue;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Chainable builder over a node. Methods creating elements return a builder of the new element,
 * methods creating other content return this builder.
 *
 * @author Johannes Lichtenberger
 */
public interface XmlBuilder {

  /**
   * Appends an element. A prefixed name is resolved against the namespaces in scope, an unprefixed
   * one takes the default namespace in scope if {@link BuilderOptions#isInheritNS()}.
   *
   * @param name the qualified name
   * @return a builder of the new element
   */
  XmlBuilder ele(String name);

  /**
   * Appends an element with attributes. An {@code xmlns} (or {@code xmlns:prefix}) attribute
   * matching the name sets the namespace of the element.
   *
   * @param name the qualified name
   * @param attributes attribute names and values
   * @return a builder of the new element
   */
  XmlBuilder ele(String name, Map<String, ?> attributes);

  /**
   * Appends an element with attributes and text content.
   *
   * @param name the qualified name
   * @param attributes attribute names and values
   * @param text the text content, {@code null} for none
   * @return a builder of the new element
   */
  XmlBuilder ele(String name, Map<String, ?> attributes, @Nullable String text);

  XmlBuilder ele(@Nullable String namespace, String name);

  XmlBuilder ele(@Nullable String namespace, String name, Map<String, ?> attributes);

  /**
   * Expands a map into nodes. Keys starting with the marker strings of the builder options become
   * attributes, processing instructions, text, CDATA sections and comments; all other keys become
   * elements. A map value is expanded recursively, a list value creates one element per item, a
   * scalar value becomes text content. The items of a {@link BuilderOptions#GROUP_KEY} list are maps
   * which are expanded one after the other.
   *
   * @param contents the map to expand
   * @return a builder of the last element created at the top level, or this builder
   */
  XmlBuilder ele(Map<String, ?> contents);

  XmlBuilder att(String name, @Nullable Object value);

  XmlBuilder att(@Nullable String namespace, String name, @Nullable Object value);

  XmlBuilder att(Map<String, ?> attributes);

  XmlBuilder removeAtt(String name);

  XmlBuilder removeAtt(@Nullable String namespace, String name);

  XmlBuilder removeAtt(String[] names);

  XmlBuilder removeAtt(@Nullable String namespace, String[] localNames);

  XmlBuilder txt(@Nullable String content);

  XmlBuilder com(@Nullable String content);

  XmlBuilder dat(@Nullable String content);

  XmlBuilder ins(String target, @Nullable String content);

  /**
   * Sets the document type declaration, named after the document element.
   *
   * @param pubID the public identifier, empty for none
   * @param sysID the system identifier, empty for none
   * @return this builder
   */
  XmlBuilder dtd(String pubID, String sysID);

  /**
   * Sets the document type declaration with the identifiers of the builder options.
   *
   * @return this builder
   */
  XmlBuilder dtd();

  /**
   * Appends a deep copy of the node of another builder. A document contributes its document
   * element, a fragment its children.
   *
   * @param node the builder whose node to copy
   * @return this builder
   */
  XmlBuilder importNode(XmlBuilder node);

  /**
   * Removes the node from its parent.
   *
   * @return a builder of the former parent
   */
  XmlBuilder remove();

  /**
   * Get a builder of the document or fragment containing the node.
   *
   * @return the builder of the top-level container
   */
  XmlBuilder doc();

  XmlBuilder root();

  XmlBuilder up();

  XmlBuilder prev();

  XmlBuilder next();

  XmlBuilder first();

  XmlBuilder last();

  Node node();

  BuilderOptions options();

  /**
   * Serializes the node into XML text.
   *
   * @param options the writer options
   * @return the XML text
   */
  String toString(WriterOptions options);

  /**
   * Serializes the node into maps, arrays and strings.
   *
   * @param options the writer options
   * @return the serialized value
   */
  XmlSerializedValue toObject(WriterOptions options);

  XmlSerializedValue toObject();

  /**
   * Serializes the whole document (or fragment) into XML text.
   *
   * @param options the writer options
   * @return the XML text
   */
  String end(WriterOptions options);

  String end();
}
