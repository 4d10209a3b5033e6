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

import static java.util.Objects.requireNonNull;

import io.domscribe.node.DocumentNode;
import io.domscribe.node.DocumentTypeNode;
import io.domscribe.node.ElementNode;
import io.domscribe.node.Node;
import io.domscribe.node.NodeKind;
import io.domscribe.node.StructNode;
import io.domscribe.service.serialize.BuilderOptions;
import io.domscribe.service.serialize.MapWriter;
import io.domscribe.service.serialize.WriterOptions;
import io.domscribe.service.serialize.XmlSerializedValue;
import io.domscribe.service.serialize.XmlStringWriter;
import io.domscribe.utils.QNames;
import java.util.Collections;
import java.util.Map;
import java.util.function.Consumer;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * {@link XmlBuilder} delegating to a node of the graph.
 *
 * @author Johannes Lichtenberger
 */
final class XmlBuilderImpl implements XmlBuilder {

  /** The node this builder works on. */
  private final Node node;

  private final BuilderOptions options;

  XmlBuilderImpl(final Node node, final BuilderOptions options) {
    this.node = requireNonNull(node);
    this.options = requireNonNull(options);
  }

  private XmlBuilderImpl builder(final Node other) {
    return new XmlBuilderImpl(other, options);
  }

  private DocumentNode document() {
    return node.getStore().getDocument();
  }

  private StructNode container() {
    if (!(node instanceof StructNode container)) {
      throw new IllegalStateException("A " + node.getKind() + " node can't have children.");
    }
    return container;
  }

  private ElementNode element() {
    if (!(node instanceof ElementNode element)) {
      throw new IllegalStateException("Attributes can only be set on elements, not on " + node.getKind() + ".");
    }
    return element;
  }

  @Override
  public XmlBuilder ele(final String name) {
    return builder(container().appendChild(createElement(namespaceOf(name), name)));
  }

  @Override
  public XmlBuilder ele(final String name, final Map<String, ?> attributes) {
    final String declared = declaredNamespace(name, attributes, "");
    final Node child =
        container().appendChild(createElement(declared == null ? namespaceOf(name) : declared, name));
    return builder(child).att(attributes);
  }

  @Override
  public XmlBuilder ele(final String name, final Map<String, ?> attributes, final @Nullable String text) {
    return ele(name, attributes).txt(text);
  }

  @Override
  public XmlBuilder ele(final @Nullable String namespace, final String name) {
    return builder(container().appendChild(document().createElementNS(namespace, name)));
  }

  @Override
  public XmlBuilder ele(final @Nullable String namespace, final String name, final Map<String, ?> attributes) {
    return ele(namespace, name).att(attributes);
  }

  @Override
  public XmlBuilder ele(final Map<String, ?> contents) {
    XmlBuilder last = null;
    if (!options.isIgnoreDecorators()) {
      // Declarations first, so that prefixed names below resolve.
      contents.forEach((key, value) -> {
        if (isAttributeKey(key) && isNamespaceDeclaration(attributeName(key))) {
          att(attributeName(key), value);
        }
      });
    }
    for (final Map.Entry<String, ?> entry : contents.entrySet()) {
      final String key = requireNonNull(entry.getKey());
      final Object value = entry.getValue();
      if (!options.isIgnoreDecorators() && BuilderOptions.GROUP_KEY.equals(key)) {
        for (final Object item : value instanceof Iterable<?> items ? items : Collections.singletonList(value)) {
          if (!(item instanceof Map<?, ?> group)) {
            throw new IllegalArgumentException("Group items must be maps, not " + item);
          }
          final XmlBuilder child = ele(stringKeys(group));
          last = child == this ? last : child;
        }
        continue;
      }
      if (!options.isIgnoreDecorators() && expandMarker(key, value)) {
        continue;
      }
      if (value instanceof Iterable<?> items) {
        for (final Object item : items) {
          final XmlBuilder child = expandElement(key, item);
          last = child == null ? last : child;
        }
      } else {
        final XmlBuilder child = expandElement(key, value);
        last = child == null ? last : child;
      }
    }
    return last == null ? this : last;
  }

  /**
   * Handles a marker key.
   *
   * @return {@code true} if the key was a marker key
   */
  private boolean expandMarker(final String key, final @Nullable Object value) {
    if (isAttributeKey(key)) {
      final String name = attributeName(key);
      if (name.isEmpty() && value instanceof Map<?, ?> attributes) {
        att(stringKeys(attributes));
      } else if (!isNamespaceDeclaration(name)) {
        att(name, value);
      }
      return true;
    }
    if (key.startsWith(options.getConvertPIKey())) {
      final String target = key.substring(options.getConvertPIKey().length());
      forEachValue(value, item -> {
        if (target.isEmpty()) {
          final String instruction = String.valueOf(item);
          final int space = instruction.indexOf(' ');
          ins(space == -1 ? instruction : instruction.substring(0, space),
              space == -1 ? "" : instruction.substring(space + 1));
        } else {
          ins(target, item == null ? null : String.valueOf(item));
        }
      });
      return true;
    }
    if (key.startsWith(options.getConvertCDataKey())) {
      forEachValue(value, item -> dat(item == null ? null : String.valueOf(item)));
      return true;
    }
    if (key.startsWith(options.getConvertCommentKey())) {
      forEachValue(value, item -> com(item == null ? null : String.valueOf(item)));
      return true;
    }
    if (key.startsWith(options.getConvertTextKey())) {
      forEachValue(value, item -> txt(item == null ? null : String.valueOf(item)));
      return true;
    }
    return false;
  }

  private static void forEachValue(final @Nullable Object value, final Consumer<Object> action) {
    if (value instanceof Iterable<?> items) {
      for (final Object item : items) {
        action.accept(item);
      }
    } else {
      action.accept(value);
    }
  }

  private @Nullable XmlBuilder expandElement(final String name, final @Nullable Object value) {
    if (value == null) {
      return options.isKeepNullNodes() ? ele(name) : null;
    }
    if (value instanceof Map<?, ?> map) {
      final Map<String, Object> contents = stringKeys(map);
      final String declared =
          options.isIgnoreDecorators() ? null : declaredNamespace(name, contents, options.getConvertAttKey());
      final XmlBuilderImpl child =
          builder(container().appendChild(createElement(declared == null ? namespaceOf(name) : declared, name)));
      child.ele(contents);
      return child;
    }
    return ele(name).txt(String.valueOf(value));
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> stringKeys(final Map<?, ?> map) {
    for (final Object key : map.keySet()) {
      if (!(key instanceof String)) {
        throw new IllegalArgumentException("Map keys must be strings, not " + key);
      }
    }
    return (Map<String, Object>) map;
  }

  private boolean isAttributeKey(final String key) {
    return key.startsWith(options.getConvertAttKey());
  }

  private String attributeName(final String key) {
    return key.substring(options.getConvertAttKey().length());
  }

  private static boolean isNamespaceDeclaration(final String name) {
    return name.equals(QNames.XMLNS) || name.startsWith(QNames.XMLNS + ':');
  }

  /**
   * Finds the declaration of the namespace of an element among its attributes.
   *
   * @param name the qualified element name
   * @param attributes the attributes
   * @param marker prefix of attribute keys
   * @return the declared namespace URI or {@code null}
   */
  private static @Nullable String declaredNamespace(final String name, final Map<String, ?> attributes,
      final String marker) {
    final int colon = name.indexOf(':');
    final String declaration = colon == -1 ? QNames.XMLNS : QNames.qualify(QNames.XMLNS, name.substring(0, colon));
    final Object value = attributes.get(marker + declaration);
    return value == null ? null : String.valueOf(value);
  }

  /**
   * Resolves the namespace of a qualified name in the scope of this builder's node.
   */
  private @Nullable String namespaceOf(final String name) {
    final int colon = name.indexOf(':');
    if (colon != -1) {
      return node.lookupNamespaceURI(name.substring(0, colon));
    }
    if (options.isInheritNS() && node.getKind() == NodeKind.ELEMENT) {
      return node.lookupNamespaceURI(null);
    }
    return null;
  }

  private ElementNode createElement(final @Nullable String namespace, final String name) {
    return document().createElementNS(namespace, name);
  }

  @Override
  public XmlBuilder att(final String name, final @Nullable Object value) {
    requireNonNull(name);
    final ElementNode element = element();
    if (value == null && !options.isKeepNullAttributes()) {
      return this;
    }
    final String stringValue = value == null ? null : String.valueOf(value);
    if (isNamespaceDeclaration(name)) {
      element.setAttributeNS(QNames.XMLNS_NAMESPACE, name, stringValue);
    } else if (name.indexOf(':') != -1) {
      element.setAttributeNS(element.lookupNamespaceURI(name.substring(0, name.indexOf(':'))), name, stringValue);
    } else {
      element.setAttribute(name, stringValue);
    }
    return this;
  }

  @Override
  public XmlBuilder att(final @Nullable String namespace, final String name, final @Nullable Object value) {
    final ElementNode element = element();
    if (value == null && !options.isKeepNullAttributes()) {
      return this;
    }
    element.setAttributeNS(namespace, name, value == null ? null : String.valueOf(value));
    return this;
  }

  @Override
  public XmlBuilder att(final Map<String, ?> attributes) {
    attributes.forEach((name, value) -> {
      if (isNamespaceDeclaration(name)) {
        att(name, value);
      }
    });
    attributes.forEach((name, value) -> {
      if (!isNamespaceDeclaration(name)) {
        att(name, value);
      }
    });
    return this;
  }

  @Override
  public XmlBuilder removeAtt(final String name) {
    element().removeAttribute(name);
    return this;
  }

  @Override
  public XmlBuilder removeAtt(final @Nullable String namespace, final String name) {
    element().removeAttributeNS(namespace, name);
    return this;
  }

  @Override
  public XmlBuilder removeAtt(final String[] names) {
    final ElementNode element = element();
    for (final String name : names) {
      element.removeAttribute(name);
    }
    return this;
  }

  @Override
  public XmlBuilder removeAtt(final @Nullable String namespace, final String[] names) {
    final ElementNode element = element();
    for (final String name : names) {
      element.removeAttributeNS(namespace, name);
    }
    return this;
  }

  @Override
  public XmlBuilder txt(final @Nullable String content) {
    if (content != null || options.isKeepNullNodes()) {
      container().appendChild(document().createTextNode(content));
    }
    return this;
  }

  @Override
  public XmlBuilder com(final @Nullable String content) {
    if (content != null || options.isKeepNullNodes()) {
      container().appendChild(document().createComment(content));
    }
    return this;
  }

  @Override
  public XmlBuilder dat(final @Nullable String content) {
    if (content != null || options.isKeepNullNodes()) {
      container().appendChild(document().createCDATASection(content));
    }
    return this;
  }

  @Override
  public XmlBuilder ins(final String target, final @Nullable String content) {
    if (content != null || options.isKeepNullNodes()) {
      container().appendChild(document().createProcessingInstruction(target, content));
    }
    return this;
  }

  @Override
  public XmlBuilder dtd(final String pubID, final String sysID) {
    final DocumentNode document = document();
    final ElementNode documentElement = document.getDocumentElement();
    if (documentElement == null) {
      throw new IllegalStateException("The doctype is named after the document element, which doesn't exist yet.");
    }
    final DocumentTypeNode doctype =
        document.createDocumentType(documentElement.getQualifiedName(), requireNonNull(pubID), requireNonNull(sysID));
    final DocumentTypeNode old = document.getDoctype();
    if (old != null) {
      document.removeChild(old);
    }
    document.insertBefore(doctype, documentElement);
    return this;
  }

  @Override
  public XmlBuilder dtd() {
    return dtd(options.getPubID(), options.getSysID());
  }

  @Override
  public XmlBuilder importNode(final XmlBuilder other) {
    Node source = other.node();
    if (source instanceof DocumentNode sourceDocument) {
      source = sourceDocument.getDocumentElement();
      if (source == null) {
        throw new IllegalStateException("The document to import has no document element.");
      }
    }
    container().appendChild(document().importNode(source, true));
    return this;
  }

  @Override
  public XmlBuilder remove() {
    final StructNode parent = node.getParent();
    if (parent == null) {
      throw new IllegalStateException("The node has no parent.");
    }
    parent.removeChild(node);
    return builder(parent);
  }

  @Override
  public XmlBuilder doc() {
    Node top = node;
    for (Node parent = top.getParent(); parent != null; parent = parent.getParent()) {
      top = parent;
    }
    if (top.getKind() == NodeKind.DOCUMENT || top.getKind() == NodeKind.DOCUMENT_FRAGMENT) {
      return top == node ? this : builder(top);
    }
    return builder(document());
  }

  @Override
  public XmlBuilder root() {
    final Node top = doc().node();
    for (final Node child : top.getChildNodes()) {
      if (child.getKind() == NodeKind.ELEMENT) {
        return builder(child);
      }
    }
    throw new IllegalStateException("There is no document element.");
  }

  @Override
  public XmlBuilder up() {
    return navigate(node.getParent(), "The node has no parent.");
  }

  @Override
  public XmlBuilder prev() {
    return navigate(node.getPreviousSibling(), "The node has no previous sibling.");
  }

  @Override
  public XmlBuilder next() {
    return navigate(node.getNextSibling(), "The node has no next sibling.");
  }

  @Override
  public XmlBuilder first() {
    return navigate(node.getFirstChild(), "The node has no children.");
  }

  @Override
  public XmlBuilder last() {
    return navigate(node.getLastChild(), "The node has no children.");
  }

  private XmlBuilder navigate(final @Nullable Node target, final String message) {
    if (target == null) {
      throw new IllegalStateException(message);
    }
    return builder(target);
  }

  @Override
  public Node node() {
    return node;
  }

  @Override
  public BuilderOptions options() {
    return options;
  }

  @Override
  public String toString() {
    return toString(WriterOptions.DEFAULTS);
  }

  @Override
  public String toString(final WriterOptions writerOptions) {
    return new XmlStringWriter(options).serialize(node, writerOptions);
  }

  @Override
  public XmlSerializedValue toObject(final WriterOptions writerOptions) {
    return new MapWriter(options).serialize(node, writerOptions);
  }

  @Override
  public XmlSerializedValue toObject() {
    return toObject(WriterOptions.DEFAULTS);
  }

  @Override
  public String end(final WriterOptions writerOptions) {
    return doc().toString(writerOptions);
  }

  @Override
  public String end() {
    return end(WriterOptions.DEFAULTS);
  }
}
