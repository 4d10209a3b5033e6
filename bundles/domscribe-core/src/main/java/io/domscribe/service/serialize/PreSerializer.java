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

import com.google.common.collect.ImmutableList;
import io.domscribe.node.AttributeNode;
import io.domscribe.node.CharacterDataNode;
import io.domscribe.node.DocumentTypeNode;
import io.domscribe.node.ElementNode;
import io.domscribe.node.Node;
import io.domscribe.node.NodeKind;
import io.domscribe.node.PINode;
import io.domscribe.utils.QNames;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a subtree and resolves everything the writers have to agree on: nesting levels, the
 * namespace declarations each element needs, the prefixes of namespaced attributes and the
 * handling of {@code null} content. The result is an immutable {@link PreSerializedNode} tree.
 *
 * <p>
 * Namespace scopes map a prefix (the empty string for the default namespace) to a namespace URI.
 * Every serialization starts with an empty scope, so the start element declares all bindings its
 * subtree uses, including the ones it inherits from ancestors which are not written.
 * </p>
 *
 * @author Johannes Lichtenberger
 */
public final class PreSerializer {

  /** Logger. */
  private static final Logger LOGGER = LoggerFactory.getLogger(PreSerializer.class);

  /** Prefix of generated namespace prefixes. */
  private static final String GENERATED_PREFIX = "ns";

  /** Scope key of the default namespace. */
  private static final String DEFAULT_NS = "";

  private final boolean keepNullNodes;

  private final boolean keepNullAttributes;

  /**
   * Constructor.
   *
   * @param keepNullNodes keep character data without content, as empty content
   * @param keepNullAttributes keep attributes without value, as empty value
   */
  public PreSerializer(final boolean keepNullNodes, final boolean keepNullAttributes) {
    this.keepNullNodes = keepNullNodes;
    this.keepNullAttributes = keepNullAttributes;
  }

  /**
   * Pre-serializes the subtree rooted at {@code node}.
   *
   * @param node the root of the subtree
   * @param level the level of the root
   * @return the pre-serialized subtree
   */
  public PreSerializedNode serialize(final Node node, final int level) {
    requireNonNull(node);
    final PreSerializedNode result = switch (node.getKind()) {
      case ELEMENT -> element((ElementNode) node, level, new LinkedHashMap<>());
      case DOCUMENT, DOCUMENT_FRAGMENT -> container(node, level);
      case ATTRIBUTE -> {
        final AttributeNode attribute = (AttributeNode) node;
        yield leaf(node, level, attribute.getQualifiedName(), Objects.requireNonNullElse(attribute.getValue(), ""));
      }
      default -> requireNonNull(child(node, level, true));
    };
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("Pre-serialized {} at level {} with {} children.", node.getNodeName(), level,
          result.children().size());
    }
    return result;
  }

  private PreSerializedNode container(final Node node, final int level) {
    final ImmutableList.Builder<PreSerializedNode> children = ImmutableList.builder();
    for (final Node child : node.getChildNodes()) {
      final PreSerializedNode serialized = child.getKind() == NodeKind.ELEMENT
          ? element((ElementNode) child, level, new LinkedHashMap<>())
          : child(child, level, false);
      if (serialized != null) {
        children.add(serialized);
      }
    }
    return new PreSerializedNode(node, level, null, null, ImmutableList.of(), ImmutableList.of(), children.build());
  }

  /**
   * Pre-serializes a non-element child.
   *
   * @return {@code null} if the node is dropped
   */
  private @Nullable PreSerializedNode child(final Node node, final int level, final boolean root) {
    switch (node.getKind()) {
      case TEXT, CDATA_SECTION, COMMENT, PROCESSING_INSTRUCTION -> {
        final String data = ((CharacterDataNode) node).getData();
        if (data == null && !keepNullNodes && !root) {
          return null;
        }
        final String name = node instanceof PINode pi ? pi.getTarget() : null;
        return leaf(node, level, name, data == null ? "" : data);
      }
      case DOCUMENT_TYPE -> {
        return leaf(node, level, ((DocumentTypeNode) node).getName(), null);
      }
      default -> throw new IllegalArgumentException("Unexpected child kind " + node.getKind());
    }
  }

  private static PreSerializedNode leaf(final Node node, final int level, final @Nullable String name,
      final @Nullable String value) {
    return new PreSerializedNode(node, level, name, value, ImmutableList.of(), ImmutableList.of(), ImmutableList.of());
  }

  private PreSerializedNode element(final ElementNode element, final int level, final Map<String, String> parentScope) {
    final Map<String, String> scope = new LinkedHashMap<>(parentScope);
    final Map<String, String> declarations = new LinkedHashMap<>();

    // The element's own binding.
    final String ownPrefix = element.getPrefix() == null ? DEFAULT_NS : element.getPrefix();
    final String ownNamespace = element.getNamespaceURI() == null ? "" : element.getNamespaceURI();
    if (!QNames.XML_PREFIX.equals(ownPrefix)) {
      final String bound = scope.getOrDefault(ownPrefix, "");
      if (!bound.equals(ownNamespace)) {
        declare(ownPrefix, ownNamespace, scope, declarations);
      }
    }

    // Explicit declarations.
    final ImmutableList.Builder<PreSerializedAttribute> attributes = ImmutableList.builder();
    for (final AttributeNode attribute : element.getAttributes()) {
      if (!attribute.isNamespaceDeclaration()) {
        continue;
      }
      final String prefix = attribute.getPrefix() == null ? DEFAULT_NS : attribute.getLocalName();
      final String uri = attribute.getValue() == null ? "" : attribute.getValue();
      if (QNames.XML_PREFIX.equals(prefix) || QNames.XMLNS.equals(prefix)) {
        continue;
      }
      if (prefix.equals(ownPrefix) && !uri.equals(ownNamespace)) {
        LOGGER.warn("Dropped declaration {}=\"{}\" on element {}, which is bound to \"{}\".",
            attribute.getQualifiedName(), uri, element.getQualifiedName(), ownNamespace);
        continue;
      }
      if (!uri.equals(scope.getOrDefault(prefix, ""))) {
        declare(prefix, uri, scope, declarations);
      }
    }

    // Attributes, choosing prefixes for namespaced ones.
    for (final AttributeNode attribute : element.getAttributes()) {
      if (attribute.isNamespaceDeclaration()) {
        continue;
      }
      final String value = attribute.getValue();
      if (value == null && !keepNullAttributes) {
        continue;
      }
      final String namespace = attribute.getNamespaceURI();
      final String name;
      if (namespace == null) {
        name = attribute.getLocalName();
      } else if (QNames.XML_NAMESPACE.equals(namespace)) {
        name = QNames.qualify(QNames.XML_PREFIX, attribute.getLocalName());
      } else {
        name = QNames.qualify(attributePrefix(attribute, namespace, scope, declarations), attribute.getLocalName());
      }
      attributes.add(new PreSerializedAttribute(attribute, name, value == null ? "" : value));
    }

    final ImmutableList.Builder<PreSerializedNamespace> namespaces = ImmutableList.builder();
    declarations.forEach((prefix, uri) -> namespaces.add(
        new PreSerializedNamespace(prefix.isEmpty() ? QNames.XMLNS : QNames.qualify(QNames.XMLNS, prefix), uri)));

    final ImmutableList.Builder<PreSerializedNode> children = ImmutableList.builder();
    for (final Node child : element.getChildNodes()) {
      final PreSerializedNode serialized = child instanceof ElementNode childElement
          ? element(childElement, level + 1, scope)
          : child(child, level + 1, false);
      if (serialized != null) {
        children.add(serialized);
      }
    }

    return new PreSerializedNode(element, level, element.getQualifiedName(), null, attributes.build(),
        namespaces.build(), children.build());
  }

  private static String attributePrefix(final AttributeNode attribute, final String namespace,
      final Map<String, String> scope, final Map<String, String> declarations) {
    final String prefix = attribute.getPrefix();
    if (prefix != null && namespace.equals(scope.get(prefix))) {
      return prefix;
    }
    for (final Map.Entry<String, String> binding : scope.entrySet()) {
      if (!binding.getKey().isEmpty() && binding.getValue().equals(namespace)) {
        return binding.getKey();
      }
    }
    if (prefix != null && !scope.containsKey(prefix)) {
      declare(prefix, namespace, scope, declarations);
      return prefix;
    }
    int index = 1;
    while (scope.containsKey(GENERATED_PREFIX + index)) {
      index++;
    }
    final String generated = GENERATED_PREFIX + index;
    declare(generated, namespace, scope, declarations);
    return generated;
  }

  private static void declare(final String prefix, final String uri, final Map<String, String> scope,
      final Map<String, String> declarations) {
    scope.put(prefix, uri);
    declarations.put(prefix, uri);
  }
}
