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

package io.domscribe.node;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import io.domscribe.exception.HierarchyRequestException;
import io.domscribe.exception.NotFoundException;
import io.domscribe.exception.WrongDocumentException;
import io.domscribe.settings.Fixed;
import io.domscribe.utils.ExtractedName;
import io.domscribe.utils.QNames;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import java.util.List;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Element node. Its attributes are kept in insertion order, but no two of them share the same
 * namespace URI and local name.
 *
 * @author Johannes Lichtenberger
 */
public final class ElementNode extends StructNode {

  private final @Nullable String namespaceURI;

  private final @Nullable String prefix;

  private final String localName;

  /** Keys of the attributes in insertion order. */
  private final LongArrayList attributeKeys;

  ElementNode(final long nodeKey, final NodeStore store, final @Nullable String namespaceURI,
      final @Nullable String prefix, final String localName) {
    super(nodeKey, store);
    this.namespaceURI = namespaceURI;
    this.prefix = prefix;
    this.localName = requireNonNull(localName);
    attributeKeys = new LongArrayList();
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.ELEMENT;
  }

  @Override
  public String getNodeName() {
    return getQualifiedName();
  }

  public @Nullable String getNamespaceURI() {
    return namespaceURI;
  }

  public @Nullable String getPrefix() {
    return prefix;
  }

  public String getLocalName() {
    return localName;
  }

  public String getQualifiedName() {
    return QNames.qualify(prefix, localName);
  }

  public int getAttributeCount() {
    return attributeKeys.size();
  }

  public AttributeNode getAttributeAt(final int index) {
    return (AttributeNode) requireNonNull(store.get(attributeKeys.getLong(index)));
  }

  /**
   * Get a snapshot of the attributes.
   *
   * @return the attributes in insertion order
   */
  public List<AttributeNode> getAttributes() {
    final ImmutableList.Builder<AttributeNode> attributes =
        ImmutableList.builderWithExpectedSize(attributeKeys.size());
    for (int i = 0, count = attributeKeys.size(); i < count; i++) {
      attributes.add(getAttributeAt(i));
    }
    return attributes.build();
  }

  /**
   * Get the first attribute with the given qualified name.
   *
   * @param qualifiedName qualified name
   * @return the attribute or {@code null}
   */
  public @Nullable AttributeNode getAttributeNode(final String qualifiedName) {
    for (int i = 0, count = attributeKeys.size(); i < count; i++) {
      final AttributeNode attribute = getAttributeAt(i);
      if (attribute.getQualifiedName().equals(qualifiedName)) {
        return attribute;
      }
    }
    return null;
  }

  /**
   * Get the attribute with the given namespace URI and local name.
   *
   * @param namespace namespace URI, {@code null} or empty for no namespace
   * @param localName local name
   * @return the attribute or {@code null}
   */
  public @Nullable AttributeNode getAttributeNodeNS(final @Nullable String namespace, final String localName) {
    final String ns = namespace == null || namespace.isEmpty() ? null : namespace;
    for (int i = 0, count = attributeKeys.size(); i < count; i++) {
      final AttributeNode attribute = getAttributeAt(i);
      if (Objects.equals(attribute.getNamespaceURI(), ns) && attribute.getLocalName().equals(localName)) {
        return attribute;
      }
    }
    return null;
  }

  /**
   * Get the value of the first attribute with the given qualified name.
   *
   * @param qualifiedName qualified name
   * @return the value or {@code null} if there's no such attribute
   */
  public @Nullable String getAttribute(final String qualifiedName) {
    final AttributeNode attribute = getAttributeNode(qualifiedName);
    return attribute == null ? null : attribute.getValue();
  }

  public boolean hasAttribute(final String qualifiedName) {
    return getAttributeNode(qualifiedName) != null;
  }

  /**
   * Sets the value of an attribute without namespace, creating it if needed.
   *
   * @param qualifiedName qualified name
   * @param value the value, may be {@code null}
   * @return the attribute
   */
  public AttributeNode setAttribute(final String qualifiedName, final @Nullable String value) {
    QNames.validateQName(qualifiedName);
    AttributeNode attribute = getAttributeNode(qualifiedName);
    if (attribute == null) {
      attribute = store.getDocument().createAttribute(qualifiedName);
      attribute.setValue(value);
      append(attribute);
    } else {
      attribute.setValue(value);
    }
    return attribute;
  }

  /**
   * Sets the value of a namespaced attribute, creating it if needed.
   *
   * @param namespace namespace URI, {@code null} or empty for no namespace
   * @param qualifiedName qualified name
   * @param value the value, may be {@code null}
   * @return the attribute
   */
  public AttributeNode setAttributeNS(final @Nullable String namespace, final String qualifiedName,
      final @Nullable String value) {
    final ExtractedName names = QNames.extractNames(namespace, qualifiedName);
    AttributeNode attribute = getAttributeNodeNS(names.namespace(), names.localName());
    if (attribute == null) {
      attribute = store.getDocument().createAttributeNS(names.namespace(), qualifiedName);
      attribute.setValue(value);
      append(attribute);
    } else {
      attribute.setValue(value);
    }
    return attribute;
  }

  /**
   * Adds an attribute, replacing the one with the same namespace URI and local name.
   *
   * @param attribute the attribute to add
   * @return the replaced attribute or {@code null}
   * @throws WrongDocumentException if the attribute belongs to another document
   * @throws HierarchyRequestException if the attribute belongs to another element
   */
  public @Nullable AttributeNode setAttributeNode(final AttributeNode attribute) {
    if (attribute.store != store) {
      throw new WrongDocumentException("Attribute %s belongs to another document.", attribute.getQualifiedName());
    }
    final ElementNode owner = attribute.getOwnerElement();
    if (owner != null && owner != this) {
      throw new HierarchyRequestException("Attribute %s is in use by another element.", attribute.getQualifiedName());
    }
    final AttributeNode old = getAttributeNodeNS(attribute.getNamespaceURI(), attribute.getLocalName());
    if (old == attribute) {
      return attribute;
    }
    if (old == null) {
      append(attribute);
    } else {
      attributeKeys.set(attributeKeys.indexOf(old.getNodeKey()), attribute.getNodeKey());
      old.setOwnerElementKey(Fixed.NULL_NODE_KEY.getStandardProperty());
      attribute.setOwnerElementKey(getNodeKey());
    }
    return old;
  }

  private void append(final AttributeNode attribute) {
    attributeKeys.add(attribute.getNodeKey());
    attribute.setOwnerElementKey(getNodeKey());
  }

  /**
   * Removes the first attribute with the given qualified name, if any.
   *
   * @param qualifiedName qualified name
   * @return the removed attribute or {@code null}
   */
  public @Nullable AttributeNode removeAttribute(final String qualifiedName) {
    final AttributeNode attribute = getAttributeNode(qualifiedName);
    return attribute == null ? null : removeAttributeNode(attribute);
  }

  /**
   * Removes the attribute with the given namespace URI and local name, if any.
   *
   * @param namespace namespace URI, {@code null} or empty for no namespace
   * @param localName local name
   * @return the removed attribute or {@code null}
   */
  public @Nullable AttributeNode removeAttributeNS(final @Nullable String namespace, final String localName) {
    final AttributeNode attribute = getAttributeNodeNS(namespace, localName);
    return attribute == null ? null : removeAttributeNode(attribute);
  }

  /**
   * Removes an attribute.
   *
   * @param attribute the attribute
   * @return the removed attribute
   * @throws NotFoundException if it's not an attribute of this element
   */
  public AttributeNode removeAttributeNode(final AttributeNode attribute) {
    final int index = attributeKeys.indexOf(attribute.getNodeKey());
    if (index == -1 || attribute.store != store) {
      throw new NotFoundException("%s is not an attribute of %s.", attribute.getQualifiedName(), getQualifiedName());
    }
    attributeKeys.removeLong(index);
    attribute.setOwnerElementKey(Fixed.NULL_NODE_KEY.getStandardProperty());
    return attribute;
  }

  @Override
  @Nullable
  String locateNamespace(final @Nullable String prefix) {
    if (namespaceURI != null && Objects.equals(this.prefix, prefix)) {
      return namespaceURI;
    }
    for (int i = 0, count = attributeKeys.size(); i < count; i++) {
      final AttributeNode attribute = getAttributeAt(i);
      if (!QNames.XMLNS_NAMESPACE.equals(attribute.getNamespaceURI())) {
        continue;
      }
      final boolean declaresPrefix = QNames.XMLNS.equals(attribute.getPrefix())
          && attribute.getLocalName().equals(prefix);
      final boolean declaresDefault = prefix == null && attribute.getPrefix() == null
          && QNames.XMLNS.equals(attribute.getLocalName());
      if (declaresPrefix || declaresDefault) {
        final String value = attribute.getValue();
        return value == null || value.isEmpty() ? null : value;
      }
    }
    final ElementNode parent = getParentElement();
    return parent == null ? null : parent.locateNamespace(prefix);
  }
}
