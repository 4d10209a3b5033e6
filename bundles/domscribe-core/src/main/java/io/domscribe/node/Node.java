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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import io.domscribe.settings.Fixed;
import io.domscribe.utils.QNames;
import java.util.List;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A node of the tree. Each node lives in the {@link NodeStore} of the document which created it and
 * refers to its parent by key only.
 *
 * @author Johannes Lichtenberger
 */
public abstract class Node {

  /** Key of the node in its store. */
  private final long nodeKey;

  /** The arena owning this node. */
  final NodeStore store;

  /** Key of the parent node. */
  private long parentKey;

  Node(final long nodeKey, final NodeStore store) {
    this.nodeKey = nodeKey;
    this.store = requireNonNull(store);
    parentKey = Fixed.NULL_NODE_KEY.getStandardProperty();
  }

  /**
   * Get the kind of the node.
   *
   * @return the node kind
   */
  public abstract NodeKind getKind();

  /**
   * Get the node name as defined by the DOM, e.g. the qualified name of an element or
   * {@code #text}.
   *
   * @return the node name
   */
  public abstract String getNodeName();

  public long getNodeKey() {
    return nodeKey;
  }

  public long getParentKey() {
    return parentKey;
  }

  void setParentKey(final long parentKey) {
    this.parentKey = parentKey;
  }

  /**
   * Get the store owning this node.
   *
   * @return the node store
   */
  public NodeStore getStore() {
    return store;
  }

  /**
   * Get the parent node.
   *
   * @return the parent or {@code null} if the node is not attached
   */
  public @Nullable StructNode getParent() {
    return (StructNode) store.get(parentKey);
  }

  /**
   * Get the parent if it is an element.
   *
   * @return the parent element or {@code null}
   */
  public @Nullable ElementNode getParentElement() {
    final StructNode parent = getParent();
    return parent instanceof ElementNode element ? element : null;
  }

  /**
   * Get the document which created this node.
   *
   * @return the owner document, {@code null} for documents
   */
  public @Nullable DocumentNode getOwnerDocument() {
    return store.getDocument();
  }

  public int getChildCount() {
    return 0;
  }

  /**
   * Get a child by its position.
   *
   * @param index position of the child
   * @return the child
   * @throws IndexOutOfBoundsException if there's no such child
   */
  public Node getChild(final int index) {
    throw new IndexOutOfBoundsException("Node kind " + getKind() + " has no children.");
  }

  /**
   * Get a snapshot of the children.
   *
   * @return the children in tree order
   */
  public List<Node> getChildNodes() {
    return ImmutableList.of();
  }

  public boolean hasChildNodes() {
    return getChildCount() != 0;
  }

  public @Nullable Node getFirstChild() {
    return hasChildNodes() ? getChild(0) : null;
  }

  public @Nullable Node getLastChild() {
    return hasChildNodes() ? getChild(getChildCount() - 1) : null;
  }

  public @Nullable Node getPreviousSibling() {
    final StructNode parent = getParent();
    if (parent == null) {
      return null;
    }
    final int index = parent.indexOf(this);
    return index > 0 ? parent.getChild(index - 1) : null;
  }

  public @Nullable Node getNextSibling() {
    final StructNode parent = getParent();
    if (parent == null) {
      return null;
    }
    final int index = parent.indexOf(this);
    return index + 1 < parent.getChildCount() ? parent.getChild(index + 1) : null;
  }

  /**
   * Finds the namespace URI bound to the given prefix in the scope of this node.
   *
   * @param prefix the prefix, {@code null} or empty for the default namespace
   * @return the namespace URI or {@code null} if the prefix isn't bound
   */
  public @Nullable String lookupNamespaceURI(final @Nullable String prefix) {
    final String key = prefix == null || prefix.isEmpty() ? null : prefix;
    if (QNames.XML_PREFIX.equals(key)) {
      return QNames.XML_NAMESPACE;
    }
    if (QNames.XMLNS.equals(key)) {
      return QNames.XMLNS_NAMESPACE;
    }
    return locateNamespace(key);
  }

  @Nullable
  String locateNamespace(final @Nullable String prefix) {
    switch (getKind()) {
      case DOCUMENT -> {
        final ElementNode documentElement = ((DocumentNode) this).getDocumentElement();
        return documentElement == null ? null : documentElement.locateNamespace(prefix);
      }
      case DOCUMENT_TYPE, DOCUMENT_FRAGMENT -> {
        return null;
      }
      case ATTRIBUTE -> {
        final ElementNode owner = ((AttributeNode) this).getOwnerElement();
        return owner == null ? null : owner.locateNamespace(prefix);
      }
      default -> {
        final ElementNode parent = getParentElement();
        return parent == null ? null : parent.locateNamespace(prefix);
      }
    }
  }

  /**
   * Determines if the given node is equal to this one: same kind, same kind-specific properties,
   * equal attributes in any order and pairwise equal children.
   *
   * @param other the node to compare with
   * @return {@code true} if both nodes are equal
   */
  public boolean isEqualNode(final @Nullable Node other) {
    if (other == null || other.getKind() != getKind()) {
      return false;
    }
    switch (getKind()) {
      case ELEMENT -> {
        final ElementNode element = (ElementNode) this;
        final ElementNode otherElement = (ElementNode) other;
        if (!Objects.equals(element.getNamespaceURI(), otherElement.getNamespaceURI())
            || !Objects.equals(element.getPrefix(), otherElement.getPrefix())
            || !element.getLocalName().equals(otherElement.getLocalName())
            || element.getAttributeCount() != otherElement.getAttributeCount()) {
          return false;
        }
        for (final AttributeNode attribute : element.getAttributes()) {
          if (!attribute.isEqualNode(
              otherElement.getAttributeNodeNS(attribute.getNamespaceURI(), attribute.getLocalName()))) {
            return false;
          }
        }
      }
      case ATTRIBUTE -> {
        final AttributeNode attribute = (AttributeNode) this;
        final AttributeNode otherAttribute = (AttributeNode) other;
        if (!Objects.equals(attribute.getNamespaceURI(), otherAttribute.getNamespaceURI())
            || !attribute.getLocalName().equals(otherAttribute.getLocalName())
            || !Objects.equals(attribute.getValue(), otherAttribute.getValue())) {
          return false;
        }
      }
      case PROCESSING_INSTRUCTION -> {
        if (!((PINode) this).getTarget().equals(((PINode) other).getTarget())
            || !Objects.equals(((PINode) this).getData(), ((PINode) other).getData())) {
          return false;
        }
      }
      case TEXT, CDATA_SECTION, COMMENT -> {
        if (!Objects.equals(((CharacterDataNode) this).getData(), ((CharacterDataNode) other).getData())) {
          return false;
        }
      }
      case DOCUMENT_TYPE -> {
        final DocumentTypeNode doctype = (DocumentTypeNode) this;
        final DocumentTypeNode otherDoctype = (DocumentTypeNode) other;
        if (!doctype.getName().equals(otherDoctype.getName())
            || !doctype.getPublicId().equals(otherDoctype.getPublicId())
            || !doctype.getSystemId().equals(otherDoctype.getSystemId())) {
          return false;
        }
      }
      case DOCUMENT, DOCUMENT_FRAGMENT -> {
        // Nothing beyond the children.
      }
      default -> throw new AssertionError(getKind());
    }

    final int childCount = getChildCount();
    if (childCount != other.getChildCount()) {
      return false;
    }
    for (int i = 0; i < childCount; i++) {
      if (!getChild(i).isEqualNode(other.getChild(i))) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns a copy of this node in the same document. The copy has no parent.
   *
   * @param deep if {@code true} the subtree is copied as well, otherwise only the node itself (and
   *        its attributes, if it is an element)
   * @return the copy
   */
  public Node cloneNode(final boolean deep) {
    return store.getDocument().copy(this, deep);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("nodeKey", nodeKey)
                      .add("kind", getKind())
                      .add("name", getNodeName())
                      .add("parentKey", parentKey)
                      .toString();
  }
}
