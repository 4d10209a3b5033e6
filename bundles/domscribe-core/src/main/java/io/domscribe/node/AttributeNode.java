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

import io.domscribe.settings.Fixed;
import io.domscribe.utils.QNames;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Attribute node. It belongs to at most one element but is not part of the element's children.
 * The value may be {@code null}; serialization decides whether such an attribute is kept.
 *
 * @author Johannes Lichtenberger
 */
public final class AttributeNode extends Node {

  private final @Nullable String namespaceURI;

  private final @Nullable String prefix;

  private final String localName;

  private @Nullable String value;

  /** Key of the element the attribute belongs to. */
  private long ownerElementKey;

  AttributeNode(final long nodeKey, final NodeStore store, final @Nullable String namespaceURI,
      final @Nullable String prefix, final String localName) {
    super(nodeKey, store);
    this.namespaceURI = namespaceURI;
    this.prefix = prefix;
    this.localName = requireNonNull(localName);
    ownerElementKey = Fixed.NULL_NODE_KEY.getStandardProperty();
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.ATTRIBUTE;
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

  public @Nullable String getValue() {
    return value;
  }

  public void setValue(final @Nullable String value) {
    this.value = value;
  }

  /**
   * Determines if this attribute declares a namespace ({@code xmlns} or {@code xmlns:*}).
   *
   * @return {@code true} for namespace declarations
   */
  public boolean isNamespaceDeclaration() {
    return QNames.XMLNS_NAMESPACE.equals(namespaceURI);
  }

  public @Nullable ElementNode getOwnerElement() {
    return (ElementNode) store.get(ownerElementKey);
  }

  void setOwnerElementKey(final long ownerElementKey) {
    this.ownerElementKey = ownerElementKey;
  }
}
