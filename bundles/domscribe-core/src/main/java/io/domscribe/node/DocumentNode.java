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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import io.domscribe.exception.HierarchyRequestException;
import io.domscribe.exception.InvalidCharacterException;
import io.domscribe.settings.Fixed;
import io.domscribe.utils.ExtractedName;
import io.domscribe.utils.QNames;
import io.domscribe.utils.XMLToken;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The document node. It is the first node of its {@link NodeStore} and the factory for every other
 * node of the store.
 *
 * @author Johannes Lichtenberger
 */
public final class DocumentNode extends StructNode {

  private DocumentNode(final NodeStore store) {
    super(Fixed.DOCUMENT_NODE_KEY.getStandardProperty(), store);
  }

  /**
   * Creates an empty document with its own node store.
   *
   * @return the new document
   */
  public static DocumentNode create() {
    final NodeStore store = new NodeStore();
    return store.register(new DocumentNode(store));
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.DOCUMENT;
  }

  @Override
  public String getNodeName() {
    return NodeKind.DOCUMENT.getFixedName();
  }

  @Override
  public @Nullable DocumentNode getOwnerDocument() {
    return null;
  }

  /**
   * Get the document element.
   *
   * @return the element child or {@code null} if there is none
   */
  public @Nullable ElementNode getDocumentElement() {
    for (int i = 0, count = getChildCount(); i < count; i++) {
      if (getChild(i) instanceof ElementNode element) {
        return element;
      }
    }
    return null;
  }

  /**
   * Get the document type declaration.
   *
   * @return the doctype child or {@code null} if there is none
   */
  public @Nullable DocumentTypeNode getDoctype() {
    for (int i = 0, count = getChildCount(); i < count; i++) {
      if (getChild(i) instanceof DocumentTypeNode doctype) {
        return doctype;
      }
    }
    return null;
  }

  /**
   * Creates an element without namespace. The qualified name is taken as local name.
   *
   * @param qualifiedName the element name
   * @return the detached element
   * @throws InvalidCharacterException if the name is not a valid qualified name
   */
  public ElementNode createElement(final String qualifiedName) {
    QNames.validateQName(qualifiedName);
    return store.register(new ElementNode(store.nextKey(), store, null, null, qualifiedName));
  }

  /**
   * Creates an element in a namespace.
   *
   * @param namespace namespace URI, {@code null} or empty for no namespace
   * @param qualifiedName qualified name, optionally prefixed
   * @return the detached element
   */
  public ElementNode createElementNS(final @Nullable String namespace, final String qualifiedName) {
    final ExtractedName names = QNames.extractNames(namespace, qualifiedName);
    return store.register(
        new ElementNode(store.nextKey(), store, names.namespace(), names.prefix(), names.localName()));
  }

  public AttributeNode createAttribute(final String qualifiedName) {
    QNames.validateQName(qualifiedName);
    return store.register(new AttributeNode(store.nextKey(), store, null, null, qualifiedName));
  }

  public AttributeNode createAttributeNS(final @Nullable String namespace, final String qualifiedName) {
    final ExtractedName names = QNames.extractNames(namespace, qualifiedName);
    return store.register(
        new AttributeNode(store.nextKey(), store, names.namespace(), names.prefix(), names.localName()));
  }

  public TextNode createTextNode(final @Nullable String data) {
    return store.register(new TextNode(store.nextKey(), store, data));
  }

  /**
   * Creates a CDATA section.
   *
   * @param data the content, may be {@code null}
   * @return the detached CDATA section
   * @throws InvalidCharacterException if the content contains {@code ]]>}
   */
  public CDataSectionNode createCDATASection(final @Nullable String data) {
    if (data != null && data.contains("]]>")) {
      throw new InvalidCharacterException("CDATA section content must not contain ']]>'.");
    }
    return store.register(new CDataSectionNode(store.nextKey(), store, data));
  }

  public CommentNode createComment(final @Nullable String data) {
    return store.register(new CommentNode(store.nextKey(), store, data));
  }

  /**
   * Creates a processing instruction.
   *
   * @param target the target, an XML name
   * @param data the content, may be {@code null}
   * @return the detached processing instruction
   * @throws InvalidCharacterException if the target is not a name or the content contains
   *         {@code ?>}
   */
  public PINode createProcessingInstruction(final String target, final @Nullable String data) {
    if (!XMLToken.isName(requireNonNull(target))) {
      throw new InvalidCharacterException("'%s' is not a valid processing instruction target.", target);
    }
    if (data != null && data.contains("?>")) {
      throw new InvalidCharacterException("Processing instruction content must not contain '?>'.");
    }
    return store.register(new PINode(store.nextKey(), store, target, data));
  }

  /**
   * Creates a document type declaration.
   *
   * @param name the qualified name of the document element
   * @param publicId the public identifier, empty for none
   * @param systemId the system identifier, empty for none
   * @return the detached doctype
   */
  public DocumentTypeNode createDocumentType(final String name, final String publicId, final String systemId) {
    QNames.validateQName(name);
    return store.register(new DocumentTypeNode(store.nextKey(), store, name, publicId, systemId));
  }

  public DocumentFragmentNode createDocumentFragment() {
    return store.register(new DocumentFragmentNode(store.nextKey(), store));
  }

  /**
   * Copies a node of another document (or of this one) into this document.
   *
   * @param node the node to import
   * @param deep if {@code true} the subtree is copied as well
   * @return the detached copy owned by this document
   * @throws IllegalArgumentException if {@code node} is a document
   */
  public Node importNode(final Node node, final boolean deep) {
    checkArgument(node.getKind() != NodeKind.DOCUMENT, "documents can't be imported");
    return copy(node, deep);
  }

  /**
   * Copies a node into this document's store. A document is copied into a new document instead.
   */
  Node copy(final Node node, final boolean deep) {
    final Node copy;
    switch (node.getKind()) {
      case DOCUMENT -> {
        final DocumentNode document = create();
        if (deep) {
          for (final Node child : node.getChildNodes()) {
            document.appendChild(document.copy(child, true));
          }
        }
        return document;
      }
      case DOCUMENT_FRAGMENT -> copy = createDocumentFragment();
      case ELEMENT -> {
        final ElementNode element = (ElementNode) node;
        final ElementNode elementCopy = store.register(new ElementNode(store.nextKey(), store,
            element.getNamespaceURI(), element.getPrefix(), element.getLocalName()));
        for (final AttributeNode attribute : element.getAttributes()) {
          elementCopy.setAttributeNode((AttributeNode) copy(attribute, false));
        }
        copy = elementCopy;
      }
      case ATTRIBUTE -> {
        final AttributeNode attribute = (AttributeNode) node;
        final AttributeNode attributeCopy = store.register(new AttributeNode(store.nextKey(), store,
            attribute.getNamespaceURI(), attribute.getPrefix(), attribute.getLocalName()));
        attributeCopy.setValue(attribute.getValue());
        copy = attributeCopy;
      }
      case TEXT -> copy = createTextNode(((TextNode) node).getData());
      case CDATA_SECTION -> copy = store.register(
          new CDataSectionNode(store.nextKey(), store, ((CDataSectionNode) node).getData()));
      case COMMENT -> copy = createComment(((CommentNode) node).getData());
      case PROCESSING_INSTRUCTION -> {
        final PINode pi = (PINode) node;
        copy = store.register(new PINode(store.nextKey(), store, pi.getTarget(), pi.getData()));
      }
      case DOCUMENT_TYPE -> {
        final DocumentTypeNode doctype = (DocumentTypeNode) node;
        copy = store.register(new DocumentTypeNode(store.nextKey(), store, doctype.getName(),
            doctype.getPublicId(), doctype.getSystemId()));
      }
      default -> throw new AssertionError(node.getKind());
    }

    if (deep && copy instanceof StructNode parent) {
      for (final Node child : node.getChildNodes()) {
        parent.appendChild(copy(child, true));
      }
    }
    return copy;
  }

  @Override
  void checkChild(final Node node, final @Nullable Node refChild) {
    switch (node.getKind()) {
      case TEXT, CDATA_SECTION -> throw new HierarchyRequestException("A document can't have %s children.",
          node.getNodeName());
      case DOCUMENT_FRAGMENT -> {
        int elements = 0;
        for (final Node child : node.getChildNodes()) {
          switch (child.getKind()) {
            case TEXT, CDATA_SECTION -> throw new HierarchyRequestException(
                "A document can't have %s children.", child.getNodeName());
            case ELEMENT -> elements++;
            default -> {
            }
          }
        }
        if (elements > 1) {
          throw new HierarchyRequestException("A document can't have more than one element child.");
        }
        if (elements == 1) {
          checkElementPlacement(node, refChild);
        }
      }
      case ELEMENT -> checkElementPlacement(node, refChild);
      case DOCUMENT_TYPE -> {
        for (int i = 0, count = getChildCount(); i < count; i++) {
          final Node child = getChild(i);
          if (child != node && child.getKind() == NodeKind.DOCUMENT_TYPE) {
            throw new HierarchyRequestException("A document can't have more than one doctype.");
          }
        }
        final int end = refChild == null ? getChildCount() : indexOf(refChild);
        for (int i = 0; i < end; i++) {
          if (getChild(i).getKind() == NodeKind.ELEMENT) {
            throw new HierarchyRequestException("The doctype must precede the document element.");
          }
        }
      }
      default -> {
      }
    }
  }

  private void checkElementPlacement(final Node node, final @Nullable Node refChild) {
    final ElementNode documentElement = getDocumentElement();
    if (documentElement != null && documentElement != node) {
      throw new HierarchyRequestException("A document can't have more than one element child.");
    }
    if (refChild != null) {
      for (int i = indexOf(refChild), count = getChildCount(); i < count; i++) {
        if (getChild(i).getKind() == NodeKind.DOCUMENT_TYPE) {
          throw new HierarchyRequestException("The document element must follow the doctype.");
        }
      }
    }
  }
}
