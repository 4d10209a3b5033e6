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
import io.domscribe.utils.TreeOrder;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A node which can have children: documents, document fragments and elements. The child list is
 * the sole owner of the children.
 *
 * @author Johannes Lichtenberger
 */
public abstract class StructNode extends Node {

  /** Keys of the children in tree order. */
  private final LongArrayList childKeys;

  StructNode(final long nodeKey, final NodeStore store) {
    super(nodeKey, store);
    childKeys = new LongArrayList();
  }

  @Override
  public int getChildCount() {
    return childKeys.size();
  }

  @Override
  public Node getChild(final int index) {
    return requireNonNull(store.get(childKeys.getLong(index)));
  }

  @Override
  public List<Node> getChildNodes() {
    final ImmutableList.Builder<Node> children = ImmutableList.builderWithExpectedSize(childKeys.size());
    for (int i = 0, count = childKeys.size(); i < count; i++) {
      children.add(getChild(i));
    }
    return children.build();
  }

  /**
   * Position of a child.
   *
   * @param child the child
   * @return the position or {@code -1} if it's not a child of this node
   */
  public int indexOf(final Node child) {
    if (child.getParentKey() != getNodeKey()) {
      return -1;
    }
    return childKeys.indexOf(child.getNodeKey());
  }

  /**
   * Appends a node as the last child. If the node is a document fragment its children are moved
   * instead.
   *
   * @param child the node to append
   * @param <N> node type
   * @return the appended node
   */
  public <N extends Node> N appendChild(final N child) {
    return insertBefore(child, null);
  }

  /**
   * Inserts a node before a reference child. A node which already has a parent is removed from it
   * first. If the node is a document fragment its children are moved instead.
   *
   * @param newChild the node to insert
   * @param refChild the child to insert before, {@code null} to append
   * @param <N> node type
   * @return the inserted node
   * @throws HierarchyRequestException if the node can't be a child of this node
   * @throws NotFoundException if {@code refChild} is not a child of this node
   * @throws WrongDocumentException if the node belongs to another document
   */
  public <N extends Node> N insertBefore(final N newChild, final @Nullable Node refChild) {
    requireNonNull(newChild);
    ensurePreInsertionValidity(newChild, refChild);

    Node reference = refChild;
    if (reference == newChild) {
      reference = newChild.getNextSibling();
    }

    if (newChild instanceof DocumentFragmentNode fragment) {
      for (final Node child : fragment.getChildNodes()) {
        fragment.removeChild(child);
        insert(child, reference);
      }
    } else {
      final StructNode oldParent = newChild.getParent();
      if (oldParent != null) {
        oldParent.removeChild(newChild);
      }
      insert(newChild, reference);
    }
    return newChild;
  }

  private void insert(final Node node, final @Nullable Node reference) {
    if (reference == null) {
      childKeys.add(node.getNodeKey());
    } else {
      childKeys.add(indexOf(reference), node.getNodeKey());
    }
    node.setParentKey(getNodeKey());
  }

  /**
   * Removes a child.
   *
   * @param child the child to remove
   * @param <N> node type
   * @return the removed child, now without parent
   * @throws NotFoundException if the node is not a child of this node
   */
  public <N extends Node> N removeChild(final N child) {
    final int index = indexOf(requireNonNull(child));
    if (index == -1) {
      throw new NotFoundException("%s is not a child of %s.", child.getNodeName(), getNodeName());
    }
    childKeys.removeLong(index);
    child.setParentKey(Fixed.NULL_NODE_KEY.getStandardProperty());
    return child;
  }

  private void ensurePreInsertionValidity(final Node node, final @Nullable Node refChild) {
    if (node.store != store) {
      throw new WrongDocumentException("%s belongs to another document, import it first.", node.getNodeName());
    }
    if (node == this || TreeOrder.isDescendantOf(node, this)) {
      throw new HierarchyRequestException("%s can't be inserted into its own subtree.", node.getNodeName());
    }
    if (refChild != null && refChild.getParentKey() != getNodeKey()) {
      throw new NotFoundException("%s is not a child of %s.", refChild.getNodeName(), getNodeName());
    }
    switch (node.getKind()) {
      case DOCUMENT, ATTRIBUTE -> throw new HierarchyRequestException("A %s node can't be a child.", node.getKind());
      case DOCUMENT_TYPE -> {
        if (getKind() != NodeKind.DOCUMENT) {
          throw new HierarchyRequestException("A document type can only be a child of a document.");
        }
      }
      default -> {
        // Allowed in general, a document narrows it down below.
      }
    }
    checkChild(node, refChild);
  }

  /**
   * Hook for node specific restrictions on children.
   *
   * @param node the node to insert
   * @param refChild the child to insert before, or {@code null}
   */
  void checkChild(final Node node, final @Nullable Node refChild) {
  }
}
