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

import io.domscribe.settings.Fixed;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Arena owning all nodes of one document. Nodes are addressed by their node key, which is the
 * index into the arena; parent, owner and child links between nodes are plain keys. Nodes are
 * never removed from the arena, a node taken out of the tree just has no parent anymore.
 *
 * @author Johannes Lichtenberger
 */
public final class NodeStore {

  /** All nodes, indexed by node key. */
  private final ObjectArrayList<Node> nodes;

  NodeStore() {
    nodes = new ObjectArrayList<>();
  }

  /**
   * The key the next registered node gets.
   *
   * @return next free node key
   */
  long nextKey() {
    return nodes.size();
  }

  /**
   * Registers a freshly created node.
   *
   * @param node the node, whose key must be {@link #nextKey()}
   * @param <N> node type
   * @return the node
   */
  <N extends Node> N register(final N node) {
    checkArgument(node.getNodeKey() == nodes.size(), "node key %s is not the next free key", node.getNodeKey());
    nodes.add(node);
    return node;
  }

  /**
   * Get a node by key.
   *
   * @param nodeKey the node key
   * @return the node or {@code null} for {@link Fixed#NULL_NODE_KEY}
   * @throws IllegalArgumentException if no node with the key exists
   */
  public @Nullable Node get(final long nodeKey) {
    if (nodeKey == Fixed.NULL_NODE_KEY.getStandardProperty()) {
      return null;
    }
    checkArgument(nodeKey >= 0 && nodeKey < nodes.size(), "unknown node key %s", nodeKey);
    return nodes.get((int) nodeKey);
  }

  /**
   * The document owning this arena.
   *
   * @return the document node
   */
  public DocumentNode getDocument() {
    return (DocumentNode) nodes.get((int) Fixed.DOCUMENT_NODE_KEY.getStandardProperty());
  }

  /**
   * Number of nodes ever created in this arena, attached or not.
   *
   * @return the number of nodes
   */
  public int size() {
    return nodes.size();
  }
}
