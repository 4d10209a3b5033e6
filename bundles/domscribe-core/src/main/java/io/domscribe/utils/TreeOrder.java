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

package io.domscribe.utils;

import static java.util.Objects.requireNonNull;

import io.domscribe.node.DocumentNode;
import io.domscribe.node.Node;
import java.util.function.Function;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Tree order (preorder) computations over the node graph: descendant and ancestor tests, preorder
 * positions and the preceding/following relations. Attributes are not part of the tree.
 *
 * @author Johannes Lichtenberger
 */
public final class TreeOrder {

  private TreeOrder() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Visits all descendants of {@code node} (excluding {@code node} itself) in preorder. The walk
   * stops at the first non-{@code null} result of the visitor.
   *
   * @param node the node whose descendants are visited
   * @param visitor returns {@code null} to continue with the next descendant or a value to stop
   * @param <T> result type of the visitor
   * @return the first non-{@code null} visitor result, or {@code null} if all descendants were
   *         visited
   */
  public static <T> @Nullable T forEachDescendant(final Node node,
      final Function<? super Node, ? extends @Nullable T> visitor) {
    requireNonNull(visitor);
    for (int i = 0, count = node.getChildCount(); i < count; i++) {
      final Node child = node.getChild(i);
      T result = visitor.apply(child);
      if (result != null) {
        return result;
      }
      result = forEachDescendant(child, visitor);
      if (result != null) {
        return result;
      }
    }
    return null;
  }

  /**
   * Determines whether {@code other} is a descendant of {@code node}.
   *
   * @param node a node
   * @param other the node to check
   * @return {@code true} if {@code other} is somewhere in the subtree below {@code node}
   */
  public static boolean isDescendantOf(final Node node, final Node other) {
    for (int i = 0, count = node.getChildCount(); i < count; i++) {
      final Node child = node.getChild(i);
      if (child == other || isDescendantOf(child, other)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Determines whether {@code other} is an ancestor of {@code node}.
   *
   * @param node a node
   * @param other the node to check
   * @return {@code true} if {@code node} is somewhere in the subtree below {@code other}
   */
  public static boolean isAncestorOf(final Node node, final Node other) {
    return isDescendantOf(other, node);
  }

  /**
   * The one-based preorder position of {@code node} among the descendants of {@code root}.
   *
   * @param root the root of the tree, may be {@code null}
   * @param node the node to get the position of
   * @return the position, or {@code -1} if {@code root} is {@code null} or {@code node} is not a
   *         descendant of it
   */
  public static int treePosition(final @Nullable Node root, final Node node) {
    if (root == null) {
      return -1;
    }
    final int[] position = {0};
    final Integer found = forEachDescendant(root, descendant -> {
      position[0]++;
      return descendant == node ? position[0] : null;
    });
    return found == null ? -1 : found;
  }

  /**
   * Determines whether {@code other} precedes {@code node}, that is both are in the same document
   * and {@code other} comes first in tree order.
   *
   * @param node a node
   * @param other the node to check
   * @return {@code true} if {@code other} is preceding {@code node}
   */
  public static boolean isPreceding(final Node node, final Node other) {
    final int[] positions = positions(node, other);
    return positions != null && positions[1] < positions[0];
  }

  /**
   * Determines whether {@code other} follows {@code node}, that is both are in the same document
   * and {@code other} comes later in tree order.
   *
   * @param node a node
   * @param other the node to check
   * @return {@code true} if {@code other} is following {@code node}
   */
  public static boolean isFollowing(final Node node, final Node other) {
    final int[] positions = positions(node, other);
    return positions != null && positions[1] > positions[0];
  }

  private static int @Nullable [] positions(final Node node, final Node other) {
    final DocumentNode document = node.getOwnerDocument();
    if (document == null || document != other.getOwnerDocument()) {
      return null;
    }
    final int nodePosition = treePosition(document, node);
    final int otherPosition = treePosition(document, other);
    if (nodePosition == -1 || otherPosition == -1) {
      return null;
    }
    return new int[] {nodePosition, otherPosition};
  }
}
