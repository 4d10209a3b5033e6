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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.domscribe.node.DocumentNode;
import io.domscribe.node.ElementNode;
import io.domscribe.node.Node;
import io.domscribe.node.TextNode;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

/**
 * Works on {@code <r><a>t</a><b/></r>}, whose descendants in preorder are r, a, t and b.
 */
class TreeOrderTest {

  private DocumentNode document;

  private ElementNode r;

  private ElementNode a;

  private TextNode t;

  private ElementNode b;

  @BeforeEach
  void setUp() {
    document = DocumentNode.create();
    r = document.appendChild(document.createElement("r"));
    a = r.appendChild(document.createElement("a"));
    t = a.appendChild(document.createTextNode("t"));
    b = r.appendChild(document.createElement("b"));
  }

  @Test
  @SuppressWarnings("unchecked")
  void testForEachDescendantVisitsInPreorder() {
    final Function<Node, Object> visitor = mock(Function.class);

    assertNull(TreeOrder.forEachDescendant(document, visitor));

    final InOrder order = inOrder(visitor);
    order.verify(visitor).apply(r);
    order.verify(visitor).apply(a);
    order.verify(visitor).apply(t);
    order.verify(visitor).apply(b);
    order.verifyNoMoreInteractions();
  }

  @Test
  @SuppressWarnings("unchecked")
  void testForEachDescendantStopsAtFirstResult() {
    final Function<Node, Object> visitor = mock(Function.class);
    when(visitor.apply(any())).thenReturn(null);
    when(visitor.apply(a)).thenReturn("stop");

    assertEquals("stop", TreeOrder.forEachDescendant(document, visitor));

    verify(visitor).apply(r);
    verify(visitor, never()).apply(t);
    verify(visitor, never()).apply(b);
  }

  @Test
  void testForEachDescendantExcludesStart() {
    assertNull(TreeOrder.forEachDescendant(t, node -> "never"));
    assertEquals("t", TreeOrder.forEachDescendant(a, node -> node == t ? "t" : null));
  }

  @Test
  void testDescendantAndAncestor() {
    assertTrue(TreeOrder.isDescendantOf(r, t));
    assertTrue(TreeOrder.isDescendantOf(document, b));
    assertFalse(TreeOrder.isDescendantOf(t, r));
    assertFalse(TreeOrder.isDescendantOf(r, r));
    assertFalse(TreeOrder.isDescendantOf(a, b));

    assertTrue(TreeOrder.isAncestorOf(t, r));
    assertFalse(TreeOrder.isAncestorOf(r, t));
    assertFalse(TreeOrder.isAncestorOf(r, r));
  }

  @Test
  void testTreePosition() {
    assertEquals(1, TreeOrder.treePosition(document, r));
    assertEquals(2, TreeOrder.treePosition(document, a));
    assertEquals(3, TreeOrder.treePosition(document, t));
    assertEquals(4, TreeOrder.treePosition(document, b));
    assertEquals(1, TreeOrder.treePosition(a, t));
    assertEquals(-1, TreeOrder.treePosition(document, document));
    assertEquals(-1, TreeOrder.treePosition(a, b));
    assertEquals(-1, TreeOrder.treePosition(null, r));
    assertEquals(-1, TreeOrder.treePosition(document, document.createElement("detached")));
  }

  @Test
  void testPrecedingAndFollowing() {
    assertTrue(TreeOrder.isPreceding(b, a));
    assertTrue(TreeOrder.isPreceding(t, r));
    assertFalse(TreeOrder.isPreceding(a, b));
    assertFalse(TreeOrder.isPreceding(a, a));

    assertTrue(TreeOrder.isFollowing(a, b));
    assertTrue(TreeOrder.isFollowing(r, t));
    assertFalse(TreeOrder.isFollowing(b, a));
  }

  @Test
  void testPrecedingNeedsSameDocument() {
    final DocumentNode other = DocumentNode.create();
    final ElementNode foreign = other.appendChild(other.createElement("r"));

    assertFalse(TreeOrder.isPreceding(b, foreign));
    assertFalse(TreeOrder.isFollowing(a, foreign));
    assertFalse(TreeOrder.isFollowing(a, document.createElement("detached")));
    assertFalse(TreeOrder.isFollowing(document, r));
  }
}
