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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.collect.ImmutableList;
import io.domscribe.XmlDocumentCreator;
import io.domscribe.node.DocumentNode;
import io.domscribe.node.ElementNode;
import io.domscribe.node.NodeKind;
import io.domscribe.utils.QNames;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Pre-serialization")
class PreSerializerTest {

  private final PreSerializer preSerializer = new PreSerializer(false, false);

  private DocumentNode document;

  @BeforeEach
  void setUp() {
    document = DocumentNode.create();
  }

  private static List<PreSerializedNamespace> namespaces(final String... nameValuePairs) {
    final ImmutableList.Builder<PreSerializedNamespace> namespaces = ImmutableList.builder();
    for (int i = 0; i < nameValuePairs.length; i += 2) {
      namespaces.add(new PreSerializedNamespace(nameValuePairs[i], nameValuePairs[i + 1]));
    }
    return namespaces.build();
  }

  @Test
  void testLevels() {
    final DocumentNode created = XmlDocumentCreator.create();

    final PreSerializedNode root = preSerializer.serialize(created, 0);

    assertSame(created, root.node());
    assertEquals(0, root.level());
    final PreSerializedNode element = root.children().get(0);
    assertEquals(0, element.level());
    assertEquals("root", element.name());
    assertEquals(1, element.children().get(0).level());
    final PreSerializedNode text = element.children().get(0).children().get(0);
    assertEquals(NodeKind.TEXT, text.kind());
    assertEquals(2, text.level());
    assertEquals("x", text.value());
    assertEquals(List.of(new PreSerializedAttribute(created.getDocumentElement().getAttributeNode("id"), "id", "1")),
        element.attributes());
  }

  @Test
  void testDeterministic() {
    final DocumentNode created = XmlDocumentCreator.createMixed();

    assertEquals(preSerializer.serialize(created, 0), preSerializer.serialize(created, 0));
  }

  @Nested
  @DisplayName("namespace declarations")
  class Namespaces {

    @Test
    void testDefaultNamespaceIsDeclaredOnce() {
      final ElementNode root = document.appendChild(document.createElementNS("urn:a", "root"));
      root.appendChild(document.createElementNS("urn:a", "child"));

      final PreSerializedNode serialized = preSerializer.serialize(root, 0);

      assertEquals(namespaces("xmlns", "urn:a"), serialized.namespaces());
      assertTrue(serialized.children().get(0).namespaces().isEmpty());
    }

    @Test
    void testDefaultNamespaceIsUndeclared() {
      final ElementNode root = document.appendChild(document.createElementNS("urn:a", "root"));
      root.appendChild(document.createElement("plain"));

      final PreSerializedNode plain = preSerializer.serialize(root, 0).children().get(0);

      assertEquals(namespaces("xmlns", ""), plain.namespaces());
    }

    @Test
    void testPrefixedElement() {
      final ElementNode root = document.appendChild(document.createElementNS("urn:p", "p:root"));
      root.appendChild(document.createElementNS("urn:p", "p:child"));
      root.appendChild(document.createElementNS("urn:q", "p:other"));

      final PreSerializedNode serialized = preSerializer.serialize(root, 0);

      assertEquals(namespaces("xmlns:p", "urn:p"), serialized.namespaces());
      assertTrue(serialized.children().get(0).namespaces().isEmpty());
      assertEquals(namespaces("xmlns:p", "urn:q"), serialized.children().get(1).namespaces());
    }

    @Test
    void testExplicitDeclarations() {
      final ElementNode root = document.appendChild(document.createElementNS("urn:a", "root"));
      root.setAttributeNS(QNames.XMLNS_NAMESPACE, "xmlns", "urn:a");
      root.setAttributeNS(QNames.XMLNS_NAMESPACE, "xmlns:z", "urn:z");
      root.appendChild(document.createElementNS("urn:z", "z:child"));

      final PreSerializedNode serialized = preSerializer.serialize(root, 0);

      assertEquals(namespaces("xmlns", "urn:a", "xmlns:z", "urn:z"), serialized.namespaces());
      assertTrue(serialized.attributes().isEmpty());
      assertTrue(serialized.children().get(0).namespaces().isEmpty());
    }

    @Test
    void testConflictingDeclarationIsDropped() {
      final ElementNode root = document.appendChild(document.createElementNS("urn:p", "p:root"));
      root.setAttributeNS(QNames.XMLNS_NAMESPACE, "xmlns:p", "urn:other");

      assertEquals(namespaces("xmlns:p", "urn:p"), preSerializer.serialize(root, 0).namespaces());
    }

    @Test
    void testAttributePrefixIsDeclared() {
      final ElementNode root = document.appendChild(document.createElement("root"));
      root.setAttributeNS("urn:b", "b:att", "v");

      final PreSerializedNode serialized = preSerializer.serialize(root, 0);

      assertEquals(namespaces("xmlns:b", "urn:b"), serialized.namespaces());
      assertEquals("b:att", serialized.attributes().get(0).name());
    }

    @Test
    void testAttributeReusesBoundPrefix() {
      final ElementNode root = document.appendChild(document.createElementNS("urn:p", "p:root"));
      root.setAttributeNS("urn:p", "q:att", "v");

      final PreSerializedNode serialized = preSerializer.serialize(root, 0);

      assertEquals(namespaces("xmlns:p", "urn:p"), serialized.namespaces());
      assertEquals("p:att", serialized.attributes().get(0).name());
    }

    @Test
    void testAttributePrefixIsGenerated() {
      final ElementNode root = document.appendChild(document.createElementNS("urn:p", "p:root"));
      root.setAttributeNS("urn:q", "p:first", "1");
      root.setAttributeNS("urn:r", "p:second", "2");

      final PreSerializedNode serialized = preSerializer.serialize(root, 0);

      assertEquals(namespaces("xmlns:p", "urn:p", "xmlns:ns1", "urn:q", "xmlns:ns2", "urn:r"),
          serialized.namespaces());
      assertEquals("ns1:first", serialized.attributes().get(0).name());
      assertEquals("ns2:second", serialized.attributes().get(1).name());
    }

    @Test
    void testXmlPrefixIsNeverDeclared() {
      final ElementNode root = document.appendChild(document.createElement("root"));
      root.setAttributeNS(QNames.XML_NAMESPACE, "xml:lang", "en");

      final PreSerializedNode serialized = preSerializer.serialize(root, 0);

      assertTrue(serialized.namespaces().isEmpty());
      assertEquals("xml:lang", serialized.attributes().get(0).name());
    }

    @Test
    void testSubtreeDeclaresInheritedBindings() {
      final ElementNode root = document.appendChild(document.createElementNS("urn:a", "root"));
      root.setAttributeNS(QNames.XMLNS_NAMESPACE, "xmlns:z", "urn:z");
      root.setAttributeNS(QNames.XMLNS_NAMESPACE, "xmlns:unused", "urn:unused");
      final ElementNode child = root.appendChild(document.createElementNS("urn:a", "child"));
      child.setAttributeNS("urn:z", "z:att", "v");
      child.appendChild(document.createElementNS("urn:a", "grandchild"));

      final PreSerializedNode serialized = preSerializer.serialize(child, 3);

      assertEquals(3, serialized.level());
      assertEquals(namespaces("xmlns", "urn:a", "xmlns:z", "urn:z"), serialized.namespaces());
      assertEquals("z:att", serialized.attributes().get(0).name());
      assertTrue(serialized.children().get(0).namespaces().isEmpty());
    }

    @Test
    void testDeclarationIsScopedToItsSubtree() {
      final ElementNode root = document.appendChild(document.createElement("r"));
      final ElementNode a = root.appendChild(document.createElement("a"));
      a.setAttributeNS(QNames.XMLNS_NAMESPACE, "xmlns:p", "urn:x");
      a.appendChild(document.createElementNS("urn:x", "p:c"));
      root.appendChild(document.createElement("b")).appendChild(document.createElementNS("urn:x", "p:c"));

      final PreSerializedNode serialized = preSerializer.serialize(root, 0);

      final PreSerializedNode serializedA = serialized.children().get(0);
      assertEquals(namespaces("xmlns:p", "urn:x"), serializedA.namespaces());
      assertTrue(serializedA.children().get(0).namespaces().isEmpty());
      final PreSerializedNode serializedB = serialized.children().get(1);
      assertTrue(serializedB.namespaces().isEmpty());
      assertEquals(namespaces("xmlns:p", "urn:x"), serializedB.children().get(0).namespaces());
    }
  }

  @Nested
  @DisplayName("null values")
  class NullValues {

    private ElementNode root;

    @BeforeEach
    void setUp() {
      root = document.appendChild(document.createElement("root"));
      root.setAttribute("empty", null);
      root.appendChild(document.createTextNode(null));
      root.appendChild(document.createComment(null));
    }

    @Test
    void testDroppedByDefault() {
      final PreSerializedNode serialized = preSerializer.serialize(root, 0);

      assertTrue(serialized.attributes().isEmpty());
      assertTrue(serialized.children().isEmpty());
    }

    @Test
    void testKeptAsEmpty() {
      final PreSerializedNode serialized = new PreSerializer(true, true).serialize(root, 0);

      assertEquals("", serialized.attributes().get(0).value());
      assertEquals(2, serialized.children().size());
      assertEquals("", serialized.children().get(0).value());
      assertEquals("", serialized.children().get(1).value());
    }

    @Test
    void testRootIsAlwaysKept() {
      final PreSerializedNode serialized = preSerializer.serialize(document.createTextNode(null), 0);

      assertEquals("", serialized.value());
      assertNull(serialized.name());
    }
  }
}
