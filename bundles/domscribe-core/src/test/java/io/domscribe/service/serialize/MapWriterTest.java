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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.domscribe.XmlDocumentCreator;
import io.domscribe.node.DocumentNode;
import io.domscribe.node.ElementNode;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MapWriterTest {

  private MapWriter writer;

  private DocumentNode document;

  @BeforeEach
  void setUp() {
    writer = new MapWriter(BuilderOptions.DEFAULTS);
    document = DocumentNode.create();
  }

  @Test
  void testDocument() {
    final XmlSerializedValue value = writer.serialize(XmlDocumentCreator.create());

    assertEquals(XmlSerializedValue.Kind.MAP, value.getKind());
    assertTrue(((XmlSerializedMap) value).isOrdered());
    assertEquals(Map.of("root", Map.of("@id", "1", "a", List.of("x", "y"))), value.toObject());
    assertEquals(3, value.descendantCount());
  }

  @Test
  void testTextOnlyElementCollapses() {
    final ElementNode text = document.appendChild(document.createElement("t"));
    text.appendChild(document.createTextNode("a"));
    text.appendChild(document.createTextNode("b"));

    assertEquals(new XmlSerializedString("ab"), writer.serialize(text));
    assertEquals(Map.of("t", "ab"), writer.serialize(document).toObject());
  }

  @Test
  void testEmptyElement() {
    final ElementNode empty = document.appendChild(document.createElement("e"));

    final XmlSerializedValue value = writer.serialize(empty);

    assertTrue(((XmlSerializedMap) value).isEmpty());
    assertEquals(Map.of("e", Map.of()), writer.serialize(document).toObject());
  }

  @Test
  void testMixedContent() {
    final XmlSerializedMap p = (XmlSerializedMap) writer.serialize(XmlDocumentCreator.createMixed()
                                                                                      .getDocumentElement());

    assertEquals(List.of("#text", "#comment", "#cdata", "?pi", "b"), List.copyOf(p.getEntries().keySet()));
    assertEquals(Map.of("#text", "t", "#comment", "c", "#cdata", "d", "?pi", "data", "b", "e"), p.toObject());
  }

  @Test
  void testKeyOrder() {
    final ElementNode root = document.appendChild(document.createElementNS("urn:a", "root"));
    root.setAttribute("id", "1");
    root.appendChild(document.createElementNS("urn:a", "a")).appendChild(document.createTextNode("1"));
    root.appendChild(document.createElementNS("urn:a", "a")).appendChild(document.createTextNode("2"));
    root.appendChild(document.createElementNS("urn:a", "b")).appendChild(document.createTextNode("3"));

    final XmlSerializedMap map = (XmlSerializedMap) writer.serialize(root);

    assertEquals(List.of("@id", "@xmlns", "a", "b"), List.copyOf(map.getEntries().keySet()));
    assertEquals(new XmlSerializedString("urn:a"), map.get("@xmlns"));
    assertEquals(List.of("1", "2"), map.get("a").toObject());
  }

  @Test
  void testInterleavedElementsAreGrouped() {
    final ElementNode root = document.appendChild(document.createElement("root"));
    root.setAttribute("id", "1");
    root.appendChild(document.createElement("a")).appendChild(document.createTextNode("1"));
    root.appendChild(document.createElement("b")).appendChild(document.createTextNode("2"));
    root.appendChild(document.createElement("a")).appendChild(document.createTextNode("3"));
    root.appendChild(document.createElement("a")).appendChild(document.createTextNode("4"));

    final XmlSerializedMap map = (XmlSerializedMap) writer.serialize(root);

    assertEquals(List.of("@id", BuilderOptions.GROUP_KEY), List.copyOf(map.getEntries().keySet()));
    assertEquals(List.of(Map.of("a", "1"), Map.of("b", "2"), Map.of("a", List.of("3", "4"))),
        map.get(BuilderOptions.GROUP_KEY).toObject());
  }

  @Test
  void testTextAroundElementIsGrouped() {
    final ElementNode p = document.appendChild(document.createElement("p"));
    p.appendChild(document.createTextNode("a"));
    p.appendChild(document.createElement("b")).appendChild(document.createTextNode("x"));
    p.appendChild(document.createTextNode("c"));

    assertEquals(Map.of("p", Map.of("#", List.of(Map.of("#text", "a"), Map.of("b", "x"), Map.of("#text", "c")))),
        writer.serialize(document).toObject());
  }

  @Test
  void testPrefixedNames() {
    final ElementNode root = document.appendChild(document.createElementNS("urn:p", "p:root"));
    root.setAttributeNS("urn:q", "q:att", "v");

    assertEquals(Map.of("p:root", Map.of("@q:att", "v", "@xmlns:p", "urn:p", "@xmlns:q", "urn:q")),
        writer.serialize(document).toObject());
  }

  @Test
  void testDoctypeIsSkipped() {
    document.appendChild(document.createDocumentType("root", "", "root.dtd"));
    document.appendChild(document.createElement("root"));

    assertEquals(Map.of("root", Map.of()), writer.serialize(document).toObject());
  }

  @Test
  void testCustomMarkers() {
    final BuilderOptions options = BuilderOptions.newBuilder()
                                                 .convertAttKey("$")
                                                 .convertTextKey("_text")
                                                 .convertCommentKey("_comment")
                                                 .convertCDataKey("_cdata")
                                                 .convertPIKey("_pi_")
                                                 .build();
    final ElementNode p = XmlDocumentCreator.createMixed().getDocumentElement();
    p.setAttribute("id", "2");

    final XmlSerializedMap map = (XmlSerializedMap) new MapWriter(options).serialize(p);

    assertEquals(List.of("$id", "_text", "_comment", "_cdata", "_pi_pi", "b"), List.copyOf(map.getEntries().keySet()));
  }

  @Test
  void testObjectFormat() {
    final WriterOptions options = WriterOptions.newBuilder().format(Format.OBJECT).build();

    final XmlSerializedValue value = writer.serialize(XmlDocumentCreator.create(), options);

    assertFalse(((XmlSerializedMap) value).isOrdered());
    assertEquals(Map.of("root", Map.of("@id", "1", "a", List.of("x", "y"))), value.toObject());
  }

  @Test
  void testJsonFormat() {
    final WriterOptions options = WriterOptions.newBuilder().format(Format.JSON).build();

    final XmlSerializedValue value = writer.serialize(XmlDocumentCreator.create(), options);

    assertInstanceOf(XmlSerializedString.class, value);
    assertEquals(XmlDocumentCreator.JSON, value.toString());
  }

  @Test
  void testNullNodes() {
    final ElementNode root = document.appendChild(document.createElement("root"));
    root.setAttribute("a", null);
    root.appendChild(document.createComment(null));

    assertEquals(Map.of(), writer.serialize(root).toObject());

    final BuilderOptions keep = BuilderOptions.newBuilder().keepNullNodes(true).keepNullAttributes(true).build();
    assertEquals(Map.of("@a", "", "#comment", ""), new MapWriter(keep).serialize(root).toObject());
  }
}
