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

package io.domscribe.builder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableMap;
import io.domscribe.XmlDocumentCreator;
import io.domscribe.exception.NamespaceException;
import io.domscribe.node.NodeKind;
import io.domscribe.service.serialize.BuilderOptions;
import io.domscribe.service.serialize.Format;
import io.domscribe.service.serialize.WriterOptions;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class XmlBuilderTest {

  private static final WriterOptions HEADLESS = WriterOptions.newBuilder().headless(true).build();

  private static XmlBuilder createDocument() {
    return XmlBuilders.create("root").att("id", "1").ele("a").txt("x").up().ele("a").txt("y").up();
  }

  @Test
  void testChain() {
    final XmlBuilder root = createDocument();

    assertEquals(XmlDocumentCreator.XML, root.end());
    assertEquals(XmlDocumentCreator.PRETTY_XML, root.end(WriterOptions.newBuilder().prettyPrint().build()));
    assertEquals("<root id=\"1\"><a>x</a><a>y</a></root>", root.toString());
  }

  @Test
  void testToObject() {
    final XmlBuilder root = createDocument();

    assertEquals(Map.of("@id", "1", "a", List.of("x", "y")), root.toObject().toObject());
    assertEquals(XmlDocumentCreator.JSON,
        root.doc().toObject(WriterOptions.newBuilder().format(Format.JSON).build()).toString());
  }

  @Test
  void testRoundTrip() {
    final Object object = createDocument().doc().toObject().toObject();

    @SuppressWarnings("unchecked")
    final XmlBuilder root = XmlBuilders.create().ele((Map<String, ?>) object);

    assertEquals(XmlDocumentCreator.XML, root.end());
  }

  @Test
  void testRoundTripOfInterleavedElements() {
    final XmlBuilder root = XmlBuilders.create("root").ele("a").txt("1").up().ele("b").txt("2").up().ele("a").txt("3").up();
    final Object object = root.doc().toObject().toObject();

    @SuppressWarnings("unchecked")
    final XmlBuilder copy = XmlBuilders.create((Map<String, ?>) object);

    assertEquals("<root><a>1</a><b>2</b><a>3</a></root>", copy.end(HEADLESS));
  }

  @Test
  void testRoundTripOfMixedContent() {
    final XmlBuilder p = XmlBuilders.create("p").txt("a").ele("b").txt("x").up().txt("c");
    final Object object = p.doc().toObject().toObject();

    @SuppressWarnings("unchecked")
    final XmlBuilder copy = XmlBuilders.create().ele((Map<String, ?>) object);

    assertEquals("<p>a<b>x</b>c</p>", copy.end(HEADLESS));
  }

  @Test
  void testCreateFromMap() {
    final BuilderOptions options = BuilderOptions.newBuilder().version("1.1").build();

    assertEquals("<root id=\"1\"><a>x</a><a>y</a></root>",
        XmlBuilders.create(ImmutableMap.of("root", ImmutableMap.of("@id", "1", "a", List.of("x", "y")))).end(HEADLESS));
    assertEquals("<?xml version=\"1.1\"?><r>t</r>", XmlBuilders.create(options, ImmutableMap.of("r", "t")).end());
  }

  @Test
  void testElementWithAttributesAndText() {
    assertEquals("<a id=\"1\">t</a>", XmlBuilders.create().ele("a", Map.of("id", "1"), "t").toString());
  }

  @Test
  void testElementWithAttributes() {
    final XmlBuilder root = XmlBuilders.create().ele("root", ImmutableMap.of("id", "1", "xmlns", "urn:a"));

    assertEquals("urn:a", root.node().lookupNamespaceURI(null));
    assertEquals("<root xmlns=\"urn:a\" id=\"1\"/>", root.end(HEADLESS));
  }

  @Test
  void testRemoveAttribute() {
    assertEquals("<r b=\"2\"/>", XmlBuilders.create("r").att("a", "1").att("b", "2").removeAtt("a").toString());
    assertEquals("<r/>",
        XmlBuilders.create("r").att("urn:x", "x:a", "1").removeAtt("urn:x", "a").toString());
  }

  @Test
  void testRemoveAttributes() {
    final XmlBuilder root = XmlBuilders.create("r").att("a", "1").att("b", "2").att("c", "3");

    assertEquals("<r c=\"3\"/>", root.removeAtt(new String[] {"a", "b", "missing"}).toString());

    final XmlBuilder prefixed =
        XmlBuilders.create("r").att("urn:x", "x:a", "1").att("urn:x", "x:b", "2").att("a", "3");

    assertEquals("<r a=\"3\"/>", prefixed.removeAtt("urn:x", new String[] {"a", "b"}).toString());
  }

  @Nested
  @DisplayName("namespaces")
  class Namespaces {

    @Test
    void testInheritedDefaultNamespace() {
      final XmlBuilder root = XmlBuilders.create().ele("urn:a", "root").ele("child").up();

      assertEquals("<root xmlns=\"urn:a\"><child/></root>", root.end(HEADLESS));
    }

    @Test
    void testNoInheritance() {
      final BuilderOptions options = BuilderOptions.newBuilder().inheritNS(false).build();

      final XmlBuilder root = XmlBuilders.create(options).ele("urn:a", "root").ele("child").up();

      assertEquals("<root xmlns=\"urn:a\"><child xmlns=\"\"/></root>", root.end(HEADLESS));
    }

    @Test
    void testChildSerializedAlone() {
      assertEquals("<child xmlns=\"urn:a\"/>", XmlBuilders.create().ele("urn:a", "root").ele("urn:a", "child").toString());
      assertEquals("<child xmlns=\"urn:a\"/>", XmlBuilders.create().ele("urn:a", "root").ele("child").toString());
    }

    @Test
    void testPrefixResolution() {
      final XmlBuilder root = XmlBuilders.create().ele("urn:p", "p:root").att("p:x", "1").ele("p:child").up();

      assertEquals("urn:p", root.first().node().lookupNamespaceURI("p"));
      assertEquals("<p:root xmlns:p=\"urn:p\" p:x=\"1\"><p:child/></p:root>", root.end(HEADLESS));
    }

    @Test
    void testUnboundPrefix() {
      final XmlBuilder root = XmlBuilders.create("root");

      assertThrows(NamespaceException.class, () -> root.ele("q:child"));
    }

    @Test
    void testDeclarationInMap() {
      final XmlBuilder root =
          XmlBuilders.create().ele(ImmutableMap.of("p:root", ImmutableMap.of("@xmlns:p", "urn:p", "p:child", "v")));

      assertEquals("urn:p", root.node().lookupNamespaceURI("p"));
      assertEquals("<p:root xmlns:p=\"urn:p\"><p:child>v</p:child></p:root>", root.end(HEADLESS));
    }
  }

  @Nested
  @DisplayName("expanding maps")
  class Expansion {

    @Test
    void testNested() {
      final XmlBuilder root =
          XmlBuilders.create().ele(ImmutableMap.of("root", ImmutableMap.of("@id", "1", "a", List.of("x", "y"))));

      assertEquals(NodeKind.ELEMENT, root.node().getKind());
      assertEquals(XmlDocumentCreator.XML, root.end());
    }

    @Test
    void testMarkers() {
      final XmlBuilder root = XmlBuilders.create("r")
                                         .ele(ImmutableMap.of("#text", "t", "#comment", "c", "#cdata", "d", "?pi",
                                             "data", "b", "e"))
                                         .up();

      assertEquals("<r>t<!--c--><![CDATA[d]]><?pi data?><b>e</b></r>", root.toString());
    }

    @Test
    void testUntargetedInstruction() {
      final XmlBuilder root = XmlBuilders.create("r").ele(ImmutableMap.of("?", List.of("target data", "bare")));

      assertEquals("<r><?target data?><?bare?></r>", root.toString());
    }

    @Test
    void testAttributeMap() {
      final XmlBuilder x = XmlBuilders.create().ele(ImmutableMap.of("x", ImmutableMap.of("@", ImmutableMap.of("a", 1, "b", true))));

      assertEquals("<x a=\"1\" b=\"true\"/>", x.toString());
    }

    @Test
    void testReturnsLastElement() {
      final XmlBuilder last = XmlBuilders.create("r").ele(ImmutableMap.of("a", "1", "b", "2", "#text", "t"));

      assertEquals("b", last.node().getNodeName());
      assertEquals("<r><a>1</a><b>2</b>t</r>", last.up().toString());
    }

    @Test
    void testIgnoreDecorators() {
      final BuilderOptions options = BuilderOptions.newBuilder().convertTextKey("_text").ignoreDecorators(true).build();

      final XmlBuilder root = XmlBuilders.create(options, "r").ele(ImmutableMap.of("_text", "t")).up();

      assertEquals("<r><_text>t</_text></r>", root.toString());
    }

    @Test
    void testCustomMarkers() {
      final BuilderOptions options = BuilderOptions.newBuilder().convertAttKey("$").convertTextKey("_text").build();

      final XmlBuilder root = XmlBuilders.create(options, "r").ele(ImmutableMap.of("$id", "1", "_text", "t"));

      assertEquals("<r id=\"1\">t</r>", root.toString());
    }

    @Test
    void testGroupItemsMustBeMaps() {
      final XmlBuilder root = XmlBuilders.create("root");

      assertThrows(IllegalArgumentException.class, () -> root.ele(ImmutableMap.of(BuilderOptions.GROUP_KEY, List.of("a"))));
    }

    @Test
    void testNonStringKeys() {
      final XmlBuilder root = XmlBuilders.create("r");

      assertThrows(IllegalArgumentException.class, () -> root.ele(ImmutableMap.of("a", ImmutableMap.of(1, "x"))));
    }
  }

  @Nested
  @DisplayName("null values")
  class NullValues {

    @Test
    void testDropped() {
      final XmlBuilder root = XmlBuilders.create("r").att("a", null).txt(null).com(null).dat(null).ins("pi", null);
      root.ele(Map.of("b", Arrays.asList((Object) null)));

      assertEquals("<r/>", root.toString());
    }

    @Test
    void testKept() {
      final BuilderOptions options = BuilderOptions.newBuilder().keepNullNodes(true).keepNullAttributes(true).build();

      final XmlBuilder root = XmlBuilders.create(options, "r").att("a", null).com(null);
      root.ele(Map.of("b", Arrays.asList((Object) null)));

      assertEquals("<r a=\"\"><!----><b/></r>", root.toString());
    }
  }

  @Nested
  @DisplayName("navigation")
  class Navigation {

    @Test
    void testSiblingsAndChildren() {
      final XmlBuilder root = XmlBuilders.create("r").ele("a").up().ele("b").up();

      assertEquals("a", root.first().node().getNodeName());
      assertEquals("b", root.last().node().getNodeName());
      assertEquals("b", root.first().next().node().getNodeName());
      assertEquals("a", root.last().prev().node().getNodeName());
      assertSame(root.node(), root.last().root().node());
      assertEquals(NodeKind.DOCUMENT, root.last().doc().node().getKind());
    }

    @Test
    void testMissingTargets() {
      final XmlBuilder root = XmlBuilders.create("r");

      assertThrows(IllegalStateException.class, root::prev);
      assertThrows(IllegalStateException.class, root::next);
      assertThrows(IllegalStateException.class, root::first);
      assertThrows(IllegalStateException.class, root::last);
      assertThrows(IllegalStateException.class, () -> root.up().up());
      assertThrows(IllegalStateException.class, () -> XmlBuilders.create().root());
    }

    @Test
    void testRemove() {
      final XmlBuilder root = XmlBuilders.create("r").ele("a").remove();

      assertSame(NodeKind.ELEMENT, root.node().getKind());
      assertEquals("<?xml version=\"1.0\"?><r/>", root.end());
      assertThrows(IllegalStateException.class, () -> root.doc().remove());
    }
  }

  @Nested
  @DisplayName("doctypes")
  class Doctypes {

    @Test
    void testPublic() {
      final XmlBuilder html = XmlBuilders.create("html").dtd("-//W3C//DTD XHTML 1.0 Strict//EN", "strict.dtd");

      assertEquals("<?xml version=\"1.0\"?><!DOCTYPE html PUBLIC \"-//W3C//DTD XHTML 1.0 Strict//EN\" \"strict.dtd\"><html/>",
          html.end());
    }

    @Test
    void testReplaced() {
      final XmlBuilder root = XmlBuilders.create("r").dtd("", "a.dtd").dtd("", "b.dtd");

      assertEquals("<?xml version=\"1.0\"?><!DOCTYPE r SYSTEM \"b.dtd\"><r/>", root.end());
    }

    @Test
    void testFromOptions() {
      final BuilderOptions options = BuilderOptions.newBuilder().pubID("-//A//DTD A//EN").sysID("a.dtd").build();

      final XmlBuilder root = XmlBuilders.create(options, "r").dtd();

      assertEquals("<?xml version=\"1.0\"?><!DOCTYPE r PUBLIC \"-//A//DTD A//EN\" \"a.dtd\"><r/>", root.end());
    }

    @Test
    void testWithoutDocumentElement() {
      assertThrows(IllegalStateException.class, () -> XmlBuilders.create().dtd("", "a.dtd"));
    }
  }

  @Nested
  @DisplayName("imports")
  class Imports {

    @Test
    void testDocument() {
      final XmlBuilder other = XmlBuilders.create("child").att("x", "1");

      final XmlBuilder root = XmlBuilders.create("root").importNode(other.doc()).importNode(other);

      assertEquals("<root><child x=\"1\"/><child x=\"1\"/></root>", root.toString());
      assertEquals("<child x=\"1\"/>", other.toString());
    }

    @Test
    void testFragment() {
      final XmlBuilder fragment = XmlBuilders.fragment().ele("a").up().ele("b").up();

      assertEquals("<a/><b/>", fragment.end());
      assertEquals("<root><a/><b/></root>", XmlBuilders.create("root").importNode(fragment).toString());
    }

    @Test
    void testEmptyDocument() {
      final XmlBuilder root = XmlBuilders.create("root");

      assertThrows(IllegalStateException.class, () -> root.importNode(XmlBuilders.create()));
    }
  }
}
