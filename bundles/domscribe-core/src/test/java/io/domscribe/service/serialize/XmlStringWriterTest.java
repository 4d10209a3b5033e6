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
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.domscribe.XmlDocumentCreator;
import io.domscribe.node.CDataSectionNode;
import io.domscribe.node.DocumentNode;
import io.domscribe.node.ElementNode;
import io.domscribe.utils.QNames;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class XmlStringWriterTest {

  private static final WriterOptions PRETTY = WriterOptions.newBuilder().prettyPrint().build();

  private XmlStringWriter writer;

  private DocumentNode document;

  @BeforeEach
  void setUp() {
    writer = new XmlStringWriter(BuilderOptions.DEFAULTS);
    document = DocumentNode.create();
  }

  @Test
  void testCompact() {
    assertEquals(XmlDocumentCreator.XML, writer.serialize(XmlDocumentCreator.create()));
  }

  @Test
  void testPretty() {
    assertEquals(XmlDocumentCreator.PRETTY_XML, writer.serialize(XmlDocumentCreator.create(), PRETTY));
  }

  @Test
  void testHeadless() {
    final WriterOptions options = WriterOptions.newBuilder().headless(true).build();

    assertEquals("<root id=\"1\"><a>x</a><a>y</a></root>", writer.serialize(XmlDocumentCreator.create(), options));
  }

  @Test
  void testMixedContent() {
    final WriterOptions options = WriterOptions.newBuilder().headless(true).build();

    assertEquals("<p>t<!--c--><![CDATA[d]]><?pi data?><b>e</b></p>",
        writer.serialize(XmlDocumentCreator.createMixed(), options));
  }

  @Nested
  @DisplayName("prolog")
  class Prolog {

    @Test
    void testDeclaration() {
      final BuilderOptions options = BuilderOptions.newBuilder().version("1.1").encoding("UTF-8").standalone(true).build();
      document.appendChild(document.createElement("r"));

      assertEquals("<?xml version=\"1.1\" encoding=\"UTF-8\" standalone=\"yes\"?><r/>",
          new XmlStringWriter(options).serialize(document));
    }

    @Test
    void testPublicDoctype() {
      document.appendChild(document.createDocumentType("html", "-//W3C//DTD XHTML 1.0 Strict//EN", "strict.dtd"));
      document.appendChild(document.createElement("html"));

      assertEquals("<?xml version=\"1.0\"?>\n<!DOCTYPE html PUBLIC \"-//W3C//DTD XHTML 1.0 Strict//EN\" \"strict.dtd\">\n"
          + "<html/>", writer.serialize(document, PRETTY));
    }

    @Test
    void testSystemDoctype() {
      document.appendChild(document.createDocumentType("r", "", "r.dtd"));
      document.appendChild(document.createElement("r"));

      assertEquals("<?xml version=\"1.0\"?><!DOCTYPE r SYSTEM \"r.dtd\"><r/>", writer.serialize(document));
      assertEquals("<r/>", writer.serialize(document, WriterOptions.newBuilder().headless(true).build()));
    }
  }

  @Nested
  @DisplayName("empty elements")
  class EmptyElements {

    private ElementNode empty;

    @BeforeEach
    void setUp() {
      empty = document.appendChild(document.createElement("e"));
    }

    @Test
    void testSelfClosing() {
      assertEquals("<e/>", writer.serialize(empty));
    }

    @Test
    void testSpaceBeforeSlash() {
      assertEquals("<e />", writer.serialize(empty, WriterOptions.newBuilder().spaceBeforeSlash(true).build()));
    }

    @Test
    void testAllowEmptyTags() {
      final WriterOptions options = WriterOptions.newBuilder().allowEmptyTags(true).spaceBeforeSlash(true).build();

      assertEquals("<e></e>", writer.serialize(empty, options));
    }

    @Test
    void testOffset() {
      assertEquals("  <e/>", writer.serialize(empty, PRETTY.toBuilder().offset(1).build()));
    }
  }

  @Test
  void testEscaping() {
    final ElementNode root = document.appendChild(document.createElement("r"));
    root.setAttribute("a", "<&\"\t\n>");
    root.appendChild(document.createTextNode("a<b&c>\"'"));

    assertEquals("<r a=\"&lt;&amp;&quot;&#x9;&#xA;&gt;\">a&lt;b&amp;c&gt;\"'</r>", writer.serialize(root));
  }

  @Test
  void testNoDoubleEncoding() {
    final ElementNode root = document.appendChild(document.createElement("r"));
    root.setAttribute("a", "&#x41;&b");
    root.appendChild(document.createTextNode("&amp; &lt &#65;"));

    assertEquals("<r a=\"&amp;#x41;&amp;b\">&amp;amp; &amp;lt &amp;#65;</r>", writer.serialize(root));
    assertEquals("<r a=\"&#x41;&amp;b\">&amp; &amp;lt &#65;</r>",
        writer.serialize(root, WriterOptions.newBuilder().noDoubleEncoding(true).build()));
  }

  @Test
  void testCDataTerminatorIsSplit() {
    final ElementNode root = document.appendChild(document.createElement("c"));
    final CDataSectionNode cdata = root.appendChild(document.createCDATASection("a"));
    cdata.setData("a]]>b");

    assertEquals("<c><![CDATA[a]]]]><![CDATA[>b]]></c>", writer.serialize(root));
  }

  @Test
  void testCommentAndEmptyProcessingInstruction() {
    final ElementNode root = document.appendChild(document.createElement("r"));
    root.appendChild(document.createComment("x"));
    root.appendChild(document.createProcessingInstruction("pi", ""));

    assertEquals("<r><!--x--><?pi?></r>", writer.serialize(root));
    assertEquals("<r>\n  <!--x-->\n  <?pi?>\n</r>", writer.serialize(root, PRETTY));
  }

  @Test
  void testNamespaces() {
    final ElementNode root = document.appendChild(document.createElementNS("urn:a", "root"));
    final ElementNode child = root.appendChild(document.createElementNS("urn:p", "p:c"));
    child.setAttributeNS("urn:p", "p:att", "v");
    root.appendChild(document.createElement("plain"));

    assertEquals("<root xmlns=\"urn:a\"><p:c xmlns:p=\"urn:p\" p:att=\"v\"/><plain xmlns=\"\"/></root>",
        writer.serialize(root));
  }

  @Test
  void testSubtreeKeepsInheritedNamespaces() {
    final ElementNode root = document.appendChild(document.createElementNS("urn:a", "root"));
    root.setAttributeNS(QNames.XMLNS_NAMESPACE, "xmlns:z", "urn:z");
    final ElementNode child = root.appendChild(document.createElementNS("urn:a", "child"));
    child.appendChild(document.createElementNS("urn:z", "z:leaf"));

    assertEquals("<child xmlns=\"urn:a\"><z:leaf xmlns:z=\"urn:z\"/></child>", writer.serialize(child));
  }

  @Test
  void testTextRoot() {
    assertEquals("a&lt;b", writer.serialize(document.createTextNode("a<b")));
  }

  @Nested
  @DisplayName("pretty printing")
  class PrettyPrinting {

    @Test
    void testWidth() {
      final ElementNode root = document.appendChild(document.createElement("root"));
      root.setAttribute("alpha", "1");
      root.setAttribute("beta", "2");
      root.setAttribute("gamma", "3");

      assertEquals("<root alpha=\"1\"\n beta=\"2\" gamma=\"3\"/>", writer.serialize(root, PRETTY.toBuilder().width(20).build()));
      assertEquals("<root alpha=\"1\" beta=\"2\" gamma=\"3\"/>", writer.serialize(root, PRETTY.toBuilder().width(0).build()));
      assertEquals("<root alpha=\"1\" beta=\"2\" gamma=\"3\"/>", writer.serialize(root, WriterOptions.newBuilder().width(20).build()));
    }

    @Test
    void testDontPrettyPrintTextNodes() {
      final ElementNode p = document.appendChild(document.createElement("p"));
      p.appendChild(document.createTextNode("a"));
      p.appendChild(document.createElement("b")).appendChild(document.createTextNode("c"));

      assertEquals("<p>\n  a\n  <b>c</b>\n</p>", writer.serialize(p, PRETTY));
      assertEquals("<p>a<b>c</b></p>", writer.serialize(p, PRETTY.toBuilder().dontPrettyPrintTextNodes(true).build()));
    }

    @Test
    void testIndentAndNewline() {
      final WriterOptions options = PRETTY.toBuilder().indent("\t").newline("\r\n").build();

      assertEquals("<?xml version=\"1.0\"?>\r\n<root id=\"1\">\r\n\t<a>x</a>\r\n\t<a>y</a>\r\n</root>",
          writer.serialize(XmlDocumentCreator.create(), options));
    }
  }

  @Nested
  @DisplayName("output streams")
  class OutputStreams {

    @Test
    void testUtf8() {
      document.appendChild(document.createElement("r")).appendChild(document.createTextNode("héllo €"));
      final ByteArrayOutputStream out = new ByteArrayOutputStream();

      writer.serialize(document, WriterOptions.DEFAULTS, out);

      assertEquals("<?xml version=\"1.0\"?><r>héllo €</r>", out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void testFailingStream() {
      document.appendChild(document.createElement("r"));
      final OutputStream failing = new OutputStream() {
        @Override
        public void write(final int b) throws IOException {
          throw new IOException("disk full");
        }
      };

      assertThrows(UncheckedIOException.class, () -> writer.serialize(document, WriterOptions.DEFAULTS, failing));
    }
  }
}
