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

import com.google.gson.JsonElement;
import com.google.gson.JsonParser;
import io.domscribe.XmlDocumentCreator;
import io.domscribe.node.DocumentNode;
import io.domscribe.node.ElementNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class JsonWriterTest {

  private static final WriterOptions PRETTY = WriterOptions.newBuilder().prettyPrint().build();

  private JsonWriter writer;

  @BeforeEach
  void setUp() {
    writer = new JsonWriter(BuilderOptions.DEFAULTS);
  }

  @Test
  void testCompact() {
    assertEquals(XmlDocumentCreator.JSON, writer.serialize(XmlDocumentCreator.create()));
  }

  @Test
  void testPretty() {
    assertEquals(XmlDocumentCreator.PRETTY_JSON, writer.serialize(XmlDocumentCreator.create(), PRETTY));
  }

  @Test
  void testIgnoresFormatOption() {
    final WriterOptions options = WriterOptions.newBuilder().format(Format.JSON).build();

    assertEquals(XmlDocumentCreator.JSON, writer.serialize(XmlDocumentCreator.create(), options));
  }

  @Test
  void testOutputIsValidJson() {
    final String json = writer.serialize(XmlDocumentCreator.createMixed(), PRETTY);

    final JsonElement parsed = JsonParser.parseString(json);

    assertEquals("data", parsed.getAsJsonObject().getAsJsonObject("p").get("?pi").getAsString());
    assertEquals(JsonParser.parseString(writer.serialize(XmlDocumentCreator.createMixed())), parsed);
  }

  @Test
  void testIdempotent() {
    final DocumentNode document = XmlDocumentCreator.create();

    assertEquals(writer.serialize(document, PRETTY), writer.serialize(document, PRETTY));
  }

  @Nested
  @DisplayName("small maps")
  class SmallMaps {

    private DocumentNode document;

    @BeforeEach
    void setUp() {
      document = DocumentNode.create();
    }

    @Test
    void testSingleEntryIsInline() {
      document.appendChild(document.createElement("a")).appendChild(document.createTextNode("1"));

      assertEquals("{ \"a\": \"1\" }", writer.serialize(document, PRETTY));
      assertEquals("{\"a\":\"1\"}", writer.serialize(document));
    }

    @Test
    void testEmptyMap() {
      final ElementNode empty = document.appendChild(document.createElement("e"));

      assertEquals("{ }", writer.serialize(empty, PRETTY));
      assertEquals("{}", writer.serialize(empty));
      assertEquals("{ \"e\": { } }", writer.serialize(document, PRETTY));
    }

    @Test
    void testOffset() {
      document.appendChild(document.createElement("a")).appendChild(document.createTextNode("1"));
      final WriterOptions options = PRETTY.toBuilder().offset(1).build();

      assertEquals("  { \"a\": \"1\" }", writer.serialize(document, options));
    }

    @Test
    void testIndentAndNewline() {
      final ElementNode root = document.appendChild(document.createElement("r"));
      root.setAttribute("a", "1");
      root.setAttribute("b", "2");
      final WriterOptions options = PRETTY.toBuilder().indent("\t").newline("\r\n").build();

      assertEquals("{\r\n\t\"@a\": \"1\",\r\n\t\"@b\": \"2\"\r\n}", writer.serialize(root, options));
    }
  }

  @Test
  @DisplayName("strings are fully escaped, not only quoted")
  void testEscaping() {
    final DocumentNode document = DocumentNode.create();
    final String text = "q\"b\\s/n\nt\tr\rf\fb\bc\u0001e\u001fé";
    document.appendChild(document.createElement("a")).appendChild(document.createTextNode(text));

    final String json = writer.serialize(document);

    assertEquals("{\"a\":\"q\\\"b\\\\s/n\\nt\\tr\\rf\\fb\\bc\\u0001e\\u001Fé\"}", json);
    assertEquals(text, JsonParser.parseString(json).getAsJsonObject().get("a").getAsString());
  }

  @Test
  void testEscapeWithoutSpecialCharacters() {
    assertEquals("plain", StringValue.escape("plain"));
    assertEquals("\\u0000", StringValue.escape("\u0000"));
  }
}
