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

/**
 * Enumeration for the different node kinds. The set is closed and fixed by the XML Information
 * Set, so algorithms over the node graph switch on it.
 *
 * @author Sebastian Graf, University of Konstanz
 * @author Johannes Lichtenberger, University of Konstanz
 */
public enum NodeKind {

  /** Node kind is a document. */
  DOCUMENT("#document", true),

  /** Node kind is a document fragment. */
  DOCUMENT_FRAGMENT("#document-fragment", true),

  /** Node kind is element. */
  ELEMENT(null, true),

  /** Node kind is attribute. */
  ATTRIBUTE(null, false),

  /** Node kind is text. */
  TEXT("#text", false),

  /** Node kind is a CDATA section. */
  CDATA_SECTION("#cdata-section", false),

  /** Node kind is comment. */
  COMMENT("#comment", false),

  /** Node kind is processing instruction. */
  PROCESSING_INSTRUCTION(null, false),

  /** Node kind is a document type declaration. */
  DOCUMENT_TYPE(null, false);

  /** Fixed node name, {@code null} if the name depends on the node. */
  private final String fixedName;

  /** Determines if nodes of this kind can have children. */
  private final boolean structural;

  NodeKind(final String fixedName, final boolean structural) {
    this.fixedName = fixedName;
    this.structural = structural;
  }

  /**
   * Get the node name shared by all nodes of this kind.
   *
   * @return the fixed name or {@code null} if it depends on the node
   */
  public String getFixedName() {
    return fixedName;
  }

  /**
   * Determines if nodes of this kind can have children.
   *
   * @return {@code true} for documents, fragments and elements
   */
  public boolean isStructural() {
    return structural;
  }

  /**
   * Determines if nodes of this kind carry character data.
   *
   * @return {@code true} for text, CDATA, comment and processing instruction nodes
   */
  public boolean isCharacterData() {
    return this == TEXT || this == CDATA_SECTION || this == COMMENT || this == PROCESSING_INSTRUCTION;
  }
}
