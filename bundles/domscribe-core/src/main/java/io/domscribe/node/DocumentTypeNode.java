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

/**
 * Document type declaration. Only the name and the external identifiers are kept, there's no DTD
 * processing.
 */
public final class DocumentTypeNode extends Node {

  private final String name;

  private final String publicId;

  private final String systemId;

  DocumentTypeNode(final long nodeKey, final NodeStore store, final String name, final String publicId,
      final String systemId) {
    super(nodeKey, store);
    this.name = requireNonNull(name);
    this.publicId = requireNonNull(publicId);
    this.systemId = requireNonNull(systemId);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.DOCUMENT_TYPE;
  }

  @Override
  public String getNodeName() {
    return name;
  }

  public String getName() {
    return name;
  }

  /**
   * Get the public identifier.
   *
   * @return the public identifier, empty if there's none
   */
  public String getPublicId() {
    return publicId;
  }

  /**
   * Get the system identifier.
   *
   * @return the system identifier, empty if there's none
   */
  public String getSystemId() {
    return systemId;
  }
}
