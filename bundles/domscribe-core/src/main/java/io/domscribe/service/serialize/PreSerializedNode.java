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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import io.domscribe.node.Node;
import io.domscribe.node.NodeKind;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Immutable, ordered view of a node and its subtree which all writers consume.
 *
 * @param node the source node, compared by identity
 * @param level the nesting level used for indentation
 * @param name the qualified name of elements and attributes, the target of processing
 *        instructions, the name of doctypes, {@code null} otherwise
 * @param value the content of character data and attributes, {@code null} otherwise
 * @param attributes attributes in output order, without namespace declarations
 * @param namespaces namespace declarations in output order
 * @param children the children in tree order
 */
public record PreSerializedNode(Node node, int level, @Nullable String name, @Nullable String value,
    ImmutableList<PreSerializedAttribute> attributes, ImmutableList<PreSerializedNamespace> namespaces,
    ImmutableList<PreSerializedNode> children) {

  public PreSerializedNode {
    requireNonNull(node);
    requireNonNull(attributes);
    requireNonNull(namespaces);
    requireNonNull(children);
  }

  public NodeKind kind() {
    return node.getKind();
  }
}
