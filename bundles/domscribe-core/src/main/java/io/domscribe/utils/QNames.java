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

import io.domscribe.exception.InvalidCharacterException;
import io.domscribe.exception.NamespaceException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Validation of qualified names and extraction of their namespace parts.
 *
 * @author Johannes Lichtenberger
 */
public final class QNames {

  /** The namespace URI bound to the {@code xml} prefix. */
  public static final String XML_NAMESPACE = "http://www.w3.org/XML/1998/namespace";

  /** The namespace URI of namespace declarations. */
  public static final String XMLNS_NAMESPACE = "http://www.w3.org/2000/xmlns/";

  /** The {@code xml} prefix. */
  public static final String XML_PREFIX = "xml";

  /** The {@code xmlns} prefix and attribute name. */
  public static final String XMLNS = "xmlns";

  private QNames() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Validates the given qualified name against the {@code Name} and {@code QName} productions.
   *
   * @param qualifiedName qualified name
   * @throws InvalidCharacterException if the name doesn't match both productions
   * @throws NullPointerException if {@code qualifiedName} is {@code null}
   */
  public static void validateQName(final String qualifiedName) {
    requireNonNull(qualifiedName);
    if (!XMLToken.isName(qualifiedName)) {
      throw new InvalidCharacterException("'%s' is not a valid XML name.", qualifiedName);
    }
    if (!XMLToken.isQName(qualifiedName)) {
      throw new InvalidCharacterException("'%s' is not a valid qualified name.", qualifiedName);
    }
  }

  /**
   * Validates the qualified name and splits it into prefix and local name, checking the prefix
   * against the namespace.
   *
   * @param namespace namespace URI, {@code null} or the empty string for no namespace
   * @param qualifiedName qualified name
   * @return the namespace, prefix and local name
   * @throws InvalidCharacterException if the qualified name is not valid
   * @throws NamespaceException if prefix and namespace don't fit together
   */
  public static ExtractedName extractNames(final @Nullable String namespace, final String qualifiedName) {
    final String ns = namespace == null || namespace.isEmpty() ? null : namespace;
    validateQName(qualifiedName);

    final int colon = qualifiedName.indexOf(':');
    final String prefix = colon == -1 ? null : qualifiedName.substring(0, colon);
    final String localName = colon == -1 ? qualifiedName : qualifiedName.substring(colon + 1);

    if (prefix != null && ns == null) {
      throw new NamespaceException("Prefix '%s' requires a namespace.", prefix);
    }
    if (XML_PREFIX.equals(prefix) && !XML_NAMESPACE.equals(ns)) {
      throw new NamespaceException("Prefix 'xml' must be bound to '%s'.", XML_NAMESPACE);
    }
    if (!XMLNS_NAMESPACE.equals(ns) && (XMLNS.equals(prefix) || XMLNS.equals(qualifiedName))) {
      throw new NamespaceException("'%s' requires the namespace '%s'.", qualifiedName, XMLNS_NAMESPACE);
    }
    if (XMLNS_NAMESPACE.equals(ns) && !XMLNS.equals(prefix) && !XMLNS.equals(qualifiedName)) {
      throw new NamespaceException("Namespace '%s' is reserved for xmlns declarations, not '%s'.",
          XMLNS_NAMESPACE, qualifiedName);
    }

    return new ExtractedName(ns, prefix, localName);
  }

  /**
   * The qualified name of a prefix and local name.
   *
   * @param prefix the prefix or {@code null}
   * @param localName the local name
   * @return {@code prefix:localName} or {@code localName}
   */
  public static String qualify(final @Nullable String prefix, final String localName) {
    return prefix == null ? localName : prefix + ':' + localName;
  }
}
