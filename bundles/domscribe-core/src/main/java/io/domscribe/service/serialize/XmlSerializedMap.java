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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A map value. Its entries are either kept in insertion order or hash ordered.
 *
 * @author Johannes Lichtenberger
 */
public final class XmlSerializedMap implements XmlSerializedValue {

  private final Map<String, XmlSerializedValue> entries;

  private final boolean ordered;

  private XmlSerializedMap(final Map<String, XmlSerializedValue> entries, final boolean ordered) {
    this.entries = entries;
    this.ordered = ordered;
  }

  /**
   * Creates a map keeping the iteration order of the given entries.
   *
   * @param entries the entries
   * @return the ordered map
   */
  public static XmlSerializedMap ordered(final Map<String, XmlSerializedValue> entries) {
    return new XmlSerializedMap(ImmutableMap.copyOf(entries), true);
  }

  /**
   * Creates a hash ordered map of the given entries.
   *
   * @param entries the entries
   * @return the unordered map
   */
  public static XmlSerializedMap unordered(final Map<String, XmlSerializedValue> entries) {
    return new XmlSerializedMap(Collections.unmodifiableMap(new HashMap<>(entries)), false);
  }

  @Override
  public Kind getKind() {
    return Kind.MAP;
  }

  public boolean isOrdered() {
    return ordered;
  }

  /**
   * Get the entries.
   *
   * @return an unmodifiable view of the entries
   */
  public Map<String, XmlSerializedValue> getEntries() {
    return entries;
  }

  public @Nullable XmlSerializedValue get(final String key) {
    return entries.get(requireNonNull(key));
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  @Override
  public Object toObject() {
    final Map<String, Object> result = ordered ? new LinkedHashMap<>() : new HashMap<>();
    entries.forEach((key, value) -> result.put(key, value.toObject()));
    return Collections.unmodifiableMap(result);
  }

  @Override
  public int descendantCount() {
    int count = 0;
    for (final XmlSerializedValue value : entries.values()) {
      count += value.descendantCount();
    }
    return count;
  }

  @Override
  public boolean equals(final @Nullable Object other) {
    return other instanceof XmlSerializedMap map && entries.equals(map.entries);
  }

  @Override
  public int hashCode() {
    return entries.hashCode();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("ordered", ordered).add("entries", entries).toString();
  }
}
