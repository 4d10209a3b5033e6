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
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serializes a subtree into nested maps, arrays and strings. Attributes, namespace declarations
 * and the children of an element become map entries keyed by the marker strings of the builder
 * options. Repeated adjacent keys are collected into an array; children whose keys interleave
 * are kept in document order under {@link BuilderOptions#GROUP_KEY}.
 *
 * @author Johannes Lichtenberger
 */
public final class MapWriter extends AbstractWriter<XmlSerializedValue> {

  /** Logger. */
  private static final Logger LOGGER = LoggerFactory.getLogger(MapWriter.class);

  public MapWriter(final BuilderOptions builderOptions) {
    super(builderOptions);
  }

  @Override
  public XmlSerializedValue serialize(final Node node, final WriterOptions options) {
    requireNonNull(node);
    if (options.getFormat() == Format.JSON) {
      return new XmlSerializedString(new JsonWriter(builderOptions).serialize(node, options));
    }
    final XmlSerializedValue value = serialize(preSerialize(node), options.getFormat() == Format.MAP);
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("Serialized {} into a {} of {} scalars.", node.getNodeName(), value.getKind(),
          value.descendantCount());
    }
    return value;
  }

  private XmlSerializedValue serialize(final PreSerializedNode node, final boolean ordered) {
    switch (node.kind()) {
      case ELEMENT -> {
        if (node.attributes().isEmpty() && node.namespaces().isEmpty() && !node.children().isEmpty()
            && node.children().stream().allMatch(child -> child.kind() == NodeKind.TEXT)) {
          final StringBuilder text = new StringBuilder();
          node.children().forEach(child -> text.append(child.value()));
          return new XmlSerializedString(text.toString());
        }
        final Map<String, List<XmlSerializedValue>> entries = new LinkedHashMap<>();
        for (final PreSerializedAttribute attribute : node.attributes()) {
          add(entries, builderOptions.getConvertAttKey() + attribute.name(), new XmlSerializedString(attribute.value()));
        }
        for (final PreSerializedNamespace namespace : node.namespaces()) {
          add(entries, builderOptions.getConvertAttKey() + namespace.name(), new XmlSerializedString(namespace.value()));
        }
        addChildren(entries, node, ordered);
        return toMap(entries, ordered);
      }
      case DOCUMENT, DOCUMENT_FRAGMENT -> {
        final Map<String, List<XmlSerializedValue>> entries = new LinkedHashMap<>();
        addChildren(entries, node, ordered);
        return toMap(entries, ordered);
      }
      case TEXT, CDATA_SECTION, COMMENT, PROCESSING_INSTRUCTION, ATTRIBUTE -> {
        return new XmlSerializedString(requireNonNull(node.value()));
      }
      default -> {
        return new XmlSerializedString(String.valueOf(node.name()));
      }
    }
  }

  /**
   * Adds the children of a node. Adjacent children with the same key share one entry. If a key
   * comes back after another one, the children are added as a {@link BuilderOptions#GROUP_KEY}
   * array of maps instead, one map per run of equal keys, so that their order survives.
   */
  private void addChildren(final Map<String, List<XmlSerializedValue>> entries, final PreSerializedNode node,
      final boolean ordered) {
    final List<Map.Entry<String, List<XmlSerializedValue>>> runs = new ArrayList<>();
    for (final PreSerializedNode child : node.children()) {
      final String key = childKey(child);
      if (key == null) {
        continue;
      }
      final XmlSerializedValue value = child.kind() == NodeKind.ELEMENT ? serialize(child, ordered) : text(child);
      if (!runs.isEmpty() && runs.get(runs.size() - 1).getKey().equals(key)) {
        runs.get(runs.size() - 1).getValue().add(value);
      } else {
        final List<XmlSerializedValue> values = new ArrayList<>(1);
        values.add(value);
        runs.add(Map.entry(key, values));
      }
    }

    final Set<String> keys = new HashSet<>();
    boolean interleaved = false;
    for (final Map.Entry<String, List<XmlSerializedValue>> run : runs) {
      interleaved |= !keys.add(run.getKey());
    }

    if (interleaved) {
      final ImmutableList.Builder<XmlSerializedValue> group = ImmutableList.builder();
      for (final Map.Entry<String, List<XmlSerializedValue>> run : runs) {
        final Map<String, XmlSerializedValue> single = new LinkedHashMap<>(2);
        single.put(run.getKey(), collapse(run.getValue()));
        group.add(ordered ? XmlSerializedMap.ordered(single) : XmlSerializedMap.unordered(single));
      }
      add(entries, BuilderOptions.GROUP_KEY, new XmlSerializedArray(group.build()));
    } else {
      runs.forEach(run -> entries.computeIfAbsent(run.getKey(), k -> new ArrayList<>(1)).addAll(run.getValue()));
    }
  }

  /**
   * The map key of a child.
   *
   * @return the key or {@code null} if the child has no map form
   */
  private @Nullable String childKey(final PreSerializedNode child) {
    return switch (child.kind()) {
      case ELEMENT -> requireNonNull(child.name());
      case TEXT -> builderOptions.getConvertTextKey();
      case CDATA_SECTION -> builderOptions.getConvertCDataKey();
      case COMMENT -> builderOptions.getConvertCommentKey();
      case PROCESSING_INSTRUCTION -> builderOptions.getConvertPIKey() + child.name();
      default -> null;
    };
  }

  private static XmlSerializedString text(final PreSerializedNode node) {
    return new XmlSerializedString(requireNonNull(node.value()));
  }

  private static void add(final Map<String, List<XmlSerializedValue>> entries, final String key,
      final XmlSerializedValue value) {
    entries.computeIfAbsent(key, k -> new ArrayList<>(1)).add(value);
  }

  private static XmlSerializedValue collapse(final List<XmlSerializedValue> values) {
    return values.size() == 1 ? values.get(0) : new XmlSerializedArray(ImmutableList.copyOf(values));
  }

  private static XmlSerializedMap toMap(final Map<String, List<XmlSerializedValue>> entries, final boolean ordered) {
    final Map<String, XmlSerializedValue> map = new LinkedHashMap<>();
    entries.forEach((key, values) -> map.put(key, collapse(values)));
    return ordered ? XmlSerializedMap.ordered(map) : XmlSerializedMap.unordered(map);
  }
}
