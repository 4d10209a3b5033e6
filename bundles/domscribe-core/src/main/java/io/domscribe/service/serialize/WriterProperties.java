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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.reflect.Field;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * <p>
 * Writer properties. Each constant is a {@code {key, default}} pair; the defaults are those of
 * {@link WriterOptions}.
 * </p>
 *
 * @author Johannes Lichtenberger, University of Konstanz
 *
 */
public final class WriterProperties {

  // ============== Class constants. =================

  /** YES maps to true. */
  private static final boolean YES = true;

  /** NO maps to false. */
  private static final boolean NO = false;

  // ============ Serialization constants. ===============

  /** Pretty print: yes/no. */
  public static final Object[] S_PRETTY_PRINT = {"pretty-print", NO};

  /** Indentation string. */
  public static final Object[] S_INDENT = {"indent", "  "};

  /** Newline string. */
  public static final Object[] S_NEWLINE = {"newline", "\n"};

  /** Indentation offset. */
  public static final Object[] S_OFFSET = {"offset", 0};

  /** Line width for attribute wrapping, 0 disables wrapping. */
  public static final Object[] S_WIDTH = {"width", 80};

  /** Omit XML declaration and doctype: yes/no. */
  public static final Object[] S_HEADLESS = {"headless", NO};

  /** Render empty elements with an end tag: yes/no. */
  public static final Object[] S_ALLOW_EMPTY_TAGS = {"allow-empty-tags", NO};

  /** Space before the slash of empty elements: yes/no. */
  public static final Object[] S_SPACE_BEFORE_SLASH = {"space-before-slash", NO};

  /** Keep children of elements with text inline: yes/no. */
  public static final Object[] S_DONT_PRETTY_PRINT_TEXT_NODES = {"dont-pretty-print-text-nodes", NO};

  /** Keep existing references: yes/no. */
  public static final Object[] S_NO_DOUBLE_ENCODING = {"no-double-encoding", NO};

  /** Output shape of the map writer: map/object/json. */
  public static final Object[] S_FORMAT = {"format", Format.MAP};

  /** Properties. */
  private final ConcurrentMap<String, Object> props = new ConcurrentHashMap<>();

  /**
   * Constructor, populating the defaults.
   */
  public WriterProperties() {
    try {
      for (final Field f : getClass().getFields()) {
        final Object obj = f.get(null);
        if (!(obj instanceof final Object[] arr)) {
          continue;
        }
        props.put(arr[0].toString(), arr[1]);
      }
    } catch (final IllegalAccessException e) {
      throw new IllegalStateException(e);
    }
  }

  /**
   * <p>
   * Read a properties file over the defaults. Format of the properties file:
   * </p>
   *
   * <ul>
   * <li>pretty-print=yes (possible values: yes/no/true/false)</li>
   * <li>indent=\t (possible values: String, {@code \n}, {@code \r} and {@code \t} are decoded)</li>
   * <li>offset=0 (possible values: Integer)</li>
   * <li>width=80 (possible values: Integer)</li>
   * <li>format=map (possible values: map/object/json)</li>
   * </ul>
   *
   * <p>
   * Empty lines and lines starting with {@code #} are skipped. Keys which are not set keep their
   * default values; if a key is specified more than once the last value is preserved.
   * </p>
   *
   * @param filePath path to the properties file
   * @return ConcurrentMap which holds property key/values
   * @throws IllegalStateException if a line is malformed
   * @throws UncheckedIOException if the file can't be read
   */
  public ConcurrentMap<String, Object> readProps(final Path filePath) {
    requireNonNull(filePath);
    try (final BufferedReader reader = Files.newBufferedReader(filePath, StandardCharsets.UTF_8)) {
      int lineNumber = 0;
      for (String line = reader.readLine(); line != null; line = reader.readLine()) {
        lineNumber++;
        final String trimmed = line.strip();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) {
          continue;
        }

        final int equals = trimmed.indexOf('=');
        if (equals < 0) {
          throw new IllegalStateException(
              "Properties file has no '=' sign in line " + lineNumber + " -- parsing error!");
        }

        final String key = trimmed.substring(0, equals).strip().toLowerCase(Locale.ROOT);
        final Object defaultValue = props.get(key);
        if (defaultValue == null) {
          throw new IllegalStateException("Unknown property '" + key + "' in line " + lineNumber + ".");
        }
        props.put(key, convert(key, defaultValue, line.substring(line.indexOf('=') + 1)));
      }
    } catch (final IOException e) {
      throw new UncheckedIOException(e);
    }

    return props;
  }

  private static Object convert(final String key, final Object defaultValue, final String rawValue) {
    if (defaultValue instanceof String) {
      return unescape(rawValue);
    }

    final String value = rawValue.strip().toLowerCase(Locale.ROOT);
    if (defaultValue instanceof Boolean) {
      return switch (value) {
        case "yes", "true" -> YES;
        case "no", "false" -> NO;
        default -> throw new IllegalStateException("Property '" + key + "' expects yes/no, not '" + value + "'.");
      };
    }
    if (defaultValue instanceof Integer) {
      try {
        return Integer.valueOf(value);
      } catch (final NumberFormatException e) {
        throw new IllegalStateException("Property '" + key + "' expects an integer, not '" + value + "'.", e);
      }
    }
    if (defaultValue instanceof Format) {
      try {
        return Format.valueOf(value.toUpperCase(Locale.ROOT));
      } catch (final IllegalArgumentException e) {
        throw new IllegalStateException("Property '" + key + "' expects map/object/json, not '" + value + "'.", e);
      }
    }
    throw new AssertionError(defaultValue.getClass());
  }

  private static String unescape(final String value) {
    final StringBuilder builder = new StringBuilder(value.length());
    for (int i = 0, len = value.length(); i < len; i++) {
      final char ch = value.charAt(i);
      if (ch == '\\' && i + 1 < len) {
        switch (value.charAt(i + 1)) {
          case 'n' -> builder.append('\n');
          case 'r' -> builder.append('\r');
          case 't' -> builder.append('\t');
          case '\\' -> builder.append('\\');
          default -> {
            builder.append(ch);
            continue;
          }
        }
        i++;
      } else {
        builder.append(ch);
      }
    }
    return builder.toString();
  }

  /**
   * Get properties map.
   *
   * @return ConcurrentMap with key/value property pairs.
   */
  public ConcurrentMap<String, Object> getProps() {
    return props;
  }
}
