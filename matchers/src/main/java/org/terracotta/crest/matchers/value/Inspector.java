/*
 * Copyright IBM Corp. 2025
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.terracotta.crest.matchers.value;

import java.util.Map;
import java.util.regex.Pattern;

import static java.util.stream.Collectors.joining;
import static java.util.stream.StreamSupport.stream;

/**
 * Renders values for inclusion in matcher descriptions and failure messages.
 * <p>
 * Text is quoted and escaped ({@code "a\tb"}), characters are single-quoted, sequences and
 * collections are bracketed ({@code [1, 2]}) and maps are braced ({@code {"a": 1}}); nested
 * values are rendered recursively.
 */
public final class Inspector {

  private Inspector() {
    //no instances please
  }

  /**
   * Renders a value.
   *
   * @param value the value to render; may be {@code null}
   * @return the rendering of {@code value}
   */
  public static String inspect(Object value) {
    if (value == null) {
      return "null";
    } else if (value instanceof Character) {
      return '\'' + escape(value.toString(), '\'') + '\'';
    } else if (value instanceof Class) {
      return ((Class<?>)value).getName();
    } else if (value instanceof Pattern) {
      return "/" + ((Pattern)value).pattern() + "/";
    }

    switch (Shape.of(value)) {
      case TEXT:
        return '"' + escape(value.toString(), '"') + '"';
      case SEQUENCE:
      case COLLECTION:
        return "[" + inspectAll(Values.elements(value)) + "]";
      case MAP:
        return ((Map<?, ?>)value).entrySet().stream()
            .map(e -> inspect(e.getKey()) + ": " + inspect(e.getValue()))
            .collect(joining(", ", "{", "}"));
      default:
        return String.valueOf(value);
    }
  }

  /**
   * Renders each value and joins the results with {@code ", "}.
   *
   * @param values the values to render
   * @return the comma-separated renderings
   */
  public static String inspectAll(Iterable<?> values) {
    return stream(values.spliterator(), false).map(Inspector::inspect).collect(joining(", "));
  }

  /**
   * Returns a token identifying the object instance, for use in identity-related messages.
   *
   * @param value the object; may be {@code null}
   * @return a hexadecimal identity token
   */
  public static String identity(Object value) {
    return String.format("0x%08x", System.identityHashCode(value));
  }

  private static String escape(String text, char quote) {
    StringBuilder sb = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        default:
          if (c == quote) {
            sb.append('\\');
          }
          sb.append(c);
      }
    }
    return sb.toString();
  }
}
