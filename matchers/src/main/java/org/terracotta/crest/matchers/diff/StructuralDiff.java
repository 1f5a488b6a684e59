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
package org.terracotta.crest.matchers.diff;

import org.terracotta.crest.matchers.value.Shape;
import org.terracotta.crest.matchers.value.Values;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Computes human-readable differences between an expected and an actual composite value.
 * <p>
 * Only values of the same diffable shape are compared: two maps, two sequences or two strings.
 * The comparison is first-level only; a nested mismatch is reported as a whole-value change.
 * <ul>
 *   <li>Maps: missing keys, extra keys, then keys whose values differ.  Equal entries are omitted.</li>
 *   <li>Sequences: a size mismatch (when present), then for each index a missing, extra or changed
 *   element.</li>
 *   <li>Strings: only when either string has at least {@value #TEXT_DIFF_THRESHOLD} characters, a
 *   length mismatch (when present) and the first differing position with up to
 *   {@value #CONTEXT_WIDTH} characters of context each side.</li>
 * </ul>
 * The diff explains a failure; it never influences whether a match succeeds.
 */
public final class StructuralDiff {

  public static final int TEXT_DIFF_THRESHOLD = 20;
  public static final int CONTEXT_WIDTH = 10;

  private StructuralDiff() {
    //no instances please
  }

  /**
   * Determines if {@code expected} and {@code actual} are both maps, both sequences or both strings.
   *
   * @param expected the expected value
   * @param actual the actual value
   * @return {@code true} if a diff can be computed
   */
  public static boolean isDiffable(Object expected, Object actual) {
    Shape shape = Shape.of(expected);
    return (shape == Shape.MAP || shape == Shape.SEQUENCE || shape == Shape.TEXT) && shape == Shape.of(actual);
  }

  /**
   * Computes the differences between {@code expected} and {@code actual}.
   *
   * @param expected the expected value
   * @param actual the actual value
   * @return the discrepancies found; empty if the values are equal or not diffable
   */
  public static List<DiffEntry> compute(Object expected, Object actual) {
    if (!isDiffable(expected, actual)) {
      return Collections.emptyList();
    }
    switch (Shape.of(expected)) {
      case MAP:
        return mapDiff((Map<?, ?>)expected, (Map<?, ?>)actual);
      case SEQUENCE:
        return sequenceDiff(Values.elements(expected), Values.elements(actual));
      case TEXT:
        return textDiff(expected.toString(), actual.toString());
      default:
        return Collections.emptyList();
    }
  }

  /**
   * Renders the differences between {@code expected} and {@code actual} as a report headed {@code Diff:}.
   *
   * @param expected the expected value
   * @param actual the actual value
   * @return the report; empty when there are no differences to show
   */
  public static Optional<String> render(Object expected, Object actual) {
    List<DiffEntry> entries = compute(expected, actual);
    if (entries.isEmpty()) {
      return Optional.empty();
    }
    List<String> lines = new ArrayList<>();
    lines.add("Diff:");
    for (DiffEntry entry : entries) {
      lines.addAll(entry.lines());
    }
    return Optional.of(String.join("\n", lines));
  }

  private static List<DiffEntry> mapDiff(Map<?, ?> expected, Map<?, ?> actual) {
    List<DiffEntry> entries = new ArrayList<>();
    for (Map.Entry<?, ?> entry : expected.entrySet()) {
      if (!Values.hasKey(actual, entry.getKey())) {
        entries.add(DiffEntry.missingKey(entry.getKey(), entry.getValue()));
      }
    }
    for (Map.Entry<?, ?> entry : actual.entrySet()) {
      if (!Values.hasKey(expected, entry.getKey())) {
        entries.add(DiffEntry.extraKey(entry.getKey(), entry.getValue()));
      }
    }
    for (Map.Entry<?, ?> entry : actual.entrySet()) {
      Object key = entry.getKey();
      if (Values.hasKey(expected, key) && !Values.deepEquals(expected.get(key), entry.getValue())) {
        entries.add(DiffEntry.changedValue(key, expected.get(key), entry.getValue()));
      }
    }
    return entries;
  }

  private static List<DiffEntry> sequenceDiff(List<Object> expected, List<Object> actual) {
    List<DiffEntry> entries = new ArrayList<>();
    if (expected.size() != actual.size()) {
      entries.add(DiffEntry.sizeMismatch(expected.size(), actual.size()));
    }
    int bound = Math.max(expected.size(), actual.size());
    for (int i = 0; i < bound; i++) {
      if (i >= actual.size()) {
        entries.add(DiffEntry.missingElement(i, expected.get(i)));
      } else if (i >= expected.size()) {
        entries.add(DiffEntry.extraElement(i, actual.get(i)));
      } else if (!Values.deepEquals(expected.get(i), actual.get(i))) {
        entries.add(DiffEntry.changedElement(i, expected.get(i), actual.get(i)));
      }
    }
    return entries;
  }

  private static List<DiffEntry> textDiff(String expected, String actual) {
    if (expected.length() < TEXT_DIFF_THRESHOLD && actual.length() < TEXT_DIFF_THRESHOLD) {
      return Collections.emptyList();
    }

    List<DiffEntry> entries = new ArrayList<>();
    if (expected.length() != actual.length()) {
      entries.add(DiffEntry.lengthMismatch(expected.length(), actual.length()));
    }

    int position = firstDifference(expected, actual);
    if (position >= 0) {
      int start = Math.max(0, position - CONTEXT_WIDTH);
      int end = Math.min(Math.min(expected.length(), actual.length()), position + CONTEXT_WIDTH);
      entries.add(DiffEntry.firstDifference(position, window(expected, start, end), window(actual, start, end)));
    }
    return entries;
  }

  /*
   * The first index at which the strings differ; when one string is a prefix of the other this
   * is the length of the shorter.  -1 if the strings are equal.
   */
  private static int firstDifference(String expected, String actual) {
    int common = Math.min(expected.length(), actual.length());
    for (int i = 0; i < common; i++) {
      if (expected.charAt(i) != actual.charAt(i)) {
        return i;
      }
    }
    return expected.length() == actual.length() ? -1 : common;
  }

  /*
   * Characters from start through end, inclusive, clipped to the string.
   */
  private static String window(String text, int start, int end) {
    return text.substring(Math.min(start, text.length()), Math.min(text.length(), end + 1));
  }
}
