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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.terracotta.crest.matchers.value.Inspector.inspect;

/**
 * One discrepancy between an expected and an actual composite value.
 * <p>
 * The meaning of {@link #location()}, {@link #expected()} and {@link #actual()} depends on the
 * {@link Kind}; see the factory methods.
 */
public final class DiffEntry {

  /**
   * The kinds of discrepancy.
   */
  public enum Kind {
    /** A key present in the expected map is absent from the actual map. */
    MISSING_KEY,
    /** A key present in the actual map is absent from the expected map. */
    EXTRA_KEY,
    /** A key present in both maps holds different values. */
    CHANGED_VALUE,
    /** The sequences have different element counts. */
    SIZE_MISMATCH,
    /** An index present in the expected sequence is beyond the end of the actual sequence. */
    MISSING_ELEMENT,
    /** An index present in the actual sequence is beyond the end of the expected sequence. */
    EXTRA_ELEMENT,
    /** An index present in both sequences holds different elements. */
    CHANGED_ELEMENT,
    /** The strings have different lengths. */
    LENGTH_MISMATCH,
    /** The position of the first differing character, with surrounding context. */
    FIRST_DIFFERENCE
  }

  private final Kind kind;
  private final Object location;
  private final Object expected;
  private final Object actual;

  private DiffEntry(Kind kind, Object location, Object expected, Object actual) {
    this.kind = kind;
    this.location = location;
    this.expected = expected;
    this.actual = actual;
  }

  public static DiffEntry missingKey(Object key, Object expectedValue) {
    return new DiffEntry(Kind.MISSING_KEY, key, expectedValue, null);
  }

  public static DiffEntry extraKey(Object key, Object actualValue) {
    return new DiffEntry(Kind.EXTRA_KEY, key, null, actualValue);
  }

  public static DiffEntry changedValue(Object key, Object expectedValue, Object actualValue) {
    return new DiffEntry(Kind.CHANGED_VALUE, key, expectedValue, actualValue);
  }

  public static DiffEntry sizeMismatch(int expectedSize, int actualSize) {
    return new DiffEntry(Kind.SIZE_MISMATCH, null, expectedSize, actualSize);
  }

  public static DiffEntry missingElement(int index, Object expectedElement) {
    return new DiffEntry(Kind.MISSING_ELEMENT, index, expectedElement, null);
  }

  public static DiffEntry extraElement(int index, Object actualElement) {
    return new DiffEntry(Kind.EXTRA_ELEMENT, index, null, actualElement);
  }

  public static DiffEntry changedElement(int index, Object expectedElement, Object actualElement) {
    return new DiffEntry(Kind.CHANGED_ELEMENT, index, expectedElement, actualElement);
  }

  public static DiffEntry lengthMismatch(int expectedLength, int actualLength) {
    return new DiffEntry(Kind.LENGTH_MISMATCH, null, expectedLength, actualLength);
  }

  /**
   * Creates an entry for the first differing character of two strings.
   *
   * @param position the index of the first difference
   * @param expectedWindow the expected text surrounding {@code position}
   * @param actualWindow the actual text surrounding {@code position}
   * @return a new {@code FIRST_DIFFERENCE} entry
   */
  public static DiffEntry firstDifference(int position, String expectedWindow, String actualWindow) {
    return new DiffEntry(Kind.FIRST_DIFFERENCE, position, expectedWindow, actualWindow);
  }

  public Kind kind() {
    return kind;
  }

  /**
   * Returns the map key, sequence index or string position of this entry.
   *
   * @return the location; {@code null} for size and length mismatches
   */
  public Object location() {
    return location;
  }

  public Object expected() {
    return expected;
  }

  public Object actual() {
    return actual;
  }

  /**
   * Renders this entry as indented report lines.
   *
   * @return the lines describing this entry
   */
  public List<String> lines() {
    switch (kind) {
      case MISSING_KEY:
        return Collections.singletonList("  missing key: " + inspect(location) + " => " + inspect(expected));
      case EXTRA_KEY:
        return Collections.singletonList("  extra key: " + inspect(location) + " => " + inspect(actual));
      case CHANGED_VALUE:
        return expectedActual("  key " + inspect(location) + ":", inspect(expected), inspect(actual));
      case SIZE_MISMATCH:
        return Collections.singletonList("  size mismatch: expected " + expected + " elements, got " + actual);
      case MISSING_ELEMENT:
        return Collections.singletonList("  missing [" + location + "]: " + inspect(expected));
      case EXTRA_ELEMENT:
        return Collections.singletonList("  extra [" + location + "]: " + inspect(actual));
      case CHANGED_ELEMENT:
        return expectedActual("  [" + location + "]:", inspect(expected), inspect(actual));
      case LENGTH_MISMATCH:
        return Collections.singletonList("  length mismatch: expected " + expected + " chars, got " + actual);
      case FIRST_DIFFERENCE:
        return expectedActual("  first difference at position " + location + ":",
            "..." + inspect(expected) + "...", "..." + inspect(actual) + "...");
      default:
        throw new AssertionError("Unexpected kind " + kind);
    }
  }

  private static List<String> expectedActual(String heading, String expected, String actual) {
    return Arrays.asList(heading, "    expected: " + expected, "    actual:   " + actual);
  }

  @Override
  public String toString() {
    return String.join("\n", lines());
  }
}
