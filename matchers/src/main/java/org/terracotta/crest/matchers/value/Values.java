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

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Shape-aware operations over arbitrary values: element access, sizes, deep equality and ordering.
 */
public final class Values {

  private Values() {
    //no instances please
  }

  /**
   * Determines if two values are equal by value.
   * <p>
   * Sequences (lists and arrays, in any combination) are compared element-wise, maps are compared
   * by key set and per-key value, text is compared by content; all other values, collections
   * included, are compared using {@link Object#equals(Object)}.  {@code null} is equal only to
   * {@code null}.
   *
   * @param a the first value
   * @param b the second value
   * @return {@code true} if {@code a} and {@code b} are deeply equal
   */
  public static boolean deepEquals(Object a, Object b) {
    if (a == b) {
      return true;
    } else if (a == null || b == null) {
      return false;
    }

    Shape shapeA = Shape.of(a);
    Shape shapeB = Shape.of(b);
    if (shapeA == Shape.SEQUENCE && shapeB == Shape.SEQUENCE) {
      List<Object> listA = elements(a);
      List<Object> listB = elements(b);
      if (listA.size() != listB.size()) {
        return false;
      }
      for (int i = 0; i < listA.size(); i++) {
        if (!deepEquals(listA.get(i), listB.get(i))) {
          return false;
        }
      }
      return true;
    } else if (shapeA == Shape.MAP && shapeB == Shape.MAP) {
      Map<?, ?> mapA = (Map<?, ?>)a;
      Map<?, ?> mapB = (Map<?, ?>)b;
      if (mapA.size() != mapB.size()) {
        return false;
      }
      for (Map.Entry<?, ?> entry : mapA.entrySet()) {
        if (!hasKey(mapB, entry.getKey()) || !deepEquals(entry.getValue(), mapB.get(entry.getKey()))) {
          return false;
        }
      }
      return true;
    } else if (shapeA == Shape.TEXT && shapeB == Shape.TEXT) {
      return a.toString().equals(b.toString());
    } else {
      return Objects.equals(a, b);
    }
  }

  /**
   * Determines if {@code map} holds {@code key}.
   * <p>
   * A key the map cannot hold, because of its type or because it is {@code null}, is absent: sorted
   * and null-hostile maps report this as a {@link ClassCastException} or {@link NullPointerException}
   * from {@link Map#containsKey(Object)}.
   *
   * @param map the map to search
   * @param key the key to look for
   * @return {@code true} if {@code key} is present
   */
  public static boolean hasKey(Map<?, ?> map, Object key) {
    try {
      return map.containsKey(key);
    } catch (ClassCastException | NullPointerException e) {
      return false;
    }
  }

  /**
   * Determines if {@code candidate} is deeply equal to any of {@code elements}.
   *
   * @param elements the elements to search
   * @param candidate the value to look for
   * @return {@code true} if a deeply equal element is present
   */
  public static boolean containsDeeply(Iterable<?> elements, Object candidate) {
    for (Object element : elements) {
      if (deepEquals(element, candidate)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns the elements of a {@link Shape#SEQUENCE} or {@link Shape#COLLECTION} value as a list.
   *
   * @param value the iterable value
   * @return an unmodifiable list of the elements in iteration order
   * @throws IllegalArgumentException if {@code value} is not iterable
   */
  public static List<Object> elements(Object value) {
    if (value instanceof List) {
      return Collections.unmodifiableList((List<?>)value);
    } else if (value != null && value.getClass().isArray()) {
      int length = Array.getLength(value);
      List<Object> list = new ArrayList<>(length);
      for (int i = 0; i < length; i++) {
        list.add(Array.get(value, i));
      }
      return Collections.unmodifiableList(list);
    } else if (value instanceof Iterable && !(value instanceof Map)) {
      List<Object> list = new ArrayList<>();
      for (Object element : (Iterable<?>)value) {
        list.add(element);
      }
      return Collections.unmodifiableList(list);
    } else {
      throw new IllegalArgumentException("Not an iterable value: " + Inspector.inspect(value));
    }
  }

  /**
   * Returns the size of a value: the length of text, the element count of a sequence or collection,
   * or the entry count of a map.
   *
   * @param value the value to measure
   * @return the size, or empty if {@code value} has no notion of size
   */
  public static OptionalInt size(Object value) {
    switch (Shape.of(value)) {
      case TEXT:
        return OptionalInt.of(((CharSequence)value).length());
      case SEQUENCE:
        return OptionalInt.of(value instanceof List ? ((List<?>)value).size() : Array.getLength(value));
      case COLLECTION:
        if (value instanceof Collection) {
          return OptionalInt.of(((Collection<?>)value).size());
        } else {
          int count = 0;
          for (Iterator<?> it = ((Iterable<?>)value).iterator(); it.hasNext(); it.next()) {
            count++;
          }
          return OptionalInt.of(count);
        }
      case MAP:
        return OptionalInt.of(((Map<?, ?>)value).size());
      default:
        return OptionalInt.empty();
    }
  }

  /**
   * Compares two values using their natural ordering.
   * <p>
   * Numbers of any type are compared by numeric value.  Other values are compared through
   * {@link Comparable#compareTo(Object)}; values that are not mutually comparable yield an
   * empty result rather than an exception.
   *
   * @param a the first value
   * @param b the second value
   * @return a negative, zero or positive value as {@code a} is less than, equal to or greater
   *      than {@code b}; empty if the values are not comparable
   */
  @SuppressWarnings({"unchecked", "rawtypes"})
  public static OptionalInt compare(Object a, Object b) {
    if (a == null || b == null) {
      return OptionalInt.empty();
    } else if (a instanceof Number && b instanceof Number) {
      return compareNumbers((Number)a, (Number)b);
    } else if (a instanceof Comparable) {
      try {
        return OptionalInt.of(((Comparable)a).compareTo(b));
      } catch (ClassCastException e) {
        return OptionalInt.empty();
      }
    } else {
      return OptionalInt.empty();
    }
  }

  private static OptionalInt compareNumbers(Number a, Number b) {
    if (isNaN(a) || isNaN(b)) {
      return OptionalInt.empty();
    }
    Optional<BigDecimal> decimalA = toDecimal(a);
    Optional<BigDecimal> decimalB = toDecimal(b);
    if (decimalA.isPresent() && decimalB.isPresent()) {
      return OptionalInt.of(decimalA.get().compareTo(decimalB.get()));
    } else {
      return OptionalInt.of(Double.compare(a.doubleValue(), b.doubleValue()));
    }
  }

  private static boolean isNaN(Number n) {
    return (n instanceof Double || n instanceof Float) && Double.isNaN(n.doubleValue());
  }

  /**
   * Converts a number to an exact {@link BigDecimal}.
   * <p>
   * Floating point values are converted through their shortest decimal representation so
   * {@code 0.1d} converts to {@code 0.1}, not to its binary expansion.
   *
   * @param number the number to convert
   * @return the decimal value; empty for NaN, infinities and unrecognized {@code Number} types
   */
  public static Optional<BigDecimal> toDecimal(Number number) {
    if (number instanceof BigDecimal) {
      return Optional.of((BigDecimal)number);
    } else if (number instanceof BigInteger) {
      return Optional.of(new BigDecimal((BigInteger)number));
    } else if (number instanceof Double || number instanceof Float) {
      double d = number.doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        return Optional.empty();
      }
      return Optional.of(new BigDecimal(number.toString()));
    } else if (number instanceof Long || number instanceof Integer || number instanceof Short || number instanceof Byte) {
      return Optional.of(BigDecimal.valueOf(number.longValue()));
    } else {
      try {
        return Optional.of(new BigDecimal(number.toString()));
      } catch (NumberFormatException e) {
        return Optional.empty();
      }
    }
  }

  /**
   * Determines the truthiness of a value: {@code null} and {@link Boolean#FALSE} are falsy,
   * everything else is truthy.
   *
   * @param value the value to test
   * @return {@code true} if {@code value} is truthy
   */
  public static boolean isTruthy(Object value) {
    return value != null && !Boolean.FALSE.equals(value);
  }
}
