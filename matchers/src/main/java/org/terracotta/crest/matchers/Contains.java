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
package org.terracotta.crest.matchers;

import org.terracotta.crest.matchers.value.Shape;
import org.terracotta.crest.matchers.value.Values;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.terracotta.crest.matchers.value.Inspector.inspect;
import static org.terracotta.crest.matchers.value.Inspector.inspectAll;

/**
 * Matches sequences and collections holding exactly the given items in any order, duplicates
 * counted.  When the single item is a map, matches maps holding exactly its entries.
 *
 * @see ContainsExactly
 */
public class Contains extends Matcher {

  private final List<Object> items;
  private final Map<?, ?> expectedEntries;

  public Contains(Object... items) {
    this.items = Collections.unmodifiableList(new ArrayList<>(Arrays.asList(items)));
    this.expectedEntries = items.length == 1 && items[0] instanceof Map ? (Map<?, ?>)items[0] : null;
  }

  @Override
  public boolean matches(Object actual) {
    Shape shape = Shape.of(actual);
    if (shape == Shape.MAP) {
      return expectedEntries != null && Values.deepEquals(actual, expectedEntries);
    } else if (shape.isIterable()) {
      Difference difference = new Difference(items, Values.elements(actual));
      return difference.missing.isEmpty() && difference.extra.isEmpty();
    } else {
      return false;
    }
  }

  @Override
  public String description() {
    return "contains exactly " + expectation() + " (in any order)";
  }

  @Override
  public String failureMessage(Object actual) {
    StringBuilder message = new StringBuilder("expected ").append(inspect(actual))
        .append(" to contain exactly ").append(expectation()).append(" (in any order)");
    Shape shape = Shape.of(actual);
    if (shape == Shape.MAP && expectedEntries != null) {
      Map<?, ?> map = (Map<?, ?>)actual;
      Map<Object, Object> missing = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : expectedEntries.entrySet()) {
        if (!Includes.hasEntry(map, entry)) {
          missing.put(entry.getKey(), entry.getValue());
        }
      }
      Map<Object, Object> extra = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        if (!Includes.hasEntry(expectedEntries, entry)) {
          extra.put(entry.getKey(), entry.getValue());
        }
      }
      if (!missing.isEmpty()) {
        message.append("\nmissing: ").append(inspect(missing));
      }
      if (!extra.isEmpty()) {
        message.append("\nextra: ").append(inspect(extra));
      }
    } else if (shape.isIterable()) {
      Difference difference = new Difference(items, Values.elements(actual));
      if (!difference.missing.isEmpty()) {
        message.append("\nmissing: ").append(inspectAll(difference.missing));
      }
      if (!difference.extra.isEmpty()) {
        message.append("\nextra: ").append(inspectAll(difference.extra));
      }
    } else {
      message.append("\nbut it is not a collection");
    }
    return message.toString();
  }

  @Override
  public String negatedFailureMessage(Object actual) {
    return "expected " + inspect(actual) + " not to contain exactly " + expectation() + " (in any order), but it did";
  }

  private String expectation() {
    return expectedEntries == null ? inspectAll(items) : inspect(expectedEntries);
  }

  /**
   * Multiset difference between the expected items and the actual elements.
   */
  private static final class Difference {
    private final List<Object> missing;
    private final List<Object> extra = new ArrayList<>();

    Difference(List<Object> expected, List<Object> actual) {
      this.missing = new ArrayList<>(expected);
      for (Object element : actual) {
        if (!removeFirstEqual(missing, element)) {
          extra.add(element);
        }
      }
    }

    private static boolean removeFirstEqual(List<Object> from, Object element) {
      for (Iterator<Object> it = from.iterator(); it.hasNext(); ) {
        if (Values.deepEquals(it.next(), element)) {
          it.remove();
          return true;
        }
      }
      return false;
    }
  }
}
