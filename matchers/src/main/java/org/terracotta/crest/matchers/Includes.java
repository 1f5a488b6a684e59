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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.terracotta.crest.matchers.value.Inspector.inspect;
import static org.terracotta.crest.matchers.value.Inspector.inspectAll;

/**
 * Matches values containing all of the given items.
 * <p>
 * What "containing" means depends on the shape of the actual value:
 * <ul>
 *   <li>text contains each item as a substring;</li>
 *   <li>a sequence or collection contains each item as an element;</li>
 *   <li>a map, when the single item is itself a map, contains each of its entries; otherwise it
 *   contains every entry of each map item and every other item as a key.</li>
 * </ul>
 * Any other value never matches.
 */
public class Includes extends Matcher {

  private final List<Object> items;
  private final Map<?, ?> expectedEntries;

  public Includes(Object... items) {
    this.items = Collections.unmodifiableList(new ArrayList<>(Arrays.asList(items)));
    this.expectedEntries = items.length == 1 && items[0] instanceof Map ? (Map<?, ?>)items[0] : null;
  }

  @Override
  public boolean matches(Object actual) {
    return Shape.of(actual) != Shape.SCALAR && missing(actual).isEmpty();
  }

  @Override
  public String description() {
    return "includes " + expectation();
  }

  @Override
  public String failureMessage(Object actual) {
    List<Object> missing = missing(actual);
    String missingText;
    if (expectedEntries != null && actual instanceof Map) {
      Map<Object, Object> missingEntries = new LinkedHashMap<>();
      for (Object entry : missing) {
        missingEntries.put(((Map.Entry<?, ?>)entry).getKey(), ((Map.Entry<?, ?>)entry).getValue());
      }
      missingText = inspect(missingEntries);
    } else {
      missingText = inspectAll(missing);
    }
    return "expected " + inspect(actual) + " to include " + expectation() + "\nmissing: " + missingText;
  }

  @Override
  public String negatedFailureMessage(Object actual) {
    return "expected " + inspect(actual) + " not to include " + expectation() + ", but it did";
  }

  private String expectation() {
    return expectedEntries == null ? inspectAll(items) : inspect(expectedEntries);
  }

  /*
   * The items (or, for a map expectation against a map, the entries) not present in actual.
   */
  private List<Object> missing(Object actual) {
    List<Object> missing = new ArrayList<>();
    switch (Shape.of(actual)) {
      case TEXT:
        String text = actual.toString();
        for (Object item : items) {
          if (!(item instanceof CharSequence) || !text.contains((CharSequence)item)) {
            missing.add(item);
          }
        }
        break;
      case SEQUENCE:
      case COLLECTION:
        List<Object> elements = Values.elements(actual);
        for (Object item : items) {
          if (!Values.containsDeeply(elements, item)) {
            missing.add(item);
          }
        }
        break;
      case MAP:
        Map<?, ?> map = (Map<?, ?>)actual;
        if (expectedEntries != null) {
          for (Map.Entry<?, ?> entry : expectedEntries.entrySet()) {
            if (!hasEntry(map, entry)) {
              missing.add(entry);
            }
          }
        } else {
          for (Object item : items) {
            if (item instanceof Map) {
              if (!((Map<?, ?>)item).entrySet().stream().allMatch(e -> hasEntry(map, e))) {
                missing.add(item);
              }
            } else if (!Values.hasKey(map, item)) {
              missing.add(item);
            }
          }
        }
        break;
      default:
        missing.addAll(items);
        break;
    }
    return missing;
  }

  static boolean hasEntry(Map<?, ?> map, Map.Entry<?, ?> entry) {
    return Values.hasKey(map, entry.getKey()) && Values.deepEquals(map.get(entry.getKey()), entry.getValue());
  }
}
