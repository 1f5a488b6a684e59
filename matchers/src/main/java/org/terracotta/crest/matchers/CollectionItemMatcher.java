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

import java.util.List;

import static java.util.Objects.requireNonNull;
import static org.terracotta.crest.matchers.value.Inspector.inspect;

/**
 * Base for quantifiers applying an item matcher to each element of a sequence or collection.
 * Values that are not sequences or collections never match.
 */
abstract class CollectionItemMatcher extends Matcher {

  protected final Matcher itemMatcher;

  protected CollectionItemMatcher(Matcher itemMatcher) {
    this.itemMatcher = requireNonNull(itemMatcher, "itemMatcher");
  }

  protected static boolean isCollection(Object actual) {
    return Shape.of(actual).isIterable();
  }

  protected static String notACollection(Object actual) {
    return "expected a collection, but got " + inspect(actual);
  }

  /*
   * Index of the first element whose match result equals wanted, or -1.
   */
  protected int firstIndex(List<Object> elements, boolean wanted) {
    for (int i = 0; i < elements.size(); i++) {
      if (itemMatcher.matches(elements.get(i)) == wanted) {
        return i;
      }
    }
    return -1;
  }

  protected String firstMatching(Object actual) {
    List<Object> elements = Values.elements(actual);
    int index = firstIndex(elements, true);
    if (index < 0) {
      return "but no item matched";
    }
    return "but item at index " + index + " matched: " + inspect(elements.get(index));
  }

  protected String itemFailureMessage(Object item) {
    return "  " + itemMatcher.failureMessage(item).replace("\n", "\n  ");
  }
}
