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

import org.terracotta.crest.matchers.value.Values;

import java.util.List;

/**
 * Matches sequences and collections whose every element satisfies an item matcher.  Empty input
 * matches.
 */
public class AllItems extends CollectionItemMatcher {

  public AllItems(Matcher itemMatcher) {
    super(itemMatcher);
  }

  @Override
  public boolean matches(Object actual) {
    return isCollection(actual) && firstIndex(Values.elements(actual), false) < 0;
  }

  @Override
  public String description() {
    return "all items are " + itemMatcher.description();
  }

  @Override
  public String failureMessage(Object actual) {
    if (!isCollection(actual)) {
      return notACollection(actual);
    }
    List<Object> elements = Values.elements(actual);
    int index = firstIndex(elements, false);
    if (index < 0) {
      return "expected all items to be " + itemMatcher.description() + "\nbut every item matched";
    }
    return "expected all items to be " + itemMatcher.description()
        + "\nitem at index " + index + " failed:\n" + itemFailureMessage(elements.get(index));
  }

  @Override
  public String negatedFailureMessage(Object actual) {
    return "expected not all items to be " + itemMatcher.description() + ", but they all matched";
  }
}
