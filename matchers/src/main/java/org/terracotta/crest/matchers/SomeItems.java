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

/**
 * Matches sequences and collections with at least one element satisfying an item matcher.
 * Empty input does not match.
 */
public class SomeItems extends CollectionItemMatcher {

  public SomeItems(Matcher itemMatcher) {
    super(itemMatcher);
  }

  @Override
  public boolean matches(Object actual) {
    return isCollection(actual) && firstIndex(Values.elements(actual), true) >= 0;
  }

  @Override
  public String description() {
    return "some items are " + itemMatcher.description();
  }

  @Override
  public String failureMessage(Object actual) {
    if (!isCollection(actual)) {
      return notACollection(actual);
    }
    return "expected some items to be " + itemMatcher.description() + "\nbut no items matched";
  }

  @Override
  public String negatedFailureMessage(Object actual) {
    if (!isCollection(actual)) {
      return notACollection(actual);
    }
    return "expected no items to be " + itemMatcher.description() + "\n" + firstMatching(actual);
  }
}
