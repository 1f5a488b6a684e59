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

import java.util.function.BiPredicate;

/**
 * Matches maps with at least one entry satisfying a condition.  An empty map does not match.
 */
public class SomeEntry extends EntryMatcher {

  public SomeEntry(BiPredicate<Object, Object> condition) {
    super(condition);
  }

  public SomeEntry(Matcher entryMatcher) {
    super(entryMatcher);
  }

  @Override
  public boolean matches(Object actual) {
    return isMap(actual) && firstEntry(actual, true).isPresent();
  }

  @Override
  public String description() {
    return "at least one entry matches " + condition();
  }

  @Override
  public String failureMessage(Object actual) {
    if (!isMap(actual)) {
      return notAMap(actual);
    }
    return "expected at least one entry to match " + condition() + ", but none did";
  }

  @Override
  public String negatedFailureMessage(Object actual) {
    if (!isMap(actual)) {
      return notAMap(actual);
    }
    return "expected no entries to match " + condition() + ", but entry "
        + firstEntry(actual, true).map(EntryMatcher::render).orElse("<none>") + " did";
  }
}
