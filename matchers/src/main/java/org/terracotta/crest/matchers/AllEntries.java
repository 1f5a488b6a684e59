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
 * Matches maps whose every entry satisfies a condition.  An empty map matches.
 */
public class AllEntries extends EntryMatcher {

  public AllEntries(BiPredicate<Object, Object> condition) {
    super(condition);
  }

  public AllEntries(Matcher entryMatcher) {
    super(entryMatcher);
  }

  @Override
  public boolean matches(Object actual) {
    return isMap(actual) && !firstEntry(actual, false).isPresent();
  }

  @Override
  public String description() {
    return "all entries match " + condition();
  }

  @Override
  public String failureMessage(Object actual) {
    if (!isMap(actual)) {
      return notAMap(actual);
    }
    return "expected all entries to match " + condition() + ", but entry "
        + firstEntry(actual, false).map(EntryMatcher::render).orElse("<none>") + " did not";
  }

  @Override
  public String negatedFailureMessage(Object actual) {
    return "expected not all entries to match " + condition() + ", but they all did";
  }
}
