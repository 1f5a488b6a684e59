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

import java.util.AbstractMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiPredicate;

import static java.util.Objects.requireNonNull;
import static org.terracotta.crest.matchers.value.Inspector.inspect;

/**
 * Base for quantifiers over the entries of a map.
 * <p>
 * The condition is either a {@link BiPredicate} over key and value or a {@link Matcher} that is
 * handed each entry as a {@link Map.Entry}.  Values that are not maps never match.
 */
abstract class EntryMatcher extends Matcher {

  private final BiPredicate<Object, Object> condition;
  private final String conditionDescription;

  protected EntryMatcher(BiPredicate<Object, Object> condition) {
    this.condition = requireNonNull(condition, "condition");
    this.conditionDescription = "condition";
  }

  protected EntryMatcher(Matcher entryMatcher) {
    requireNonNull(entryMatcher, "entryMatcher");
    this.condition = (k, v) -> entryMatcher.matches(new AbstractMap.SimpleImmutableEntry<>(k, v));
    this.conditionDescription = entryMatcher.description();
  }

  protected String condition() {
    return conditionDescription;
  }

  protected static boolean isMap(Object actual) {
    return actual instanceof Map;
  }

  protected static String notAMap(Object actual) {
    return "expected a Map, but got " + inspect(actual);
  }

  /*
   * The first entry whose condition result equals wanted.
   */
  protected Optional<Map.Entry<?, ?>> firstEntry(Object actual, boolean wanted) {
    for (Map.Entry<?, ?> entry : ((Map<?, ?>)actual).entrySet()) {
      if (condition.test(entry.getKey(), entry.getValue()) == wanted) {
        return Optional.of(entry);
      }
    }
    return Optional.empty();
  }

  protected static String render(Map.Entry<?, ?> entry) {
    return inspect(entry.getKey()) + " => " + inspect(entry.getValue());
  }
}
