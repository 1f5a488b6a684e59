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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.BiPredicate;

import static java.util.stream.Collectors.toList;
import static org.terracotta.crest.matchers.value.Inspector.inspect;
import static org.terracotta.crest.matchers.value.Inspector.inspectAll;

/**
 * Base for matchers checking that a map holds each of several keys or values.
 */
abstract class MapMembershipMatcher extends Matcher {

  private final List<Object> expected;
  private final String singular;
  private final String plural;
  private final BiPredicate<Map<?, ?>, Object> present;

  protected MapMembershipMatcher(Object[] expected, String singular, String plural, BiPredicate<Map<?, ?>, Object> present) {
    if (expected.length == 0) {
      throw new MatcherConfigurationException("at least one " + singular + " required");
    }
    this.expected = Collections.unmodifiableList(new ArrayList<>(Arrays.asList(expected)));
    this.singular = singular;
    this.plural = plural;
    this.present = present;
  }

  @Override
  public boolean matches(Object actual) {
    return actual instanceof Map && missing((Map<?, ?>)actual).isEmpty();
  }

  @Override
  public String description() {
    return "has " + expectation();
  }

  @Override
  public String failureMessage(Object actual) {
    if (!(actual instanceof Map)) {
      return "expected a Map, but got " + inspect(actual);
    }
    return "expected " + inspect(actual) + " to have " + plural + " " + inspectAll(expected)
        + "\nmissing: " + inspectAll(missing((Map<?, ?>)actual));
  }

  @Override
  public String negatedFailureMessage(Object actual) {
    return "expected " + inspect(actual) + " not to have " + expectation() + ", but it did";
  }

  private String expectation() {
    return (expected.size() == 1 ? singular : plural) + " " + inspectAll(expected);
  }

  private List<Object> missing(Map<?, ?> actual) {
    return expected.stream().filter(e -> !present.test(actual, e)).collect(toList());
  }
}
