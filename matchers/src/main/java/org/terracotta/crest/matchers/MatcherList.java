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
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

import static java.util.stream.Collectors.joining;
import static java.util.stream.Collectors.toList;

/**
 * Base for combinators over an arbitrary number of matchers.
 */
abstract class MatcherList extends Matcher {

  protected final List<Matcher> matchers;

  /**
   * Creates a combinator over {@code matchers}.  Nested arrays and iterables of matchers are
   * flattened, preserving order.
   *
   * @param matchers matchers, arrays of matchers or iterables of matchers
   * @throws MatcherConfigurationException if an element is not a matcher
   */
  protected MatcherList(Object... matchers) {
    List<Matcher> flattened = new ArrayList<>();
    flatten(matchers, flattened);
    this.matchers = Collections.unmodifiableList(flattened);
  }

  private static void flatten(Object[] elements, List<Matcher> into) {
    for (Object element : elements) {
      if (element instanceof Matcher) {
        into.add((Matcher)element);
      } else if (element instanceof Object[]) {
        flatten((Object[])element, into);
      } else if (element instanceof Iterable) {
        List<Object> nested = new ArrayList<>();
        ((Iterable<?>)element).forEach(nested::add);
        flatten(nested.toArray(), into);
      } else {
        throw new MatcherConfigurationException("Expecting a matcher but found " + element);
      }
    }
  }

  protected List<Matcher> matching(Object actual) {
    return matchers.stream().filter(m -> m.matches(actual)).collect(toList());
  }

  protected List<Matcher> failing(Object actual) {
    return matchers.stream().filter(m -> !m.matches(actual)).collect(toList());
  }

  protected String descriptions(String separator) {
    return join(matchers, Matcher::description, separator);
  }

  protected static String join(List<Matcher> matchers, Function<Matcher, String> mapper, String separator) {
    return matchers.stream().map(mapper).collect(joining(separator));
  }
}
