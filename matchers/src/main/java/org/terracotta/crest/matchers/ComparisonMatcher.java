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

import java.util.OptionalInt;
import java.util.function.IntPredicate;

import static org.terracotta.crest.matchers.value.Inspector.inspect;

/**
 * Base for matchers comparing the actual value against a bound using natural ordering.
 * <p>
 * Numbers compare by numeric value whatever their types; other values compare through
 * {@link Comparable}.  Values that cannot be compared with the bound do not match.
 *
 * @see Values#compare(Object, Object)
 */
abstract class ComparisonMatcher extends Matcher {

  private final Object bound;
  private final String label;
  private final IntPredicate accept;

  protected ComparisonMatcher(Object bound, String label, IntPredicate accept) {
    if (bound == null) {
      throw new MatcherConfigurationException("comparison bound must not be null");
    }
    this.bound = bound;
    this.label = label;
    this.accept = accept;
  }

  @Override
  public boolean matches(Object actual) {
    OptionalInt comparison = Values.compare(actual, bound);
    return comparison.isPresent() && accept.test(comparison.getAsInt());
  }

  @Override
  public String description() {
    return label + " " + inspect(bound);
  }

  @Override
  public String failureMessage(Object actual) {
    return "expected " + inspect(actual) + " to be " + description();
  }

  @Override
  public String negatedFailureMessage(Object actual) {
    return "expected " + inspect(actual) + " not to be " + description() + ", but it was";
  }
}
