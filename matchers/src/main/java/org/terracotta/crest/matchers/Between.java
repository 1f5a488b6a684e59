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

import static org.terracotta.crest.matchers.value.Inspector.inspect;

/**
 * Matches values lying between two bounds, inclusively unless constructed as exclusive.
 */
public class Between extends Matcher {

  private final Object min;
  private final Object max;
  private final boolean exclusive;

  public Between(Object min, Object max) {
    this(min, max, false);
  }

  public Between(Object min, Object max, boolean exclusive) {
    if (min == null || max == null) {
      throw new MatcherConfigurationException("bounds must not be null");
    }
    this.min = min;
    this.max = max;
    this.exclusive = exclusive;
  }

  @Override
  public boolean matches(Object actual) {
    OptionalInt lower = Values.compare(actual, min);
    OptionalInt upper = Values.compare(actual, max);
    if (!lower.isPresent() || !upper.isPresent()) {
      return false;
    } else if (exclusive) {
      return lower.getAsInt() > 0 && upper.getAsInt() < 0;
    } else {
      return lower.getAsInt() >= 0 && upper.getAsInt() <= 0;
    }
  }

  @Override
  public String description() {
    return "between " + inspect(min) + " and " + inspect(max) + (exclusive ? " (exclusively)" : " (inclusively)");
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
