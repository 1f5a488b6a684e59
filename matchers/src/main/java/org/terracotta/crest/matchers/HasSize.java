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

import static java.util.Objects.requireNonNull;
import static org.terracotta.crest.matchers.value.Inspector.inspect;

/**
 * Matches values whose size equals an expected size, or whose size satisfies a matcher.
 * <p>
 * Values with no notion of size (see {@link Values#size(Object)}) never match.
 */
public class HasSize extends Matcher {

  private final Matcher sizeMatcher;
  private final String expectation;

  public HasSize(int size) {
    if (size < 0) {
      throw new MatcherConfigurationException("size must be non-negative: " + size);
    }
    this.sizeMatcher = new Equals(size);
    this.expectation = Integer.toString(size);
  }

  public HasSize(Matcher sizeMatcher) {
    this.sizeMatcher = requireNonNull(sizeMatcher, "sizeMatcher");
    this.expectation = sizeMatcher.description();
  }

  @Override
  public boolean matches(Object actual) {
    OptionalInt size = Values.size(actual);
    return size.isPresent() && sizeMatcher.matches(size.getAsInt());
  }

  @Override
  public String description() {
    return "has size " + expectation;
  }

  @Override
  public String failureMessage(Object actual) {
    OptionalInt size = Values.size(actual);
    return "expected " + inspect(actual) + " to have size " + expectation + ", but "
        + (size.isPresent() ? "had size " + size.getAsInt() : "it has no size");
  }

  @Override
  public String negatedFailureMessage(Object actual) {
    return "expected " + inspect(actual) + " not to have size " + expectation + ", but it did";
  }
}
