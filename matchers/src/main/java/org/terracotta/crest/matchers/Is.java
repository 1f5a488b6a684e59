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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

import static org.terracotta.crest.matchers.value.Inspector.identity;
import static org.terracotta.crest.matchers.value.Inspector.inspect;

/**
 * Matches the very same object as an expected reference.
 * <p>
 * When the expected value is itself a {@link Matcher} this matcher is transparent: matching,
 * description and both messages are delegated to it, so {@code is(equalTo(x))} reads naturally.
 */
public class Is extends Matcher {

  private final Object expected;

  //Identity is checked against the caller's own reference
  @SuppressFBWarnings("EI_EXPOSE_REP2")
  public Is(Object expected) {
    this.expected = expected;
  }

  @Override
  public boolean matches(Object actual) {
    if (expected instanceof Matcher) {
      return ((Matcher)expected).matches(actual);
    } else {
      return actual == expected;
    }
  }

  @Override
  public String description() {
    if (expected instanceof Matcher) {
      return ((Matcher)expected).description();
    } else {
      return "the same object as " + reference(expected);
    }
  }

  @Override
  public String failureMessage(Object actual) {
    if (expected instanceof Matcher) {
      return ((Matcher)expected).failureMessage(actual);
    } else {
      return "expected " + reference(actual) + " to be the same object as " + reference(expected);
    }
  }

  @Override
  public String negatedFailureMessage(Object actual) {
    if (expected instanceof Matcher) {
      return ((Matcher)expected).negatedFailureMessage(actual);
    } else {
      return "expected " + reference(actual) + " not to be the same object as " + inspect(expected)
          + ", but they are the same object";
    }
  }

  private static String reference(Object value) {
    return inspect(value) + " (identity: " + identity(value) + ")";
  }
}
