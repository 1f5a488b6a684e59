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

import org.hamcrest.BaseMatcher;
import org.hamcrest.Description;

import static org.terracotta.crest.matchers.value.Inspector.inspect;

/**
 * Base class of all matchers.
 * <p>
 * A matcher is an immutable predicate over an arbitrary value that can describe itself and
 * explain, in either direction, why a value did or did not satisfy it.  Subclasses implement
 * {@link #matches(Object)} and {@link #description()} and override the message methods when the
 * defaults are not informative enough:
 * <pre>{@code
 *   public class IsEven extends Matcher {
 *     public boolean matches(Object actual) {
 *       return actual instanceof Integer && ((Integer)actual) % 2 == 0;
 *     }
 *
 *     public String description() {
 *       return "an even integer";
 *     }
 *   }
 * }</pre>
 * <p>
 * Matchers are also Hamcrest matchers: {@link #describeTo(Description)} renders the
 * {@link #description()} and {@link #describeMismatch(Object, Description)} renders the
 * {@link #failureMessage(Object)}, so they may be used with {@code org.hamcrest.MatcherAssert}.
 * <p>
 * Implementations must not throw from {@code matches} when given a value of a type they cannot
 * handle; such a value simply does not match.
 */
public abstract class Matcher extends BaseMatcher<Object> {

  /**
   * Checks if {@code actual} satisfies this matcher.
   *
   * @param actual the value to check; may be {@code null}
   * @return {@code true} if {@code actual} matches
   */
  @Override
  public abstract boolean matches(Object actual);

  /**
   * Describes what this matcher expects.  The description depends only on the arguments with
   * which this matcher was constructed.
   *
   * @return the human-readable expectation
   */
  public abstract String description();

  /**
   * Explains why {@code actual} does not match when a match was wanted.
   *
   * @param actual the value that was checked
   * @return the failure message
   */
  public String failureMessage(Object actual) {
    return "expected " + inspect(actual) + " to be " + description();
  }

  /**
   * Explains why {@code actual} matches when a match was not wanted.
   *
   * @param actual the value that was checked
   * @return the negated failure message
   */
  public String negatedFailureMessage(Object actual) {
    return "expected " + inspect(actual) + " not to be " + description();
  }

  /**
   * Combines this matcher with {@code other}; the result matches when both match.
   *
   * @param other the other matcher
   * @return a new {@code And} matcher
   */
  public Matcher and(Matcher other) {
    return new And(this, other);
  }

  /**
   * Combines this matcher with {@code other}; the result matches when either matches.
   *
   * @param other the other matcher
   * @return a new {@code Or} matcher
   */
  public Matcher or(Matcher other) {
    return new Or(this, other);
  }

  @Override
  public void describeTo(Description description) {
    description.appendText(description());
  }

  @Override
  public void describeMismatch(Object item, Description description) {
    description.appendText(failureMessage(item));
  }
}
