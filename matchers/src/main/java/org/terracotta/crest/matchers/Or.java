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
import java.util.List;

import static java.util.Objects.requireNonNull;
import static org.terracotta.crest.matchers.value.Inspector.inspect;

/**
 * Matches when at least one of two matchers matches.
 */
public class Or extends Matcher {

  private final Matcher left;
  private final Matcher right;

  public Or(Matcher left, Matcher right) {
    this.left = requireNonNull(left, "left");
    this.right = requireNonNull(right, "right");
  }

  @Override
  public boolean matches(Object actual) {
    return left.matches(actual) || right.matches(actual);
  }

  @Override
  public String description() {
    return "(" + left.description() + " or " + right.description() + ")";
  }

  @Override
  public String failureMessage(Object actual) {
    return "expected " + inspect(actual) + " to match at least one of:\n"
        + "  " + left.description() + "\n"
        + "  " + right.description() + "\n"
        + "but it matched neither:\n"
        + "  " + left.failureMessage(actual) + "\n"
        + "  " + right.failureMessage(actual);
  }

  /**
   * {@inheritDoc}
   * <p>
   * Only the side(s) that matched are listed.
   */
  @Override
  public String negatedFailureMessage(Object actual) {
    List<String> matched = new ArrayList<>(2);
    if (left.matches(actual)) {
      matched.add(left.description());
    }
    if (right.matches(actual)) {
      matched.add(right.description());
    }
    return "expected " + inspect(actual) + " not to match either condition, but it matched:\n"
        + "  " + String.join("\n  ", matched);
  }
}
