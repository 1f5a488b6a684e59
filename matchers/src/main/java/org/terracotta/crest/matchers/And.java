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
 * Matches when both of two matchers match.
 * <p>
 * Both sides are always evaluated so the failure message can report every failing side.
 */
public class And extends Matcher {

  private final Matcher left;
  private final Matcher right;

  public And(Matcher left, Matcher right) {
    this.left = requireNonNull(left, "left");
    this.right = requireNonNull(right, "right");
  }

  @Override
  public boolean matches(Object actual) {
    boolean leftMatches = left.matches(actual);
    boolean rightMatches = right.matches(actual);
    return leftMatches && rightMatches;
  }

  @Override
  public String description() {
    return "(" + left.description() + " and " + right.description() + ")";
  }

  @Override
  public String failureMessage(Object actual) {
    List<String> messages = new ArrayList<>(2);
    if (!left.matches(actual)) {
      messages.add(left.failureMessage(actual));
    }
    if (!right.matches(actual)) {
      messages.add(right.failureMessage(actual));
    }
    return String.join("\n  AND\n", messages);
  }

  @Override
  public String negatedFailureMessage(Object actual) {
    return "expected " + inspect(actual) + " not to match both conditions:\n"
        + "  " + left.description() + "\n"
        + "  " + right.description() + "\n"
        + "but it matched both";
  }
}
