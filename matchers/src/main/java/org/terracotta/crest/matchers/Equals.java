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

import org.terracotta.crest.matchers.diff.StructuralDiff;
import org.terracotta.crest.matchers.value.Values;

import java.util.Optional;

import static org.terracotta.crest.matchers.value.Inspector.inspect;

/**
 * Matches values deeply equal to an expected value.
 * <p>
 * When the expected and actual values are both maps, both sequences or both (long) strings the
 * failure message carries a {@link StructuralDiff structural diff}.
 *
 * @see Values#deepEquals(Object, Object)
 */
public class Equals extends Matcher {

  private final Object expected;

  public Equals(Object expected) {
    this.expected = expected;
  }

  @Override
  public boolean matches(Object actual) {
    return Values.deepEquals(actual, expected);
  }

  @Override
  public String description() {
    return "equal to " + inspect(expected);
  }

  @Override
  public String failureMessage(Object actual) {
    String message = "expected " + inspect(actual) + "\n      to equal " + inspect(expected);
    Optional<String> diff = StructuralDiff.render(expected, actual);
    return diff.map(d -> message + "\n\n" + d).orElse(message);
  }

  @Override
  public String negatedFailureMessage(Object actual) {
    return "expected " + inspect(actual) + "\n  not to equal " + inspect(expected) + ", but they are equal";
  }
}
