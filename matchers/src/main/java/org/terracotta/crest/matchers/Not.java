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

import static java.util.Objects.requireNonNull;

/**
 * Negates another matcher.
 * <p>
 * A failure of this matcher means the wrapped matcher unexpectedly matched, so the failure
 * messages of the two are swapped.  Negations nest freely: {@code never(never(m))} behaves
 * exactly like {@code m}.
 */
public class Not extends Matcher {

  private final Matcher matcher;

  public Not(Matcher matcher) {
    this.matcher = requireNonNull(matcher, "matcher");
  }

  @Override
  public boolean matches(Object actual) {
    return !matcher.matches(actual);
  }

  @Override
  public String description() {
    return "not " + matcher.description();
  }

  @Override
  public String failureMessage(Object actual) {
    return matcher.negatedFailureMessage(actual);
  }

  @Override
  public String negatedFailureMessage(Object actual) {
    return matcher.failureMessage(actual);
  }
}
