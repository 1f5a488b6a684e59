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

import static org.terracotta.crest.matchers.value.Inspector.inspect;

/**
 * Matches when every one of a list of matchers matches.  An empty list matches everything.
 */
public class AllOf extends MatcherList {

  public AllOf(Object... matchers) {
    super(matchers);
  }

  @Override
  public boolean matches(Object actual) {
    return matchers.stream().allMatch(m -> m.matches(actual));
  }

  @Override
  public String description() {
    return "all of: " + descriptions(", ");
  }

  @Override
  public String failureMessage(Object actual) {
    return "expected " + inspect(actual) + " to match all of:\n"
        + "  " + descriptions("\n  ") + "\n"
        + "but failed:\n"
        + "  " + join(failing(actual), m -> m.failureMessage(actual), "\n  ");
  }

  @Override
  public String negatedFailureMessage(Object actual) {
    return "expected " + inspect(actual) + " not to match all conditions, but it matched all:\n"
        + "  " + descriptions("\n  ");
  }
}
