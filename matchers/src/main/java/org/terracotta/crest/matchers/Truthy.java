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

import static org.terracotta.crest.matchers.value.Inspector.inspect;

/**
 * Matches every value other than {@code null} and {@link Boolean#FALSE}.
 */
public class Truthy extends Matcher {

  @Override
  public boolean matches(Object actual) {
    return Values.isTruthy(actual);
  }

  @Override
  public String description() {
    return "truthy";
  }

  @Override
  public String failureMessage(Object actual) {
    return "expected " + inspect(actual) + " to be truthy";
  }

  @Override
  public String negatedFailureMessage(Object actual) {
    return "expected " + inspect(actual) + " not to be truthy, but it was";
  }
}
