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
import static org.terracotta.crest.matchers.value.Inspector.inspect;

/**
 * Matches values whose runtime class is exactly a given type; subtypes do not match.
 */
public class InstanceOf extends Matcher {

  private final Class<?> type;

  public InstanceOf(Class<?> type) {
    this.type = requireNonNull(type, "type");
  }

  @Override
  public boolean matches(Object actual) {
    return actual != null && actual.getClass() == type;
  }

  @Override
  public String description() {
    return "an instance of exactly " + type.getName();
  }

  @Override
  public String failureMessage(Object actual) {
    return "expected " + inspect(actual) + " to be an instance of exactly " + type.getName()
        + ", but was " + IsA.typeOf(actual);
  }

  @Override
  public String negatedFailureMessage(Object actual) {
    return "expected " + inspect(actual) + " not to be an instance of exactly " + type.getName() + ", but it is";
  }
}
