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
 * Matches instances of a type or any of its subtypes, reporting failures over several lines.
 */
public class DescendsFrom extends IsA {

  public DescendsFrom(Class<?> type) {
    super(type);
  }

  @Override
  public String failureMessage(Object actual) {
    return "expected " + inspect(actual) + "\n      to be an instance of " + type.getName()
        + "\nbut was " + typeOf(actual);
  }

  @Override
  public String negatedFailureMessage(Object actual) {
    return "expected " + inspect(actual) + "\n      not to be an instance of " + type.getName()
        + "\nbut it is";
  }
}
