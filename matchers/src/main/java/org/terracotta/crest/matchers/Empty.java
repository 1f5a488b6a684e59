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

import java.util.OptionalInt;

import static org.terracotta.crest.matchers.value.Inspector.inspect;

/**
 * Matches text, sequences, collections and maps of size zero.
 */
public class Empty extends Matcher {

  @Override
  public boolean matches(Object actual) {
    OptionalInt size = Values.size(actual);
    return size.isPresent() && size.getAsInt() == 0;
  }

  @Override
  public String description() {
    return "empty";
  }

  @Override
  public String failureMessage(Object actual) {
    OptionalInt size = Values.size(actual);
    if (size.isPresent()) {
      return "expected " + inspect(actual) + " to be empty, but had size " + size.getAsInt();
    } else {
      return "expected " + inspect(actual) + " to be empty, but it has no size";
    }
  }

  @Override
  public String negatedFailureMessage(Object actual) {
    return "expected " + inspect(actual) + " not to be empty, but it was";
  }
}
