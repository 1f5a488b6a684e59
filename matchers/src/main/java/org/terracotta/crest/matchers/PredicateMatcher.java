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

import java.util.function.Predicate;

import static java.util.Objects.requireNonNull;

/**
 * Matches values accepted by a {@link Predicate}.
 * <p>
 * A predicate that cannot handle the actual value's type and throws {@link ClassCastException}
 * is treated as not matching.
 */
public class PredicateMatcher extends Matcher {

  private final String description;
  private final Predicate<Object> predicate;

  public PredicateMatcher(String description, Predicate<Object> predicate) {
    this.description = requireNonNull(description, "description");
    this.predicate = requireNonNull(predicate, "predicate");
  }

  @Override
  public boolean matches(Object actual) {
    try {
      return predicate.test(actual);
    } catch (ClassCastException e) {
      return false;
    }
  }

  @Override
  public String description() {
    return description;
  }
}
