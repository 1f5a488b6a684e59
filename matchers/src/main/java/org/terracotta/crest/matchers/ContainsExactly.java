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

import org.terracotta.crest.matchers.value.Shape;
import org.terracotta.crest.matchers.value.Values;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.terracotta.crest.matchers.value.Inspector.inspect;

/**
 * Matches sequences and collections holding exactly the given items in the given order.
 *
 * @see Contains
 */
public class ContainsExactly extends Matcher {

  private final List<Object> items;

  public ContainsExactly(Object... items) {
    this.items = Collections.unmodifiableList(new ArrayList<>(Arrays.asList(items)));
  }

  @Override
  public boolean matches(Object actual) {
    return Shape.of(actual).isIterable() && Values.deepEquals(Values.elements(actual), items);
  }

  @Override
  public String description() {
    return "contains exactly " + inspect(items) + " (in order)";
  }

  @Override
  public String failureMessage(Object actual) {
    StringBuilder message = new StringBuilder("expected ").append(inspect(actual))
        .append(" to contain exactly ").append(inspect(items)).append(" (in order)");
    if (!Shape.of(actual).isIterable()) {
      return message.append("\nbut it is not a collection").toString();
    }

    List<Object> elements = Values.elements(actual);
    if (elements.size() != items.size()) {
      message.append("\nexpected size ").append(items.size()).append(", got ").append(elements.size());
    } else {
      for (int i = 0; i < items.size(); i++) {
        if (!Values.deepEquals(items.get(i), elements.get(i))) {
          message.append("\nat index ").append(i).append(": expected ").append(inspect(items.get(i)))
              .append(", got ").append(inspect(elements.get(i)));
        }
      }
    }
    return message.toString();
  }

  @Override
  public String negatedFailureMessage(Object actual) {
    return "expected " + inspect(actual) + " not to contain exactly " + inspect(items) + " (in order), but it did";
  }
}
