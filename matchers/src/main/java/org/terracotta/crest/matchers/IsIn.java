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

import com.google.common.collect.BoundType;
import com.google.common.collect.Range;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.terracotta.crest.matchers.value.Shape;
import org.terracotta.crest.matchers.value.Values;

import java.util.Map;
import java.util.OptionalInt;

import static org.terracotta.crest.matchers.value.Inspector.inspect;

/**
 * Matches values that are members of a container.
 * <p>
 * Membership is element membership for sequences and collections, key membership for maps,
 * substring membership for text and interval membership for a {@link Range}.
 */
public class IsIn extends Matcher {

  private final Object container;

  //Membership is checked against the live container
  @SuppressFBWarnings("EI_EXPOSE_REP2")
  public IsIn(Object container) {
    if (!(container instanceof Range) && Shape.of(container) == Shape.SCALAR) {
      throw new MatcherConfigurationException("expected a collection, map, string or range but found " + inspect(container));
    }
    this.container = container;
  }

  @Override
  public boolean matches(Object actual) {
    if (container instanceof Range) {
      return actual instanceof Comparable && inRange((Range<?>)container, actual);
    }
    switch (Shape.of(container)) {
      case SEQUENCE:
      case COLLECTION:
        return Values.containsDeeply(Values.elements(container), actual);
      case MAP:
        return Values.hasKey((Map<?, ?>)container, actual);
      case TEXT:
        return actual instanceof CharSequence && container.toString().contains((CharSequence)actual);
      default:
        return false;
    }
  }

  /*
   * Bounds are checked with Values.compare so numeric ranges admit any Number type.
   */
  private static boolean inRange(Range<?> range, Object actual) {
    if (range.hasLowerBound()) {
      OptionalInt order = Values.compare(actual, range.lowerEndpoint());
      if (!order.isPresent() || order.getAsInt() < 0
          || (order.getAsInt() == 0 && range.lowerBoundType() == BoundType.OPEN)) {
        return false;
      }
    }
    if (range.hasUpperBound()) {
      OptionalInt order = Values.compare(actual, range.upperEndpoint());
      if (!order.isPresent() || order.getAsInt() > 0
          || (order.getAsInt() == 0 && range.upperBoundType() == BoundType.OPEN)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String description() {
    return "in " + containerText();
  }

  @Override
  public String failureMessage(Object actual) {
    return "expected " + inspect(actual) + " to be in " + containerText();
  }

  @Override
  public String negatedFailureMessage(Object actual) {
    return "expected " + inspect(actual) + " not to be in " + containerText() + ", but it was";
  }

  private String containerText() {
    return container instanceof Range ? container.toString() : inspect(container);
  }
}
