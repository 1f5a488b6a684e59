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
package org.terracotta.crest.matchers.value;

import java.util.List;
import java.util.Map;

/**
 * The closed set of value shapes on which shape-polymorphic matchers dispatch.
 * <p>
 * Matchers such as {@code includes} or {@code contains} behave differently for text, sequences
 * and maps.  Rather than probing the actual value for capabilities, each matcher classifies the
 * value with {@link #of(Object)} and handles the shapes it supports; every other shape is
 * "not applicable" and results in a failed match.
 */
public enum Shape {
  /**
   * A {@link CharSequence}.
   */
  TEXT,
  /**
   * An ordered, indexable sequence: a {@link List} or an array (object or primitive).
   */
  SEQUENCE,
  /**
   * Any other {@link Iterable} (sets, queues, ...); iteration order carries no meaning.
   */
  COLLECTION,
  /**
   * A {@link Map}.
   */
  MAP,
  /**
   * Anything else, including {@code null}.
   */
  SCALAR;

  /**
   * Classifies {@code value}.
   *
   * @param value the value to classify; may be {@code null}
   * @return the shape of {@code value}
   */
  public static Shape of(Object value) {
    if (value instanceof CharSequence) {
      return TEXT;
    } else if (value instanceof List || (value != null && value.getClass().isArray())) {
      return SEQUENCE;
    } else if (value instanceof Map) {
      return MAP;
    } else if (value instanceof Iterable) {
      return COLLECTION;
    } else {
      return SCALAR;
    }
  }

  /**
   * Indicates whether values of this shape hold elements that may be iterated.
   *
   * @return {@code true} for {@link #SEQUENCE} and {@link #COLLECTION}
   */
  public boolean isIterable() {
    return this == SEQUENCE || this == COLLECTION;
  }

  /**
   * Indicates whether values of this shape have a size.
   *
   * @return {@code true} for every shape except {@link #SCALAR}
   */
  public boolean isSized() {
    return this != SCALAR;
  }
}
