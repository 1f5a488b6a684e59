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

import com.google.common.collect.Range;
import org.junit.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.terracotta.crest.matchers.Matchers.isIn;

public class IsInTest {

  @Test
  public void testSequencesAndCollections() {
    assertTrue(isIn(Arrays.asList(1, 2, 3)).matches(2));
    assertTrue(isIn(new String[] { "a", "b" }).matches("b"));
    assertTrue(isIn(new HashSet<>(Arrays.asList('x', 'y'))).matches('x'));
    assertFalse(isIn(Arrays.asList(1, 2, 3)).matches(4));
    assertFalse(isIn(Collections.emptyList()).matches(null));
  }

  @Test
  public void testMapKeys() {
    assertTrue(isIn(Collections.singletonMap("k", "v")).matches("k"));
    assertFalse(isIn(Collections.singletonMap("k", "v")).matches("v"));
  }

  @Test
  public void testText() {
    assertTrue(isIn("hello world").matches("lo w"));
    assertFalse(isIn("hello world").matches("xyz"));
    assertFalse(isIn("123").matches(2));
  }

  @Test
  public void testMessages() {
    assertEquals("in [1, 2]", isIn(Arrays.asList(1, 2)).description());
    assertEquals("expected 3 to be in [1, 2]", isIn(Arrays.asList(1, 2)).failureMessage(3));
    assertEquals("expected 1 not to be in [1, 2], but it was", isIn(Arrays.asList(1, 2)).negatedFailureMessage(1));
  }

  @Test(expected = MatcherConfigurationException.class)
  public void testScalarContainer() {
    isIn(42);
  }

  @Test
  public void testSortedMapKeys() {
    Map<String, Integer> sorted = new TreeMap<>();
    sorted.put("a", 1);
    assertTrue(isIn(sorted).matches("a"));
    assertFalse(isIn(sorted).matches(5));
    assertFalse(isIn(sorted).matches(null));
  }

  @Test
  public void testNumericRangeAcceptsAnyNumberType() {
    assertTrue(isIn(Range.closed(1, 10)).matches(5L));
    assertTrue(isIn(Range.closed(1, 10)).matches(10.0));
    assertFalse(isIn(Range.closed(1, 10)).matches(10.5));
    assertFalse(isIn(Range.open(1, 10)).matches(1L));
    assertTrue(isIn(Range.atLeast(1)).matches(new BigDecimal("1.5")));
    assertFalse(isIn(Range.closed(1, 10)).matches("x"));
    assertFalse(isIn(Range.closed(1, 10)).matches(null));
  }
}
