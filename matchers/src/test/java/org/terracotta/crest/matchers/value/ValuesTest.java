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

import org.junit.Test;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ValuesTest {

  @Test
  public void testShapes() {
    assertThat(Shape.of("abc"), is(Shape.TEXT));
    assertThat(Shape.of(new StringBuilder("abc")), is(Shape.TEXT));
    assertThat(Shape.of(Arrays.asList(1, 2)), is(Shape.SEQUENCE));
    assertThat(Shape.of(new int[] { 1 }), is(Shape.SEQUENCE));
    assertThat(Shape.of(new HashSet<>(Arrays.asList(1, 2))), is(Shape.COLLECTION));
    assertThat(Shape.of(new ArrayDeque<>()), is(Shape.COLLECTION));
    assertThat(Shape.of(Collections.emptyMap()), is(Shape.MAP));
    assertThat(Shape.of(42), is(Shape.SCALAR));
    assertThat(Shape.of(null), is(Shape.SCALAR));
  }

  @Test
  public void testDeepEqualsAcrossSequenceKinds() {
    assertTrue(Values.deepEquals(Arrays.asList(1, 2, 3), new Integer[] { 1, 2, 3 }));
    assertTrue(Values.deepEquals(new int[] { 1, 2 }, new int[] { 1, 2 }));
    assertFalse(Values.deepEquals(Arrays.asList(1, 2), Arrays.asList(2, 1)));
  }

  @Test
  public void testDeepEqualsNested() {
    Map<String, Object> a = new LinkedHashMap<>();
    a.put("list", new int[] { 1, 2 });
    Map<String, Object> b = new LinkedHashMap<>();
    b.put("list", Arrays.asList(1, 2));
    assertTrue(Values.deepEquals(a, b));
  }

  @Test
  public void testNullAndFalseAreDistinct() {
    assertTrue(Values.deepEquals(null, null));
    assertFalse(Values.deepEquals(null, Boolean.FALSE));
    assertFalse(Values.deepEquals(Boolean.FALSE, null));
  }

  @Test
  public void testElementsOfArray() {
    assertThat(Values.elements(new long[] { 3L, 4L }), is(Arrays.<Object>asList(3L, 4L)));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testElementsOfScalar() {
    Values.elements(42);
  }

  @Test
  public void testSize() {
    assertThat(Values.size("four").getAsInt(), is(4));
    assertThat(Values.size(new Object[3]).getAsInt(), is(3));
    assertThat(Values.size(Collections.singletonMap("a", 1)).getAsInt(), is(1));
    assertFalse(Values.size(42).isPresent());
    assertFalse(Values.size(null).isPresent());
  }

  @Test
  public void testCompareMixedNumbers() {
    assertThat(Values.compare(1, 1.5d).getAsInt(), lessThan(0));
    assertThat(Values.compare(2L, new BigDecimal("1.99")).getAsInt(), greaterThan(0));
    assertThat(Values.compare(0.1d, new BigDecimal("0.1")).getAsInt(), is(0));
  }

  @Test
  public void testCompareIncomparable() {
    assertFalse(Values.compare("a", 1).isPresent());
    assertFalse(Values.compare(new Object(), new Object()).isPresent());
    assertFalse(Values.compare(Double.NaN, 1).isPresent());
    assertFalse(Values.compare(null, 1).isPresent());
  }

  @Test
  public void testTruthiness() {
    assertFalse(Values.isTruthy(null));
    assertFalse(Values.isTruthy(false));
    assertTrue(Values.isTruthy(0));
    assertTrue(Values.isTruthy(""));
    assertTrue(Values.isTruthy(true));
  }

  @Test
  public void testHasKeyOnSortedMap() {
    Map<String, Integer> sorted = new TreeMap<>();
    sorted.put("a", 1);
    assertTrue(Values.hasKey(sorted, "a"));
    assertFalse(Values.hasKey(sorted, 1));
    assertFalse(Values.hasKey(sorted, null));
  }

  @Test
  public void testDeepEqualsSortedMapIsSymmetric() {
    Map<String, Integer> sorted = new TreeMap<>();
    sorted.put("a", 1);
    Map<Object, Integer> numberKey = new HashMap<>();
    numberKey.put(1, 1);
    Map<Object, Integer> nullKey = new HashMap<>();
    nullKey.put(null, 1);

    assertFalse(Values.deepEquals(sorted, numberKey));
    assertFalse(Values.deepEquals(numberKey, sorted));
    assertFalse(Values.deepEquals(sorted, nullKey));
    assertFalse(Values.deepEquals(nullKey, sorted));
  }
}
