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

import org.junit.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.terracotta.crest.matchers.Matchers.equalTo;

public class EqualsTest {

  @Test
  public void testReflexiveAndSymmetric() {
    Object[] values = { 1, "a", null, Arrays.asList(1, 2), new int[] { 1, 2 }, Boolean.FALSE };
    for (Object a : values) {
      assertTrue(equalTo(a).matches(a));
      for (Object b : values) {
        assertEquals(equalTo(a).matches(b), equalTo(b).matches(a));
      }
    }
  }

  @Test
  public void testNullIsNotFalse() {
    assertFalse(equalTo(null).matches(false));
    assertFalse(equalTo(false).matches(null));
  }

  @Test
  public void testDescription() {
    assertEquals("equal to [1, 2]", equalTo(Arrays.asList(1, 2)).description());
  }

  @Test
  public void testScalarFailureMessageHasNoDiff() {
    assertEquals("expected 1\n      to equal 2", equalTo(2).failureMessage(1));
  }

  @Test
  public void testShortStringFailureMessageHasNoDiff() {
    assertEquals("expected \"abc\"\n      to equal \"abd\"", equalTo("abd").failureMessage("abc"));
  }

  @Test
  public void testMapFailureMessageCarriesDiff() {
    Map<String, Integer> expected = new LinkedHashMap<>();
    expected.put("a", 1);
    expected.put("b", 2);
    Map<String, Integer> actual = new LinkedHashMap<>();
    actual.put("a", 1);
    actual.put("b", 3);

    assertEquals("expected {\"a\": 1, \"b\": 3}\n"
        + "      to equal {\"a\": 1, \"b\": 2}\n"
        + "\n"
        + "Diff:\n"
        + "  key \"b\":\n"
        + "    expected: 2\n"
        + "    actual:   3", equalTo(expected).failureMessage(actual));
  }

  @Test
  public void testMixedShapesHaveNoDiff() {
    assertThat(equalTo(Arrays.asList(1)).failureMessage("[1]"), not(containsString("Diff:")));
  }

  @Test
  public void testNegatedFailureMessage() {
    assertEquals("expected 5\n  not to equal 5, but they are equal", equalTo(5).negatedFailureMessage(5));
  }

  @Test
  public void testSortedMapAgainstIncompatibleKeys() {
    Map<String, Integer> sorted = new TreeMap<>();
    sorted.put("a", 1);
    Map<Object, Integer> numberKey = new HashMap<>();
    numberKey.put(1, 1);

    assertFalse(equalTo(sorted).matches(numberKey));
    assertFalse(equalTo(numberKey).matches(sorted));
    assertThat(equalTo(sorted).failureMessage(numberKey), containsString("extra key: 1 => 1"));
    assertThat(equalTo(numberKey).failureMessage(sorted), containsString("missing key: 1 => 1"));
  }
}
