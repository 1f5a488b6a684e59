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
import java.math.BigInteger;
import java.time.LocalDate;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.terracotta.crest.matchers.Matchers.between;
import static org.terracotta.crest.matchers.Matchers.closeTo;
import static org.terracotta.crest.matchers.Matchers.greaterThan;
import static org.terracotta.crest.matchers.Matchers.greaterThanOrEqualTo;
import static org.terracotta.crest.matchers.Matchers.isIn;
import static org.terracotta.crest.matchers.Matchers.lessThan;
import static org.terracotta.crest.matchers.Matchers.lessThanOrEqualTo;

public class ComparisonMatchersTest {

  @Test
  public void testBoundaries() {
    assertTrue(greaterThan(5).matches(6));
    assertFalse(greaterThan(5).matches(5));
    assertTrue(greaterThanOrEqualTo(5).matches(5));
    assertFalse(greaterThanOrEqualTo(5).matches(4));
    assertTrue(lessThan(5).matches(4));
    assertFalse(lessThan(5).matches(5));
    assertTrue(lessThanOrEqualTo(5).matches(5));
    assertFalse(lessThanOrEqualTo(5).matches(6));
  }

  @Test
  public void testMixedNumberTypes() {
    assertTrue(greaterThan(5).matches(5.5d));
    assertTrue(lessThan(new BigDecimal("2.5")).matches(2L));
    assertTrue(greaterThan(BigInteger.TEN).matches(10.01f));
    assertTrue(greaterThanOrEqualTo(0.1d).matches(new BigDecimal("0.1")));
  }

  @Test
  public void testComparables() {
    assertTrue(greaterThan("apple").matches("banana"));
    assertTrue(lessThan(LocalDate.of(2020, 1, 1)).matches(LocalDate.of(2019, 12, 31)));
  }

  @Test
  public void testIncomparableValuesDoNotMatch() {
    assertFalse(greaterThan(5).matches("6"));
    assertFalse(lessThan("z").matches(1));
    assertFalse(greaterThan(5).matches(null));
    assertFalse(lessThan(5).matches(new Object()));
    assertFalse(greaterThan(0).matches(Double.NaN));
  }

  @Test
  public void testMessages() {
    assertEquals("greater than 5", greaterThan(5).description());
    assertEquals("expected 3 to be greater than or equal to 5", greaterThanOrEqualTo(5).failureMessage(3));
    assertEquals("expected 3 not to be less than 5, but it was", lessThan(5).negatedFailureMessage(3));
    assertEquals("expected \"b\" to be less than or equal to \"a\"", lessThanOrEqualTo("a").failureMessage("b"));
  }

  @Test(expected = MatcherConfigurationException.class)
  public void testNullBound() {
    greaterThan(null);
  }

  @Test
  public void testBetweenInclusive() {
    assertTrue(between(1, 10).matches(1));
    assertTrue(between(1, 10).matches(10));
    assertTrue(between(1, 10).matches(5.5));
    assertFalse(between(1, 10).matches(0));
    assertFalse(between(1, 10).matches("5"));
    assertEquals("between 1 and 10 (inclusively)", between(1, 10).description());
    assertEquals("expected 11 to be between 1 and 10 (inclusively)", between(1, 10).failureMessage(11));
  }

  @Test
  public void testBetweenExclusive() {
    assertFalse(between(1, 10, true).matches(1));
    assertFalse(between(1, 10, true).matches(10));
    assertTrue(between(1, 10, true).matches(2));
    assertEquals("expected 5 not to be between 1 and 10 (exclusively), but it was",
        between(1, 10, true).negatedFailureMessage(5));
  }

  @Test
  public void testCloseToBoundaryIsInclusive() {
    Matcher closeTo = closeTo(10.0, 1.0);
    assertTrue(closeTo.matches(9.0));
    assertTrue(closeTo.matches(11.0));
    assertTrue(closeTo.matches(10));
    assertFalse(closeTo.matches(8.9));
    assertFalse(closeTo.matches(11.01));
  }

  @Test
  public void testCloseToIgnoresNonNumbers() {
    Matcher closeTo = closeTo(10.0, 1.0);
    assertFalse(closeTo.matches("10"));
    assertFalse(closeTo.matches(null));
    assertFalse(closeTo.matches(Double.NaN));
    assertFalse(closeTo.matches(Double.POSITIVE_INFINITY));
  }

  @Test
  public void testCloseToMessages() {
    assertEquals("close to 10.0 (within 1.0)", closeTo(10.0, 1.0).description());
    assertEquals("expected 8.9 to be close to 10.0 (within 1.0), but difference was 1.1",
        closeTo(10.0, 1.0).failureMessage(8.9));
    assertEquals("expected 1.0 to be close to 0.1 (within 0.5), but difference was 0.9",
        closeTo(0.1, 0.5).failureMessage(1.0));
    assertEquals("expected 9.5 not to be close to 10.0 (within 1.0), but it was",
        closeTo(10.0, 1.0).negatedFailureMessage(9.5));
  }

  @Test(expected = MatcherConfigurationException.class)
  public void testCloseToNegativeDelta() {
    closeTo(1, -0.1);
  }

  @Test
  public void testIsInRange() {
    assertTrue(isIn(Range.closed(1, 5)).matches(5));
    assertFalse(isIn(Range.closedOpen(1, 5)).matches(5));
    assertFalse(isIn(Range.closed(1, 5)).matches("3"));
    assertFalse(isIn(Range.closed(1, 5)).matches(null));
    assertEquals("in [1..5]", isIn(Range.closed(1, 5)).description());
  }
}
