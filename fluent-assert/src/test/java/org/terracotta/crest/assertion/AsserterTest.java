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
package org.terracotta.crest.assertion;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.Test;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.terracotta.crest.assertion.Assertions.assertThat;
import static org.terracotta.crest.matchers.Matchers.anything;
import static org.terracotta.crest.matchers.Matchers.equalTo;
import static org.terracotta.crest.matchers.Matchers.greaterThan;
import static org.terracotta.crest.matchers.Matchers.hasSize;
import static org.terracotta.crest.matchers.Matchers.includes;
import static org.terracotta.crest.matchers.Matchers.lessThan;
import static org.terracotta.crest.matchers.Matchers.nilValue;

public class AsserterTest {

  static String failureOf(Runnable assertion) {
    try {
      assertion.run();
    } catch (AssertionError e) {
      return e.getMessage();
    }
    throw new AssertionError("Expecting assertion to fail");
  }

  @Test
  public void testMatchesChains() {
    Asserter asserter = assertThat(5);
    assertSame(asserter, asserter.matches(greaterThan(3)).matches(lessThan(10)));
  }

  @Test
  public void testMatchFailure() {
    assertEquals("expected 2 to be greater than 3", failureOf(() -> assertThat(2).matches(greaterThan(3))));
  }

  @Test
  public void testChainStopsAtFirstFailure() {
    assertEquals("expected 12 to be less than 10",
        failureOf(() -> assertThat(12).matches(greaterThan(3)).matches(lessThan(10)).matches(equalTo(12))));
  }

  @Test
  public void testReasonPrefixesFailure() {
    assertEquals("total: expected 2 to be greater than 3",
        failureOf(() -> assertThat("total", 2).matches(greaterThan(3))));
  }

  @Test
  public void testIsEqualTo() {
    assertThat(Arrays.asList(1, 2, 3)).isEqualTo(Arrays.asList(1, 2, 3));
    assertThat(1).isEqualTo(1L);
  }

  @Test
  public void testIsEqualToReportsDiff() {
    assertEquals("expected [1, 2, 3]\n"
            + "      to equal [1, 2, 4]\n"
            + "\n"
            + "Diff:\n"
            + "  [2]:\n"
            + "    expected: 4\n"
            + "    actual:   3",
        failureOf(() -> assertThat(Arrays.asList(1, 2, 3)).isEqualTo(Arrays.asList(1, 2, 4))));
  }

  @Test
  public void testIsEqualToMapDiff() {
    Map<String, Object> expected = new HashMap<>();
    expected.put("a", 1);
    Map<String, Object> actual = new HashMap<>();
    actual.put("a", 2);
    assertEquals("expected {\"a\": 2}\n"
            + "      to equal {\"a\": 1}\n"
            + "\n"
            + "Diff:\n"
            + "  key \"a\":\n"
            + "    expected: 1\n"
            + "    actual:   2",
        failureOf(() -> assertThat(actual).isEqualTo(expected)));
  }

  @Test
  public void testIsIdentity() {
    Object value = new Object();
    assertThat(value).is(value);

    String message = failureOf(() -> assertThat(new StringBuilder("a").toString()).is("a"));
    assertTrue(message, message.startsWith("expected \"a\" (identity: 0x"));
    assertTrue(message, message.contains(" to be the same object as \"a\" (identity: 0x"));
  }

  @Test
  public void testIsDelegatesToMatcher() {
    assertThat(Arrays.asList(1, 2)).is(hasSize(2));
    assertEquals("expected [1] to have size 2, but had size 1", failureOf(() -> assertThat(Arrays.asList(1)).is(hasSize(2))));
  }

  @Test
  public void testNever() {
    assertThat(4).never(equalTo(3));
    assertEquals("expected 3\n  not to equal 3, but they are equal", failureOf(() -> assertThat(3).never(equalTo(3))));
  }

  @Test
  public void testHamcrestMatcher() {
    assertThat("hello").matches(org.hamcrest.Matchers.startsWith("he"));
    assertEquals("expected \"hello\" to be a string starting with \"x\"\nbut was \"hello\"",
        failureOf(() -> assertThat("hello").matches(org.hamcrest.Matchers.startsWith("x"))));
  }

  @Test
  public void testNullBlockIsNullValue() {
    assertThat((Block)null).matches(nilValue());
    assertThat("reason", (Block)null).matches(nilValue());
  }

  @Test
  public void testValueOperationOnBlock() {
    try {
      assertThat(() -> { }).matches(anything());
      throw new AssertionError("Expecting IllegalStateException");
    } catch (IllegalStateException e) {
      assertEquals("matches requires a value, but this assertion is bound to a block", e.getMessage());
    }
  }

  @Test
  public void testBlockOperationOnValue() {
    try {
      assertThat(5).raisesNothing();
      throw new AssertionError("Expecting IllegalStateException");
    } catch (IllegalStateException e) {
      assertEquals("raisesNothing requires a block, but this assertion is bound to 5", e.getMessage());
    }
    try {
      assertThat("x").raisesError();
      throw new AssertionError("Expecting IllegalStateException");
    } catch (IllegalStateException e) {
      assertEquals("raisesError requires a block, but this assertion is bound to \"x\"", e.getMessage());
    }
  }

  @Test
  public void testFailureIsLogged() {
    Logger logger = (Logger)LoggerFactory.getLogger(Asserter.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.setContext((LoggerContext)LoggerFactory.getILoggerFactory());
    appender.start();
    logger.addAppender(appender);
    try {
      failureOf(() -> assertThat("list", Arrays.asList(1)).matches(includes(2)));
      assertEquals(1, appender.list.size());
      assertEquals("Assertion failed: list: expected [1] to include 2\nmissing: 2",
          appender.list.get(0).getFormattedMessage());
    } finally {
      logger.detachAppender(appender);
      appender.stop();
    }
  }
}
