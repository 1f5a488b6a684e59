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
import java.util.regex.Pattern;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.terracotta.crest.matchers.Matchers.blank;
import static org.terracotta.crest.matchers.Matchers.endsWith;
import static org.terracotta.crest.matchers.Matchers.matchesPattern;
import static org.terracotta.crest.matchers.Matchers.startsWith;

public class TextMatchersTest {

  @Test
  public void testStartsWith() {
    assertTrue(startsWith("foo").matches("foobar"));
    assertTrue(startsWith("foo").matches(new StringBuilder("foobar")));
    assertFalse(startsWith("bar").matches("foobar"));
    assertTrue(startsWith("").matches("anything"));
    assertFalse(startsWith("1").matches(123));
    assertFalse(startsWith("f").matches(null));
    assertFalse(startsWith("a").matches(Arrays.asList("a")));
  }

  @Test
  public void testStartsWithMessages() {
    assertEquals("a string start with \"foo\"", startsWith("foo").description());
    assertEquals("expected \"bar\"\n      to start with \"foo\"", startsWith("foo").failureMessage("bar"));
    assertEquals("expected \"foo\"\n      not to start with \"foo\"\nbut it does", startsWith("foo").negatedFailureMessage("foo"));
  }

  @Test
  public void testEndsWith() {
    assertTrue(endsWith("bar").matches("foobar"));
    assertFalse(endsWith("foo").matches("foobar"));
    assertTrue(endsWith("").matches(""));
    assertFalse(endsWith("x").matches('x'));
    assertEquals("expected \"foo\"\n      to end with \"bar\"", endsWith("bar").failureMessage("foo"));
  }

  @Test
  public void testMatchesPatternFindsAnywhere() {
    assertTrue(matchesPattern("\\d+").matches("abc123def"));
    assertFalse(matchesPattern("^\\d+$").matches("abc123def"));
    assertTrue(matchesPattern(Pattern.compile("B", Pattern.CASE_INSENSITIVE)).matches("abc"));
    assertFalse(matchesPattern("1").matches(1));
  }

  @Test
  public void testMatchesPatternMessages() {
    assertEquals("a string matching /\\d+/", matchesPattern("\\d+").description());
    assertEquals("expected \"abc\"\n      to match pattern /\\d+/", matchesPattern("\\d+").failureMessage("abc"));
    assertEquals("expected \"1\"\n      not to match pattern /\\d+/\nbut it does", matchesPattern("\\d+").negatedFailureMessage("1"));
  }

  @Test(expected = MatcherConfigurationException.class)
  public void testInvalidPattern() {
    matchesPattern("(unclosed");
  }

  @Test
  public void testBlank() {
    assertTrue(blank().matches(""));
    assertTrue(blank().matches(" \t\n"));
    assertFalse(blank().matches(" x "));
    assertFalse(blank().matches(null));
    assertFalse(blank().matches(Arrays.asList()));
    assertEquals("expected \"x\"\n      to be blank", blank().failureMessage("x"));
    assertEquals("expected \"\"\n      not to be blank\nbut it is", blank().negatedFailureMessage(""));
  }
}
