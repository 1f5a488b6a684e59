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

import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.matchesPattern;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.terracotta.crest.matchers.Matchers.equalTo;
import static org.terracotta.crest.matchers.Matchers.is;

public class IsTest {

  @Test
  public void testIdentity() {
    List<String> list = new ArrayList<>();
    assertTrue(is(list).matches(list));
    assertFalse(is(list).matches(new ArrayList<>()));
    assertTrue(is(null).matches(null));
  }

  @Test
  public void testMessagesCarryIdentityTokens() {
    List<String> expected = new ArrayList<>();
    String message = is(expected).failureMessage(new ArrayList<>());
    assertThat(message, matchesPattern(
        "expected \\[\\] \\(identity: 0x[0-9a-f]{8}\\) to be the same object as \\[\\] \\(identity: 0x[0-9a-f]{8}\\)"));

    assertThat(is(expected).description(), containsString("the same object as [] (identity: 0x"));
    assertThat(is(expected).negatedFailureMessage(expected), containsString(", but they are the same object"));
  }

  @Test
  public void testDelegatesToMatcher() {
    Matcher inner = equalTo(3);
    Matcher delegating = is(inner);
    assertTrue(delegating.matches(3));
    assertFalse(delegating.matches(4));
    assertEquals(inner.description(), delegating.description());
    assertEquals(inner.failureMessage(4), delegating.failureMessage(4));
    assertEquals(inner.negatedFailureMessage(3), delegating.negatedFailureMessage(3));
  }
}
