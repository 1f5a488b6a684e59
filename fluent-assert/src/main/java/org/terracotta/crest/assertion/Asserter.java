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

import org.junit.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.terracotta.crest.matchers.Equals;
import org.terracotta.crest.matchers.HamcrestAdapter;
import org.terracotta.crest.matchers.Is;
import org.terracotta.crest.matchers.Matcher;
import org.terracotta.crest.matchers.Not;

import static java.util.Objects.requireNonNull;
import static org.terracotta.crest.matchers.value.Inspector.inspect;

/**
 * Applies matchers to a value, or observes the errors raised by a {@link Block}, failing through
 * {@link Assert#fail(String)} with the matcher's message.
 * <p>
 * An {@code Asserter} is bound either to a value or to a block.  The value operations
 * ({@code matches}, {@code isEqualTo}, {@code is}, {@code never}) and the block operations
 * ({@code raisesError}, {@code raisesNothing}) are not interchangeable; calling one kind on the
 * other binding throws {@link IllegalStateException}.
 * <p>
 * Value operations return this {@code Asserter} so expectations may be chained;
 * {@code raisesError} returns an {@code Asserter} bound to the raised error.
 */
public final class Asserter {
  private static final Logger LOGGER = LoggerFactory.getLogger(Asserter.class);

  private final String reason;
  private final Object actual;
  private final Block block;

  private Asserter(String reason, Object actual, Block block) {
    this.reason = reason;
    this.actual = actual;
    this.block = block;
  }

  static Asserter forValue(String reason, Object actual) {
    return new Asserter(reason, actual, null);
  }

  static Asserter forBlock(String reason, Block block) {
    return new Asserter(reason, null, requireNonNull(block, "block"));
  }

  /**
   * Asserts the bound value satisfies {@code matcher}.
   *
   * @param matcher the matcher to apply
   * @return this {@code Asserter}
   * @throws AssertionError if the value does not match
   * @throws IllegalStateException if this {@code Asserter} is bound to a block
   */
  public Asserter matches(Matcher matcher) {
    requireNonNull(matcher, "matcher");
    requireValue("matches");
    if (!matcher.matches(actual)) {
      fail(matcher.failureMessage(actual));
    }
    return this;
  }

  /**
   * Asserts the bound value satisfies a Hamcrest {@code matcher}.
   *
   * @param matcher the Hamcrest matcher to apply
   * @return this {@code Asserter}
   */
  public Asserter matches(org.hamcrest.Matcher<?> matcher) {
    return matches(new HamcrestAdapter(matcher));
  }

  public Asserter isEqualTo(Object expected) {
    return matches(new Equals(expected));
  }

  public Asserter is(Object expected) {
    return matches(new Is(expected));
  }

  /**
   * Asserts the bound value does not satisfy {@code matcher}.
   *
   * @param matcher the matcher that must not match
   * @return this {@code Asserter}
   */
  public Asserter never(Matcher matcher) {
    return matches(new Not(matcher));
  }

  /**
   * Asserts the bound block raises an {@link Exception}.
   *
   * @return an {@code Asserter} bound to the raised exception
   * @see #raisesError(Class, Matcher)
   */
  public Asserter raisesError() {
    return raisesError(null, null);
  }

  public Asserter raisesError(Class<? extends Throwable> type) {
    return raisesError(type, null);
  }

  /**
   * Asserts the bound block raises an instance of {@code type} whose message satisfies
   * {@code messageMatcher}.
   * <p>
   * {@link Error}s raised by the block, {@link AssertionError} included, propagate untouched
   * unless {@code type} is an {@code Error} type, or {@code Throwable}, they are an instance of.
   * When no type is given any {@link Exception} is accepted.
   *
   * @param type the expected type, subtypes included; {@code null} for any exception
   * @param messageMatcher the matcher applied to the error message; {@code null} for any message
   * @return an {@code Asserter} bound to the raised error
   * @throws AssertionError if nothing, or the wrong thing, was raised
   * @throws IllegalStateException if this {@code Asserter} is bound to a value
   */
  public Asserter raisesError(Class<? extends Throwable> type, Matcher messageMatcher) {
    requireBlock("raisesError");
    String expectation = type == null ? "an error" : type.getName();

    Throwable raised = run(type);
    if (raised == null) {
      fail("expected block to raise " + expectation + ", but no error was raised");
    } else if (type != null && !type.isInstance(raised)) {
      fail("expected block to raise " + expectation + ", but raised " + summary(raised));
    } else if (messageMatcher != null && !messageMatcher.matches(raised.getMessage())) {
      fail("expected block to raise " + expectation + " with message " + messageMatcher.description()
          + ", but message was " + inspect(raised.getMessage()));
    }
    return new Asserter(reason, raised, null);
  }

  /**
   * Asserts the bound block completes without raising an {@link Exception}.  {@link Error}s
   * propagate untouched.
   *
   * @throws AssertionError if the block raised an exception
   * @throws IllegalStateException if this {@code Asserter} is bound to a value
   */
  public void raisesNothing() {
    requireBlock("raisesNothing");
    Throwable raised = run(null);
    if (raised != null) {
      fail("expected block not to raise an error, but raised " + summary(raised));
    }
  }

  /*
   * Runs the block returning what it raised, or null.  Errors escape unless expected is an Error
   * type, or Throwable, they are an instance of.
   */
  private Throwable run(Class<? extends Throwable> expected) {
    try {
      block.run();
      return null;
    } catch (Error e) {
      if (expected != null && !Exception.class.isAssignableFrom(expected) && expected.isInstance(e)) {
        return e;
      }
      throw e;
    } catch (Throwable t) {
      return t;
    }
  }

  private static String summary(Throwable t) {
    return t.getClass().getName() + ": " + t.getMessage();
  }

  private void requireValue(String operation) {
    if (block != null) {
      throw new IllegalStateException(operation + " requires a value, but this assertion is bound to a block");
    }
  }

  private void requireBlock(String operation) {
    if (block == null) {
      throw new IllegalStateException(operation + " requires a block, but this assertion is bound to " + inspect(actual));
    }
  }

  private void fail(String message) {
    String fullMessage = reason == null ? message : reason + ": " + message;
    LOGGER.debug("Assertion failed: {}", fullMessage);
    Assert.fail(fullMessage);
  }
}
