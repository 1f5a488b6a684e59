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

import org.terracotta.crest.matchers.registry.MatcherFactory;
import org.terracotta.crest.matchers.registry.MatcherRegistry;

import java.util.function.BiPredicate;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Static factory methods for every matcher and combinator.
 * <pre>{@code
 *   import static org.terracotta.crest.matchers.Matchers.*;
 *
 *   assertThat(list).matches(allOf(hasSize(3), includes(2), not(includes(5))));
 *   assertThat(map).matches(hasKey("id").and(hasAttribute("name", startsWith("J"))));
 * }</pre>
 */
public final class Matchers {

  private Matchers() {
    //no instances please
  }

  /**
   * Returns a matcher for values deeply equal to {@code expected}.
   *
   * @param expected the expected value
   * @return a new {@code Equals} matcher
   * @see org.terracotta.crest.matchers.value.Values#deepEquals(Object, Object)
   */
  public static Matcher equalTo(Object expected) {
    return new Equals(expected);
  }

  /**
   * Returns a matcher for the very object {@code expected}, or, if {@code expected} is a
   * {@code Matcher}, that matcher unchanged in behavior.
   *
   * @param expected the expected reference or a matcher
   * @return a new {@code Is} matcher
   */
  public static Matcher is(Object expected) {
    return new Is(expected);
  }

  public static Matcher isA(Class<?> type) {
    return new IsA(type);
  }

  public static Matcher descendsFrom(Class<?> type) {
    return new DescendsFrom(type);
  }

  public static Matcher instanceOf(Class<?> type) {
    return new InstanceOf(type);
  }

  public static Matcher respondsTo(String... methodNames) {
    return new RespondsTo(methodNames);
  }

  public static Matcher startsWith(CharSequence prefix) {
    return new StartsWith(prefix);
  }

  public static Matcher endsWith(CharSequence suffix) {
    return new EndsWith(suffix);
  }

  public static Matcher matchesPattern(String regex) {
    return new MatchesPattern(regex);
  }

  public static Matcher matchesPattern(Pattern pattern) {
    return new MatchesPattern(pattern);
  }

  public static Matcher blank() {
    return new Blank();
  }

  public static Matcher empty() {
    return new Empty();
  }

  public static Matcher hasSize(int size) {
    return new HasSize(size);
  }

  /**
   * Returns a matcher for values whose size satisfies {@code sizeMatcher}.
   *
   * @param sizeMatcher the matcher applied to the size
   * @return a new {@code HasSize} matcher
   */
  public static Matcher hasSize(Matcher sizeMatcher) {
    return new HasSize(sizeMatcher);
  }

  public static Matcher greaterThan(Object bound) {
    return new IsGreaterThan(bound);
  }

  public static Matcher greaterThanOrEqualTo(Object bound) {
    return new IsGreaterThanOrEqualTo(bound);
  }

  public static Matcher lessThan(Object bound) {
    return new IsLessThan(bound);
  }

  public static Matcher lessThanOrEqualTo(Object bound) {
    return new IsLessThanOrEqualTo(bound);
  }

  public static Matcher between(Object min, Object max) {
    return new Between(min, max);
  }

  public static Matcher between(Object min, Object max, boolean exclusive) {
    return new Between(min, max, exclusive);
  }

  public static Matcher closeTo(Number expected, Number delta) {
    return new IsCloseTo(expected, delta);
  }

  public static Matcher includes(Object... items) {
    return new Includes(items);
  }

  public static Matcher hasKey(Object... keys) {
    return new HasKey(keys);
  }

  public static Matcher hasValue(Object... values) {
    return new HasValue(values);
  }

  /**
   * Returns a matcher for sequences and collections holding exactly {@code items} in any order.
   * A single map argument matches maps with exactly its entries.
   *
   * @param items the expected items
   * @return a new {@code Contains} matcher
   */
  public static Matcher contains(Object... items) {
    return new Contains(items);
  }

  public static Matcher containsExactly(Object... items) {
    return new ContainsExactly(items);
  }

  public static Matcher allItems(Matcher itemMatcher) {
    return new AllItems(itemMatcher);
  }

  public static Matcher someItems(Matcher itemMatcher) {
    return new SomeItems(itemMatcher);
  }

  public static Matcher noItems(Matcher itemMatcher) {
    return new NoItems(itemMatcher);
  }

  public static Matcher allEntries(BiPredicate<Object, Object> condition) {
    return new AllEntries(condition);
  }

  public static Matcher allEntries(Matcher entryMatcher) {
    return new AllEntries(entryMatcher);
  }

  public static Matcher someEntry(BiPredicate<Object, Object> condition) {
    return new SomeEntry(condition);
  }

  public static Matcher someEntry(Matcher entryMatcher) {
    return new SomeEntry(entryMatcher);
  }

  public static Matcher noEntry(BiPredicate<Object, Object> condition) {
    return new NoEntry(condition);
  }

  public static Matcher noEntry(Matcher entryMatcher) {
    return new NoEntry(entryMatcher);
  }

  /**
   * Returns a matcher for members of {@code container}: an element of a collection or array, a
   * key of a map, a substring of a string or a value within a Guava
   * {@link com.google.common.collect.Range Range}.
   *
   * @param container the container
   * @return a new {@code IsIn} matcher
   */
  public static Matcher isIn(Object container) {
    return new IsIn(container);
  }

  public static Matcher hasAttribute(String name) {
    return new HasAttribute(name);
  }

  public static Matcher hasAttribute(String name, Matcher valueMatcher) {
    return new HasAttribute(name, valueMatcher);
  }

  public static Matcher anything() {
    return new Anything();
  }

  public static Matcher nilValue() {
    return new NilValue();
  }

  public static Matcher truthy() {
    return new Truthy();
  }

  public static Matcher falsy() {
    return new Falsy();
  }

  public static Matcher not(Matcher matcher) {
    return new Not(matcher);
  }

  public static Matcher allOf(Object... matchers) {
    return new AllOf(matchers);
  }

  public static Matcher noneOf(Object... matchers) {
    return new NoneOf(matchers);
  }

  public static Matcher someOf(Object... matchers) {
    return new SomeOf(matchers);
  }

  /**
   * Returns a matcher accepting the values accepted by {@code predicate}.
   *
   * @param description the description of the expectation, e.g. {@code "an even number"}
   * @param predicate the test applied to the actual value
   * @return a new {@code PredicateMatcher}
   */
  public static Matcher matching(String description, Predicate<Object> predicate) {
    return new PredicateMatcher(description, predicate);
  }

  /**
   * Adapts a Hamcrest matcher.
   *
   * @param matcher the Hamcrest matcher
   * @return a {@code Matcher} delegating to {@code matcher}
   */
  public static Matcher that(org.hamcrest.Matcher<?> matcher) {
    return new HamcrestAdapter(matcher);
  }

  /**
   * Creates a matcher from the factory registered in the {@link MatcherRegistry#shared() shared registry}.
   *
   * @param name the registered name
   * @param args the factory arguments
   * @return the new matcher
   * @throws MatcherConfigurationException if {@code name} is not registered
   */
  public static Matcher matcher(String name, Object... args) {
    return MatcherRegistry.shared().create(name, args);
  }

  /**
   * Registers a matcher factory in the {@link MatcherRegistry#shared() shared registry}.
   *
   * @param name the name to register
   * @param factory the factory
   * @throws MatcherConfigurationException if the name is invalid or taken, or the factory is missing
   */
  public static void register(String name, MatcherFactory factory) {
    MatcherRegistry.shared().register(name, factory);
  }
}
