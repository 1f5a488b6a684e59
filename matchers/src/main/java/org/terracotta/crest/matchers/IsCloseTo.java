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

import org.terracotta.crest.matchers.value.Values;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

import static org.terracotta.crest.matchers.value.Inspector.inspect;

/**
 * Matches numbers within a tolerance of an expected number, bounds included.
 * <p>
 * The difference is computed in exact decimal arithmetic, so {@code closeTo(10.0, 1.0)} matches
 * {@code 9.0} and rejects {@code 8.9} without floating point artifacts.  Non-numeric values, NaN
 * and infinities never match.
 */
public class IsCloseTo extends Matcher {

  private static final int REPORTED_SCALE = 10;

  private final Number expected;
  private final Number delta;
  private final BigDecimal expectedDecimal;
  private final BigDecimal deltaDecimal;

  public IsCloseTo(Number expected, Number delta) {
    if (expected == null || delta == null) {
      throw new MatcherConfigurationException("expected value and delta must not be null");
    }
    this.expected = expected;
    this.delta = delta;
    this.expectedDecimal = Values.toDecimal(expected)
        .orElseThrow(() -> new MatcherConfigurationException("expected value must be finite: " + expected));
    this.deltaDecimal = Values.toDecimal(delta)
        .orElseThrow(() -> new MatcherConfigurationException("delta must be finite: " + delta));
    if (deltaDecimal.signum() < 0) {
      throw new MatcherConfigurationException("delta must be non-negative: " + delta);
    }
  }

  @Override
  public boolean matches(Object actual) {
    return difference(actual).map(d -> d.compareTo(deltaDecimal) <= 0).orElse(false);
  }

  @Override
  public String description() {
    return "close to " + inspect(expected) + " (within " + inspect(delta) + ")";
  }

  @Override
  public String failureMessage(Object actual) {
    String message = "expected " + inspect(actual) + " to be " + description();
    return difference(actual)
        .map(d -> message + ", but difference was " + d.setScale(REPORTED_SCALE, RoundingMode.HALF_UP).stripTrailingZeros().toPlainString())
        .orElse(message + ", but it is not a finite number");
  }

  @Override
  public String negatedFailureMessage(Object actual) {
    return "expected " + inspect(actual) + " not to be " + description() + ", but it was";
  }

  private Optional<BigDecimal> difference(Object actual) {
    if (actual instanceof Number) {
      return Values.toDecimal((Number)actual).map(a -> a.subtract(expectedDecimal).abs());
    } else {
      return Optional.empty();
    }
  }
}
