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

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static java.util.Objects.requireNonNull;
import static org.terracotta.crest.matchers.value.Inspector.inspect;

/**
 * Matches text in which a regular expression can be found.  The pattern is not anchored;
 * use {@code ^} and {@code $} to match the whole text.
 */
public class MatchesPattern extends Matcher {

  private final Pattern pattern;

  public MatchesPattern(Pattern pattern) {
    this.pattern = requireNonNull(pattern, "pattern");
  }

  public MatchesPattern(String regex) {
    this(compile(regex));
  }

  private static Pattern compile(String regex) {
    requireNonNull(regex, "regex");
    try {
      return Pattern.compile(regex);
    } catch (PatternSyntaxException e) {
      throw new MatcherConfigurationException("invalid pattern " + inspect(regex), e);
    }
  }

  @Override
  public boolean matches(Object actual) {
    return actual instanceof CharSequence && pattern.matcher((CharSequence)actual).find();
  }

  @Override
  public String description() {
    return "a string matching " + inspect(pattern);
  }

  @Override
  public String failureMessage(Object actual) {
    return "expected " + inspect(actual) + "\n      to match pattern " + inspect(pattern);
  }

  @Override
  public String negatedFailureMessage(Object actual) {
    return "expected " + inspect(actual) + "\n      not to match pattern " + inspect(pattern) + "\nbut it does";
  }
}
