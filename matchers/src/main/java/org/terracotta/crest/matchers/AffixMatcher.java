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

import static java.util.Objects.requireNonNull;
import static org.terracotta.crest.matchers.value.Inspector.inspect;

/**
 * Base for matchers testing a text value against an affix.  Non-text values never match.
 */
abstract class AffixMatcher extends Matcher {

  private final String affix;
  private final String label;

  protected AffixMatcher(CharSequence affix, String label) {
    this.affix = requireNonNull(affix, "affix").toString();
    this.label = label;
  }

  @Override
  public final boolean matches(Object actual) {
    return actual instanceof CharSequence && test(actual.toString(), affix);
  }

  protected abstract boolean test(String actual, String affix);

  @Override
  public String description() {
    return "a string " + label + " " + inspect(affix);
  }

  @Override
  public String failureMessage(Object actual) {
    return "expected " + inspect(actual) + "\n      to " + label + " " + inspect(affix);
  }

  @Override
  public String negatedFailureMessage(Object actual) {
    return "expected " + inspect(actual) + "\n      not to " + label + " " + inspect(affix) + "\nbut it does";
  }
}
