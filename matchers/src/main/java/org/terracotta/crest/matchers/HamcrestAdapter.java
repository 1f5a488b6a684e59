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

import org.hamcrest.Description;
import org.hamcrest.StringDescription;

import static java.util.Objects.requireNonNull;
import static org.terracotta.crest.matchers.value.Inspector.inspect;

/**
 * Presents a Hamcrest {@link org.hamcrest.Matcher} as a {@link Matcher}, so existing Hamcrest
 * matchers compose with the combinators and the assertion entry point.
 */
public class HamcrestAdapter extends Matcher {

  private final org.hamcrest.Matcher<?> delegate;

  public HamcrestAdapter(org.hamcrest.Matcher<?> delegate) {
    this.delegate = requireNonNull(delegate, "delegate");
  }

  @Override
  public boolean matches(Object actual) {
    try {
      return delegate.matches(actual);
    } catch (ClassCastException e) {
      return false;
    }
  }

  @Override
  public String description() {
    return StringDescription.toString(delegate);
  }

  @Override
  public String failureMessage(Object actual) {
    Description mismatch = new StringDescription();
    delegate.describeMismatch(actual, mismatch);
    return "expected " + inspect(actual) + " to be " + description() + "\nbut " + mismatch;
  }

  @Override
  public void describeTo(Description description) {
    delegate.describeTo(description);
  }

  @Override
  public void describeMismatch(Object item, Description description) {
    delegate.describeMismatch(item, description);
  }
}
