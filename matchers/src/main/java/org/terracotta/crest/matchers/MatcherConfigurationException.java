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

/**
 * Thrown when a matcher or matcher factory is constructed or registered with arguments that
 * cannot be used.  These errors are raised at the call site, never deferred to assertion time.
 */
public class MatcherConfigurationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public MatcherConfigurationException(String message) {
    super(message);
  }

  public MatcherConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
