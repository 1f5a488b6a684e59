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
package org.terracotta.crest.matchers.registry;

import org.terracotta.crest.matchers.Matcher;

/**
 * Creates matchers from the arguments supplied at the point of use.
 *
 * @see MatcherRegistry#register(String, MatcherFactory)
 */
@FunctionalInterface
public interface MatcherFactory {

  /**
   * Creates a new matcher.
   *
   * @param args the arguments given to {@link MatcherRegistry#create(String, Object...)}
   * @return a new {@code Matcher}
   * @throws org.terracotta.crest.matchers.MatcherConfigurationException if {@code args} cannot be used
   */
  Matcher create(Object... args);
}
