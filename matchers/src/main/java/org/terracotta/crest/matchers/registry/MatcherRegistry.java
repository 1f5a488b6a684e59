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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.terracotta.crest.matchers.Matcher;
import org.terracotta.crest.matchers.MatcherConfigurationException;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A registry of named {@link MatcherFactory} instances.
 * <p>
 * Registrations are permanent: a name, once registered, cannot be replaced or removed for the
 * life of the registry.  Registration and lookup are safe for concurrent use.
 * <pre>{@code
 *   MatcherRegistry registry = new MatcherRegistry();
 *   registry.register("even", args -> Matchers.matching("an even number", n -> ((Integer)n) % 2 == 0));
 *   assertThat(4).matches(registry.create("even"));
 * }</pre>
 * {@link #shared()} returns the process-wide instance used by
 * {@link org.terracotta.crest.matchers.Matchers#matcher(String, Object...)}.
 */
public class MatcherRegistry {
  private static final Logger LOGGER = LoggerFactory.getLogger(MatcherRegistry.class);

  private static final MatcherRegistry SHARED = new MatcherRegistry();

  private final Map<String, MatcherFactory> factories = new ConcurrentHashMap<>();

  /**
   * Returns the process-wide registry.
   *
   * @return the shared {@code MatcherRegistry}
   */
  public static MatcherRegistry shared() {
    return SHARED;
  }

  /**
   * Registers {@code factory} under {@code name}.
   *
   * @param name the name under which the factory is registered
   * @param factory the factory creating the matcher
   * @throws MatcherConfigurationException if {@code name} is null or empty, if {@code factory} is
   *      null or if {@code name} is already registered
   */
  public void register(String name, MatcherFactory factory) {
    if (name == null || name.isEmpty()) {
      throw new MatcherConfigurationException("matcher name required");
    }
    if (factory == null) {
      throw new MatcherConfigurationException("factory required for matcher \"" + name + "\"");
    }
    if (factories.putIfAbsent(name, factory) != null) {
      throw new MatcherConfigurationException("matcher \"" + name + "\" is already registered");
    }
    LOGGER.debug("Registered matcher \"{}\" -> {}", name, factory);
  }

  /**
   * Indicates whether a factory is registered under {@code name}.
   *
   * @param name the name to check
   * @return {@code true} if {@code name} is registered
   */
  public boolean isRegistered(String name) {
    return name != null && factories.containsKey(name);
  }

  /**
   * Creates a matcher using the factory registered under {@code name}.
   *
   * @param name the registered name
   * @param args the arguments passed to the factory
   * @return the new matcher
   * @throws MatcherConfigurationException if {@code name} is not registered or the factory
   *      returns {@code null}
   */
  public Matcher create(String name, Object... args) {
    MatcherFactory factory = name == null ? null : factories.get(name);
    if (factory == null) {
      throw new MatcherConfigurationException("no matcher registered as \"" + name + "\"");
    }
    Matcher matcher = factory.create(args);
    if (matcher == null) {
      throw new MatcherConfigurationException("factory for matcher \"" + name + "\" returned null");
    }
    return matcher;
  }
}
