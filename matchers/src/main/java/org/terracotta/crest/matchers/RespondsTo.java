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

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static java.util.stream.Collectors.joining;
import static java.util.stream.Collectors.toList;
import static org.terracotta.crest.matchers.value.Inspector.inspect;

/**
 * Matches objects exposing a public method of each of the given names.
 */
public class RespondsTo extends Matcher {

  private final List<String> methodNames;

  public RespondsTo(String... methodNames) {
    if (methodNames.length == 0) {
      throw new MatcherConfigurationException("at least one method name required");
    }
    List<String> names = new ArrayList<>(methodNames.length);
    for (String name : methodNames) {
      if (name == null || name.isEmpty()) {
        throw new MatcherConfigurationException("method names must not be null or empty");
      }
      names.add(name);
    }
    this.methodNames = Collections.unmodifiableList(names);
  }

  @Override
  public boolean matches(Object actual) {
    return missing(actual).isEmpty();
  }

  @Override
  public String description() {
    return "respond to " + names(methodNames);
  }

  @Override
  public String failureMessage(Object actual) {
    return "expected " + inspect(actual) + "\n      to respond to " + names(methodNames)
        + "\nmissing: " + names(missing(actual));
  }

  @Override
  public String negatedFailureMessage(Object actual) {
    return "expected " + inspect(actual) + "\n      not to respond to " + names(methodNames) + "\nbut it does";
  }

  private List<String> missing(Object actual) {
    if (actual == null) {
      return methodNames;
    }
    List<String> present = Arrays.stream(actual.getClass().getMethods())
        .filter(m -> Modifier.isPublic(m.getModifiers()))
        .map(Method::getName)
        .collect(toList());
    return methodNames.stream().filter(n -> !present.contains(n)).collect(toList());
  }

  private static String names(List<String> names) {
    return names.stream().map(n -> "\"" + n + "\"").collect(joining(", "));
  }
}
