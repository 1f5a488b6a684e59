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

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Member;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.terracotta.crest.matchers.value.Inspector.inspect;

/**
 * Matches values exposing a named attribute, optionally whose value satisfies a matcher.
 * <p>
 * For a map the attribute is the entry under the key {@code name}.  For any other object the
 * attribute is read, in order of preference, through a public no-argument method {@code name()},
 * a bean getter {@code getName()} or {@code isName()}, or a public field {@code name}.  Only
 * members declared by public types are considered.
 */
public class HasAttribute extends Matcher {

  private final String name;
  private final Matcher valueMatcher;

  public HasAttribute(String name) {
    this(name, null);
  }

  /**
   * Creates a matcher for attribute {@code name}.
   *
   * @param name the attribute name
   * @param valueMatcher the matcher the attribute value must satisfy; {@code null} to check presence only
   */
  public HasAttribute(String name, Matcher valueMatcher) {
    if (name == null || name.isEmpty()) {
      throw new MatcherConfigurationException("attribute name required");
    }
    this.name = name;
    this.valueMatcher = valueMatcher;
  }

  @Override
  public boolean matches(Object actual) {
    Optional<Reader> reader = reader(actual);
    return reader.isPresent() && (valueMatcher == null || valueMatcher.matches(reader.get().read(actual)));
  }

  @Override
  public String description() {
    return "has attribute " + inspect(name) + (valueMatcher == null ? "" : " " + valueMatcher.description());
  }

  @Override
  public String failureMessage(Object actual) {
    Optional<Reader> reader = reader(actual);
    if (!reader.isPresent()) {
      return "expected " + inspect(actual) + " to have attribute " + inspect(name)
          + "\nbut it has no attribute " + inspect(name);
    } else if (valueMatcher == null) {
      return "expected " + inspect(actual) + " to have attribute " + inspect(name) + ", and it does";
    }
    return "expected " + inspect(actual) + " to have attribute " + inspect(name) + " " + valueMatcher.description()
        + "\nbut " + inspect(name) + " was " + inspect(reader.get().read(actual));
  }

  @Override
  public String negatedFailureMessage(Object actual) {
    return "expected " + inspect(actual) + " not to have attribute " + inspect(name) + ", but it did";
  }

  private Optional<Reader> reader(Object actual) {
    if (actual == null) {
      return Optional.empty();
    } else if (actual instanceof Map) {
      if (Values.hasKey((Map<?, ?>)actual, name)) {
        Reader entry = m -> ((Map<?, ?>)m).get(name);
        return Optional.of(entry);
      } else {
        return Optional.empty();
      }
    }

    String capitalized = Character.toUpperCase(name.charAt(0)) + name.substring(1);
    for (String candidate : new String[] { name, "get" + capitalized, "is" + capitalized }) {
      Optional<Method> method = publicTypes(actual.getClass()).stream()
          .map(t -> accessor(t, candidate)).filter(Optional::isPresent).map(Optional::get).findFirst();
      if (method.isPresent()) {
        Reader getter = o -> invoke(method.get(), o);
        return Optional.of(getter);
      }
    }
    Optional<Field> field = publicTypes(actual.getClass()).stream()
        .map(t -> field(t, name)).filter(Optional::isPresent).map(Optional::get).findFirst();
    if (field.isPresent()) {
      Reader fieldReader = o -> get(field.get(), o);
      return Optional.of(fieldReader);
    } else {
      return Optional.empty();
    }
  }

  /*
   * The public classes and interfaces through which members of type may be reached reflectively.
   */
  private static Set<Class<?>> publicTypes(Class<?> type) {
    Set<Class<?>> types = new LinkedHashSet<>();
    Deque<Class<?>> pending = new ArrayDeque<>();
    pending.add(type);
    while (!pending.isEmpty()) {
      Class<?> next = pending.remove();
      if (Modifier.isPublic(next.getModifiers())) {
        types.add(next);
      }
      if (next.getSuperclass() != null) {
        pending.add(next.getSuperclass());
      }
      for (Class<?> iface : next.getInterfaces()) {
        pending.add(iface);
      }
    }
    return types;
  }

  private static Optional<Method> accessor(Class<?> type, String methodName) {
    try {
      Method method = type.getMethod(methodName);
      return method.getReturnType() == void.class || isStatic(method) ? Optional.empty() : Optional.of(method);
    } catch (NoSuchMethodException e) {
      return Optional.empty();
    }
  }

  private static Optional<Field> field(Class<?> type, String fieldName) {
    try {
      Field field = type.getField(fieldName);
      return isStatic(field) ? Optional.empty() : Optional.of(field);
    } catch (NoSuchFieldException e) {
      return Optional.empty();
    }
  }

  private static boolean isStatic(Member member) {
    return Modifier.isStatic(member.getModifiers());
  }

  private Object invoke(Method method, Object target) {
    try {
      return method.invoke(target);
    } catch (InvocationTargetException e) {
      throw new IllegalStateException("Reading attribute " + inspect(name) + " of " + inspect(target) + " failed", e.getCause());
    } catch (IllegalAccessException e) {
      throw new IllegalStateException("Attribute " + inspect(name) + " of " + inspect(target) + " is not accessible", e);
    }
  }

  private Object get(Field field, Object target) {
    try {
      return field.get(target);
    } catch (IllegalAccessException e) {
      throw new IllegalStateException("Attribute " + inspect(name) + " of " + inspect(target) + " is not accessible", e);
    }
  }

  @FunctionalInterface
  private interface Reader {
    Object read(Object target);
  }
}
