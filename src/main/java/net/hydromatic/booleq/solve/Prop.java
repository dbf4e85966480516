/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.booleq.solve;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property of a {@link Solver}.
 *
 * @see Solver#Solver(Map, Tracer)
 */
public enum Prop {
  /**
   * Integer property "maxPassCount" is the maximum number of passes of the
   * fixpoint loop. If the loop has not converged after that many passes, the
   * solver logs a warning and returns the candidates it has, which are
   * correct but may not be as narrow as possible.
   *
   * <p>The default, -1, means no limit.
   */
  MAX_PASS_COUNT("maxPassCount", Integer.class, true, -1),

  /**
   * Boolean property "checkGroundTruth" controls whether, after solving, the
   * solver checks whether the ground truth has become {@code FALSE}, and logs
   * a warning if it has. Does not change the result of {@link Solver#solve()}.
   * Default is false.
   */
  CHECK_GROUND_TRUTH("checkGroundTruth", Boolean.class, true, false),

  /**
   * Boolean property "trace" controls whether a solver that was not given a
   * {@link Tracer} logs each step of the solve at TRACE level. Default is
   * false.
   */
  TRACE("trace", Boolean.class, true, false);

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, boolean required, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new RuntimeException("property " + propName + " not found");
    }
    return prop;
  }

  /**
   * Converts a set of string properties, such as those read from a file, into
   * a property map. Keys may be either the {@link #name()} or {@link
   * #camelName} of a property.
   */
  public static Map<Prop, Object> fromProperties(Properties properties) {
    final Map<Prop, Object> map = new EnumMap<>(Prop.class);
    for (String propName : properties.stringPropertyNames()) {
      lookup(propName).setLenient(map, properties.getProperty(propName));
    }
    return map;
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        type,
        camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    Object o = map.get(this);
    return this.<Boolean>typeValue(o);
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    Object o = map.get(this);
    return this.<Integer>typeValue(o);
  }

  @SuppressWarnings("unchecked")
  private <T> T typeValue(Object o) {
    if (o == null) {
      return (T) defaultValue;
    }
    return (T) o;
  }

  /**
   * Sets the value of a property, converting strings to the property's type.
   */
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (value instanceof String && type != String.class) {
      final String s = ((String) value).trim();
      if (type == Boolean.class) {
        switch (s.toLowerCase(Locale.ROOT)) {
          case "true":
            set(map, true);
            return;
          case "false":
            set(map, false);
            return;
          default:
            throw new RuntimeException(
                "value for property " + camelName
                    + " must be 'true' or 'false'");
        }
      }
      if (type == Integer.class) {
        try {
          set(map, Integer.valueOf(s));
          return;
        } catch (NumberFormatException e) {
          throw new RuntimeException(
              "value for property " + camelName + " must be an integer", e);
        }
      }
    }
    set(map, value);
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      if (required) {
        throw new RuntimeException("property is required");
      }
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new RuntimeException("value for property must have type " + type);
      }
      map.put(this, value);
    }
  }
}

// End Prop.java
