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
package net.hydromatic.planar.eval;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.base.Enums;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property.
 *
 * @see net.hydromatic.planar.compile.PlanarCompiler
 */
public enum Prop {
  /**
   * Boolean property "arityChecks" controls whether a plan checks, before it
   * runs, that each object has the number of output and input legs that the
   * diagram uses. Default is true.
   */
  ARITY_CHECKS("arityChecks", Boolean.class, true, true),

  /**
   * Boolean property "checkPlanarity" controls whether to check, in planar
   * mode, that each assignment can be drawn without crossings before
   * decomposing it. Default is true.
   */
  CHECK_PLANARITY("checkPlanarity", Boolean.class, true, true),

  /**
   * Boolean property "decompose" controls whether, in planar mode,
   * products are decomposed into binary contractions. Default is true.
   */
  DECOMPOSE("decompose", Boolean.class, true, true),

  /**
   * Enum property "mode" controls how braidings are handled. In
   * {@link Mode#PLANAR} mode (the default), braidings are constructed and
   * contractions are kept planar; in {@link Mode#SYMMETRIC} mode, braidings
   * are removed.
   */
  MODE("mode", Mode.class, true, Mode.PLANAR);

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and
   * {@link #camelName}.
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

  Prop(String camelName, Class<?> type, boolean required,
      Object defaultValue) {
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

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(type == requestedType,
        "invalid type %s for property %s", type, camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    Object o = map.get(this);
    return this.<Boolean>typeValue(o);
  }

  /** Returns the value of an enum property. */
  public <E extends Enum<E>> E enumValue(Map<Prop, Object> map,
      Class<E> type) {
    checkType(type);
    Object o = map.get(this);
    return this.typeValue(o);
  }

  @SuppressWarnings("unchecked")
  private <T> T typeValue(@Nullable Object o) {
    return (T) (o == null ? defaultValue : o);
  }

  /** Sets the value of a property, allowing strings for boolean and enum
   * types. */
  @SuppressWarnings({"rawtypes", "unchecked"})
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (type.isEnum() && value instanceof String) {
      Optional<Enum> optional =
          Enums.getIfPresent((Class<Enum>) type,
              ((String) value).toUpperCase(Locale.ROOT));
      if (!optional.isPresent()) {
        String values =
            Arrays.stream((Enum[]) type.getEnumConstants())
                .map(Enum::name)
                .collect(Collectors.joining("', '", "'", "'"));
        throw new RuntimeException("value must be one of: " + values);
      }
      set(map, optional.get());
      return;
    }
    if (type == Boolean.class && value instanceof String) {
      set(map, Boolean.valueOf((String) value));
      return;
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
        throw new RuntimeException("value for property must have type "
            + type);
      }
      map.put(this, value);
    }
  }

  /**
   * Removes the value of this property from a map, returning the previous
   * value or null.
   */
  public Object remove(Map<Prop, Object> map) {
    return map.remove(this);
  }

  /** Allowed values for {@link #MODE} property. */
  public enum Mode {
    /** Braidings are constructed, and contractions are planar. The
     * default. */
    PLANAR,
    /** Braidings are removed; the order of legs does not matter. */
    SYMMETRIC
  }
}

// End Prop.java
