/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.blossom.config;

import org.apache.blossom.util.trace.BlossomTrace;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;
import java.util.function.Function;

/**
 * A Blossom specific system property that is used to configure various
 * aspects of the framework.
 *
 * <p>Blossom system properties must always be in the "blossom" root
 * namespace. A value is looked up first among the Java system properties,
 * then in a {@code blossom.properties} file on the class path, and finally
 * the coded default applies.
 *
 * @param <T> the type of the property value
 */
public final class BlossomSystemProperty<T> {
  //~ Static fields/initializers ---------------------------------------------

  private static final Logger LOGGER = BlossomTrace.getConfigTracer();

  /** Name of the optional class path resource holding property defaults. */
  public static final String PROPERTIES_RESOURCE = "blossom.properties";

  private static final Properties PROPERTIES = loadProperties();

  /**
   * Tolerance below which the slack of an edge counts as zero when the
   * matching algorithm decides whether the edge is tight.
   *
   * <p>Zero reproduces exact comparisons. A positive value helps with
   * floating point weights but may accept a slightly suboptimal matching.
   */
  public static final BlossomSystemProperty<Double> MATCHING_EPSILON =
      doubleProperty("blossom.matching.epsilon", 0d);

  /**
   * Whether to check complementary slackness after a matching computed in
   * integer-weight mode.
   */
  public static final BlossomSystemProperty<Boolean> MATCHING_VERIFY =
      booleanProperty("blossom.matching.verify", true);

  /** Whether matching computations assume integer weights by default. */
  public static final BlossomSystemProperty<Boolean> MATCHING_INTEGER_WEIGHTS =
      booleanProperty("blossom.matching.integerWeights", false);

  //~ Instance fields --------------------------------------------------------

  private final String name;
  private final T value;

  //~ Constructors -----------------------------------------------------------

  private BlossomSystemProperty(String name, T value) {
    this.name = name;
    this.value = value;
  }

  //~ Methods ----------------------------------------------------------------

  private static BlossomSystemProperty<Boolean> booleanProperty(String name,
      boolean defaultValue) {
    return new BlossomSystemProperty<>(name,
        resolve(name, defaultValue, BlossomSystemProperty::parseBoolean));
  }

  private static BlossomSystemProperty<Double> doubleProperty(String name,
      double defaultValue) {
    return new BlossomSystemProperty<>(name,
        resolve(name, defaultValue, Double::valueOf));
  }

  private static <T> T resolve(String name, T defaultValue,
      Function<String, T> parser) {
    Preconditions.checkArgument(name.startsWith("blossom."),
        "property %s is not in the blossom namespace", name);
    String raw = System.getProperty(name);
    if (raw == null) {
      raw = PROPERTIES.getProperty(name);
    }
    if (raw == null) {
      return defaultValue;
    }
    try {
      final T value = parser.apply(raw.trim());
      LOGGER.debug("Property {} set to {}", name, value);
      return value;
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid value '" + raw
          + "' for property " + name, e);
    }
  }

  private static Boolean parseBoolean(String raw) {
    if (raw.equalsIgnoreCase("true")) {
      return true;
    } else if (raw.equalsIgnoreCase("false")) {
      return false;
    }
    throw new IllegalArgumentException("not a boolean: " + raw);
  }

  private static Properties loadProperties() {
    final Properties properties = new Properties();
    final ClassLoader classLoader = BlossomSystemProperty.class.getClassLoader();
    try (InputStream stream = classLoader.getResourceAsStream(PROPERTIES_RESOURCE)) {
      if (stream != null) {
        properties.load(stream);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("while reading " + PROPERTIES_RESOURCE, e);
    }
    return properties;
  }

  /** Returns the name of this property. */
  public String name() {
    return name;
  }

  /** Returns the value of this property. */
  public T value() {
    return value;
  }
}

// End BlossomSystemProperty.java
