/*
 * Copyright 2024 Roman Khlebnov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.admission.supervision;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Tunable limits of the supervision bounded context.
 *
 * @param maxPromoters allowed in one group, {@link #UNLIMITED} by default
 * @param maxCaMembers allowed in one group, {@link #UNLIMITED} by default
 */
public record SupervisionSettings(int maxPromoters, int maxCaMembers) {
  public static final int UNLIMITED = Integer.MAX_VALUE;

  public static final String RESOURCE = "supervision.properties";
  public static final String MAX_PROMOTERS_KEY = "supervision.max-promoters";
  public static final String MAX_CA_MEMBERS_KEY = "supervision.max-ca-members";

  public SupervisionSettings {
    if (maxPromoters < 1) {
      throw new IllegalArgumentException(
          "Maximum promoters must be positive, got %d".formatted(maxPromoters));
    }

    if (maxCaMembers < 1) {
      throw new IllegalArgumentException(
          "Maximum CA members must be positive, got %d".formatted(maxCaMembers));
    }
  }

  /**
   * @return settings without any cap
   */
  public static SupervisionSettings defaults() {
    return new SupervisionSettings(UNLIMITED, UNLIMITED);
  }

  /**
   * Missing keys fall back to {@link #UNLIMITED}.
   *
   * @param properties to read {@link #MAX_PROMOTERS_KEY} and {@link #MAX_CA_MEMBERS_KEY} from
   * @return parsed settings
   * @throws IllegalArgumentException if a value is not a positive integer
   */
  public static SupervisionSettings fromProperties(final Properties properties) {
    if (properties == null) {
      throw new IllegalArgumentException("Properties cannot be null");
    }

    return new SupervisionSettings(
        readLimit(properties, MAX_PROMOTERS_KEY), readLimit(properties, MAX_CA_MEMBERS_KEY));
  }

  /**
   * @return settings read from the {@link #RESOURCE} classpath resource, {@link #defaults()} when
   *     the resource does not exist
   */
  public static SupervisionSettings load() {
    return load(SupervisionSettings.class.getClassLoader(), RESOURCE);
  }

  static SupervisionSettings load(final ClassLoader classLoader, final String resource) {
    try (InputStream input = classLoader.getResourceAsStream(resource)) {
      if (input == null) {
        return defaults();
      }

      final var properties = new Properties();
      properties.load(input);
      return fromProperties(properties);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot read '%s'".formatted(resource), e);
    }
  }

  private static int readLimit(final Properties properties, final String key) {
    final String value = properties.getProperty(key);
    if (value == null || value.isBlank()) {
      return UNLIMITED;
    }

    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          "'%s' must be an integer, got '%s'".formatted(key, value), e);
    }
  }
}
