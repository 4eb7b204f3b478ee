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

package io.github.admission.ddd.validation;

import java.io.Serial;

/**
 * Violation of a business rule: an expected condition the user can fix, as opposed to an
 * infrastructure failure.
 *
 * <p>Each concrete violation has a stable {@link #getCode() code} which callers can rely on to
 * translate or group messages.
 */
public abstract class BusinessException extends RuntimeException {
  @Serial private static final long serialVersionUID = 2879517735940361048L;

  private final String code;

  /**
   * @param code stable identifier of the violated rule
   * @param message human-readable description of the violation
   * @throws IllegalArgumentException if code is {@code null} or blank
   */
  protected BusinessException(final String code, final String message) {
    super(message);

    if (code == null || code.isBlank()) {
      throw new IllegalArgumentException("Business exception code cannot be blank");
    }

    this.code = code;
  }

  /**
   * @return stable identifier of the violated rule
   */
  public final String getCode() {
    return code;
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/422">422 Unprocessable
   *     Content</a>
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-3400/">Suppressed Sonar rule about
   *     declaring a constant instead</a>
   */
  @SuppressWarnings("squid:S3400")
  public int getStatusCode() {
    return 422;
  }

  @Override
  public String toString() {
    return "%s[%s]: %s".formatted(getClass().getSimpleName(), code, getMessage());
  }
}
