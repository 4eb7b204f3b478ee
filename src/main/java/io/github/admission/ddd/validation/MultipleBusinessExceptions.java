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
import java.util.List;
import java.util.stream.Collectors;

/**
 * Carries every violation found by an accumulating {@link ValidatorList}, in the order the rules
 * were declared, so that a caller can display the full checklist at once.
 */
public class MultipleBusinessExceptions extends RuntimeException {
  @Serial private static final long serialVersionUID = -1841162253419938020L;

  private final transient List<BusinessException> exceptions;

  /**
   * @param exceptions found, must contain at least one element
   * @throws IllegalArgumentException if the list is {@code null} or empty
   */
  public MultipleBusinessExceptions(final List<BusinessException> exceptions) {
    super(describe(exceptions));
    this.exceptions = List.copyOf(exceptions);
  }

  /**
   * @return violations in declaration order
   */
  public List<BusinessException> getExceptions() {
    return exceptions;
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-3400/">Suppressed Sonar rule about
   *     declaring a constant instead</a>
   */
  @SuppressWarnings("squid:S3400")
  public final int getStatusCode() {
    return 422;
  }

  private static String describe(final List<BusinessException> exceptions) {
    if (exceptions == null || exceptions.isEmpty()) {
      throw new IllegalArgumentException("At least one business exception is required");
    }

    return exceptions.stream()
        .map(exception -> "%s: %s".formatted(exception.getCode(), exception.getMessage()))
        .collect(Collectors.joining("; "));
  }
}
