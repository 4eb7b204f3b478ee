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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered composition of {@link BusinessValidator}s, evaluated in one of two modes:
 *
 * <ul>
 *   <li>{@link #failFast(Object)} stops at the first violation and throws it as is, for
 *       preconditions guarding a single mutation.
 *   <li>{@link #accumulate(Object)} evaluates every rule and throws all violations together, for
 *       completeness checks feeding a list shown to the user.
 * </ul>
 *
 * @param <C> is the type of the validated context
 */
public final class ValidatorList<C> {
  private final List<BusinessValidator<C>> validators;

  private ValidatorList(final List<BusinessValidator<C>> validators) {
    this.validators = List.copyOf(validators);
  }

  /**
   * @param validators in evaluation order
   * @param <C> is the type of the validated context
   * @return a new list
   * @throws NullPointerException if any validator is {@code null}
   */
  @SafeVarargs
  public static <C> ValidatorList<C> of(final BusinessValidator<C>... validators) {
    return new ValidatorList<>(List.of(validators));
  }

  /**
   * @param other validators to evaluate after the current ones
   * @return a new list containing both
   */
  public ValidatorList<C> andThen(final ValidatorList<C> other) {
    final var combined = new ArrayList<>(validators);
    combined.addAll(other.validators);
    return new ValidatorList<>(combined);
  }

  /**
   * @param context to check
   * @return every violation in declaration order, empty when all rules hold
   */
  public List<BusinessException> violations(final C context) {
    return validators.stream()
        .map(validator -> validator.validate(context))
        .flatMap(Optional::stream)
        .toList();
  }

  /**
   * @param context to check
   * @throws BusinessException the first violation found
   */
  public void failFast(final C context) {
    for (BusinessValidator<C> validator : validators) {
      final Optional<BusinessException> violation = validator.validate(context);
      if (violation.isPresent()) {
        throw violation.get();
      }
    }
  }

  /**
   * @param context to check
   * @throws MultipleBusinessExceptions with every violation found, if any
   */
  public void accumulate(final C context) {
    final List<BusinessException> found = violations(context);
    if (!found.isEmpty()) {
      throw new MultipleBusinessExceptions(found);
    }
  }
}
