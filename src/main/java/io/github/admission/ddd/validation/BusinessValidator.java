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

import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Single business rule evaluated against a context, usually an aggregate.
 *
 * <p>Rules must not change the context.
 *
 * @param <C> is the type of the validated context
 */
@FunctionalInterface
public interface BusinessValidator<C> {
  /**
   * @param context to check
   * @return the violation, or {@link Optional#empty()} when the rule holds
   */
  Optional<BusinessException> validate(final C context);

  /**
   * Shortcut for rules expressed as a plain condition.
   *
   * @param condition which must hold for the context
   * @param violation producing the exception when the condition does not hold
   * @param <C> is the type of the validated context
   * @return a new validator
   */
  static <C> BusinessValidator<C> of(
      final Predicate<C> condition,
      final Supplier<? extends BusinessException> violation) {
    return context ->
        condition.test(context)
            ? Optional.empty()
            : Optional.<BusinessException>of(violation.get());
  }
}
