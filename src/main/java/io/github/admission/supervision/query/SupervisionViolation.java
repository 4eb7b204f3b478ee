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

package io.github.admission.supervision.query;

import io.github.admission.ddd.validation.BusinessException;

/**
 * @param code stable identifier of the broken rule
 * @param message describing the rule to the user
 */
public record SupervisionViolation(String code, String message) {
  public static SupervisionViolation of(final BusinessException exception) {
    return new SupervisionViolation(exception.getCode(), exception.getMessage());
  }
}
