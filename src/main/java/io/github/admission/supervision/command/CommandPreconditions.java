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

package io.github.admission.supervision.command;

import java.util.List;

final class CommandPreconditions {
  private CommandPreconditions() {
    // Cannot be instantiated
  }

  static <T> T throwIllegalArgumentIfNull(final T value, final String name) {
    if (value == null) {
      throw new IllegalArgumentException(name + " cannot be null");
    }

    return value;
  }

  static String throwIllegalArgumentIfBlank(final String value, final String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " cannot be blank");
    }

    return value;
  }

  static List<String> copyOrEmpty(final List<String> values) {
    return values == null ? List.of() : List.copyOf(values);
  }
}
