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

package io.github.admission.supervision.domain.model;

import java.io.Serial;
import java.io.Serializable;
import java.util.UUID;

/**
 * @param uuid of the supervision group
 */
public record SupervisionGroupIdentity(UUID uuid) implements Serializable {
  @Serial private static final long serialVersionUID = 6213374958821730114L;

  public SupervisionGroupIdentity {
    if (uuid == null) {
      throw new IllegalArgumentException("Supervision group UUID cannot be null");
    }
  }

  public static SupervisionGroupIdentity random() {
    return new SupervisionGroupIdentity(UUID.randomUUID());
  }
}
