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
 * Reference to the doctoral proposition owning a supervision group. The proposition itself lives
 * in another aggregate and is never loaded from here.
 *
 * @param uuid of the proposition
 */
public record PropositionIdentity(UUID uuid) implements Serializable {
  @Serial private static final long serialVersionUID = -3385119217560446702L;

  public PropositionIdentity {
    if (uuid == null) {
      throw new IllegalArgumentException("Proposition UUID cannot be null");
    }
  }
}
