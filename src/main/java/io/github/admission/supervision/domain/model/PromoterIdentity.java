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

/**
 * @param id of the person supervising the thesis
 */
public record PromoterIdentity(String id) implements SignatoryIdentity {
  @Serial private static final long serialVersionUID = -8150291838707615349L;

  public PromoterIdentity {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Promoter ID cannot be blank");
    }
  }

  @Override
  public SignatoryRole role() {
    return SignatoryRole.PROMOTER;
  }
}
