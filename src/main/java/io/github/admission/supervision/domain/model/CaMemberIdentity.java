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
 * @param id of the person sitting on the accompanying committee
 */
public record CaMemberIdentity(String id) implements SignatoryIdentity {
  @Serial private static final long serialVersionUID = 3907718243925585721L;

  public CaMemberIdentity {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("CA member ID cannot be blank");
    }
  }

  @Override
  public SignatoryRole role() {
    return SignatoryRole.CA_MEMBER;
  }
}
