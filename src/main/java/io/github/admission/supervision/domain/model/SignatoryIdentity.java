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

import java.io.Serializable;

/**
 * Person asked to sign a proposition, either as a promoter or as a CA member.
 *
 * <p>Promoters and CA members share the same identifier space. Two identities are equal only when
 * both their role and their identifier match.
 */
public sealed interface SignatoryIdentity extends Serializable
    permits PromoterIdentity, CaMemberIdentity {
  /**
   * @return opaque reference of the person
   */
  String id();

  SignatoryRole role();

  /**
   * @param role of the signatory
   * @param id of the person
   * @return the identity matching the role
   */
  static SignatoryIdentity of(final SignatoryRole role, final String id) {
    if (role == null) {
      throw new IllegalArgumentException("Signatory role cannot be null");
    }

    return switch (role) {
      case PROMOTER -> new PromoterIdentity(id);
      case CA_MEMBER -> new CaMemberIdentity(id);
    };
  }
}
