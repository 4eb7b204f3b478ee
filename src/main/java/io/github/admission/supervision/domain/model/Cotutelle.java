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
import java.util.List;

/**
 * Joint supervision of the thesis with a partner institution.
 *
 * <p>A group without cotutelle ({@code null}) means the candidate did not answer yet, {@link #NONE}
 * means the candidate explicitly stated there is no cotutelle.
 *
 * @param motivation for the joint supervision
 * @param partnerConsortiumInstitution whether the partner belongs to the consortium, {@code null}
 *     when unanswered
 * @param institution catalog reference of the partner, used for consortium institutions
 * @param otherInstitutionName of a partner outside the catalog
 * @param otherInstitutionAddress of a partner outside the catalog
 * @param openingRequestDocuments references of the signed opening request
 * @param conventionDocuments references of the cotutelle convention
 * @param otherDocuments references of any other supporting document
 */
public record Cotutelle(
    String motivation,
    Boolean partnerConsortiumInstitution,
    String institution,
    String otherInstitutionName,
    String otherInstitutionAddress,
    List<String> openingRequestDocuments,
    List<String> conventionDocuments,
    List<String> otherDocuments)
    implements Serializable {
  @Serial private static final long serialVersionUID = -7519623107740063186L;

  public static final Cotutelle NONE =
      new Cotutelle("", null, "", "", "", List.of(), List.of(), List.of());

  public Cotutelle {
    motivation = blankIfNull(motivation);
    institution = blankIfNull(institution);
    otherInstitutionName = blankIfNull(otherInstitutionName);
    otherInstitutionAddress = blankIfNull(otherInstitutionAddress);
    openingRequestDocuments = emptyIfNull(openingRequestDocuments);
    conventionDocuments = emptyIfNull(conventionDocuments);
    otherDocuments = emptyIfNull(otherDocuments);
  }

  /**
   * @return {@code true} unless this is {@link #NONE}
   */
  public boolean isDefined() {
    return !equals(NONE);
  }

  /**
   * A defined cotutelle is complete once motivated, with its partner designated and its opening
   * request attached. While the consortium question is unanswered, either institution field
   * designates the partner.
   *
   * @return {@code true} for {@link #NONE} and for complete cotutelles
   */
  public boolean isComplete() {
    if (!isDefined()) {
      return true;
    }

    return !motivation.isBlank() && isPartnerDesignated() && !openingRequestDocuments.isEmpty();
  }

  private boolean isPartnerDesignated() {
    if (partnerConsortiumInstitution == null) {
      return !institution.isBlank() || !otherInstitutionName.isBlank();
    }

    return partnerConsortiumInstitution ? !institution.isBlank() : !otherInstitutionName.isBlank();
  }

  private static String blankIfNull(final String value) {
    return value == null ? "" : value;
  }

  private static List<String> emptyIfNull(final List<String> value) {
    return value == null ? List.of() : List.copyOf(value);
  }
}
