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

/**
 * Contact details of a signatory who is not registered in the person registry, typically a
 * promoter or a CA member working for another institution.
 *
 * <p>Missing values are stored as blank ones.
 *
 * @param firstName of the member
 * @param lastName of the member
 * @param email the invitation is sent to
 * @param doctor whether the member holds a doctorate, {@code null} when unknown
 * @param institution employing the member
 * @param city of the institution
 * @param country code of the institution
 * @param language of the messages sent to the member
 */
public record ExternalMember(
    String firstName,
    String lastName,
    String email,
    Boolean doctor,
    String institution,
    String city,
    String country,
    String language)
    implements Serializable {
  @Serial private static final long serialVersionUID = -4290314578829165307L;

  public ExternalMember {
    firstName = blankIfNull(firstName);
    lastName = blankIfNull(lastName);
    email = blankIfNull(email);
    institution = blankIfNull(institution);
    city = blankIfNull(city);
    country = blankIfNull(country);
    language = blankIfNull(language);
  }

  private static String blankIfNull(final String value) {
    return value == null ? "" : value;
  }
}
