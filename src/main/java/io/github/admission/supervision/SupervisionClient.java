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

package io.github.admission.supervision;

import io.github.admission.ddd.authorization.DomainClient;
import java.io.Serial;

/**
 * Person acting on a supervision group.
 *
 * @param personId of the authenticated person
 * @param role under which the person acts
 */
public record SupervisionClient(String personId, Role role) implements DomainClient {
  @Serial private static final long serialVersionUID = -1187310577120654233L;

  public enum Role {
    /** Author of the proposition. */
    CANDIDATE,
    /** Promoter or CA member asked to sign. */
    SIGNATORY,
    /** Administrative staff acting for the candidate. */
    MANAGER
  }

  public SupervisionClient {
    if (personId == null || personId.isBlank()) {
      throw new IllegalArgumentException("Person ID cannot be blank");
    }

    if (role == null) {
      throw new IllegalArgumentException("Role cannot be null");
    }
  }

  public static SupervisionClient candidate(final String personId) {
    return new SupervisionClient(personId, Role.CANDIDATE);
  }

  public static SupervisionClient signatory(final String personId) {
    return new SupervisionClient(personId, Role.SIGNATORY);
  }

  public static SupervisionClient manager(final String personId) {
    return new SupervisionClient(personId, Role.MANAGER);
  }

  /** {@inheritDoc} */
  @Override
  public String domainRole() {
    return role.name();
  }

  /**
   * @return {@code true} for candidates and managers acting for them
   */
  public boolean actsForCandidate() {
    return role == Role.CANDIDATE || role == Role.MANAGER;
  }

  /**
   * @param signatoryId named in a decision
   * @return {@code true} when this client is that signatory
   */
  public boolean isSignatory(final String signatoryId) {
    return role == Role.SIGNATORY && personId.equals(signatoryId);
  }
}
