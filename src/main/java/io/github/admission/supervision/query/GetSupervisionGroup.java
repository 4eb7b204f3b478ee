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

import io.github.admission.ddd.authorization.DomainClient;
import io.github.admission.ddd.cqrs.DomainQuery;
import io.github.admission.supervision.domain.model.PropositionIdentity;
import java.io.Serial;
import java.time.Instant;
import java.util.UUID;

/**
 * @param messageId of the query
 * @param createdAt when the query was issued
 * @param domainClient issuing the query
 * @param propositionId owning the group to read
 */
public record GetSupervisionGroup(
    UUID messageId, Instant createdAt, DomainClient domainClient, PropositionIdentity propositionId)
    implements DomainQuery.One<UUID, Instant> {
  @Serial private static final long serialVersionUID = -2415092377150318520L;

  public GetSupervisionGroup {
    if (messageId == null || createdAt == null || domainClient == null) {
      throw new IllegalArgumentException("Query is missing mandatory values");
    }

    if (propositionId == null) {
      throw new IllegalArgumentException("Proposition ID cannot be null");
    }
  }

  public static GetSupervisionGroup of(
      final DomainClient domainClient, final PropositionIdentity propositionId) {
    return new GetSupervisionGroup(UUID.randomUUID(), Instant.now(), domainClient, propositionId);
  }
}
