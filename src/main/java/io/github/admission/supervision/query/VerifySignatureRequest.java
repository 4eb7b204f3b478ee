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
import io.github.admission.supervision.domain.model.SupervisionGroupIdentity;
import java.io.Serial;
import java.time.Instant;
import java.util.UUID;

/**
 * Lists everything preventing the candidate from requesting signatures, without changing the
 * group.
 *
 * @param messageId of the query
 * @param createdAt when the query was issued
 * @param domainClient issuing the query
 * @param groupId of the group to check
 */
public record VerifySignatureRequest(
    UUID messageId, Instant createdAt, DomainClient domainClient, SupervisionGroupIdentity groupId)
    implements DomainQuery.Many<UUID, Instant> {
  @Serial private static final long serialVersionUID = -8832950071326651464L;

  public VerifySignatureRequest {
    if (messageId == null || createdAt == null || domainClient == null) {
      throw new IllegalArgumentException("Query is missing mandatory values");
    }

    if (groupId == null) {
      throw new IllegalArgumentException("Supervision group ID cannot be null");
    }
  }

  public static VerifySignatureRequest of(
      final DomainClient domainClient, final SupervisionGroupIdentity groupId) {
    return new VerifySignatureRequest(UUID.randomUUID(), Instant.now(), domainClient, groupId);
  }
}
