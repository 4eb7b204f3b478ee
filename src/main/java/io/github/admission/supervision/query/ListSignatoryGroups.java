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
import java.io.Serial;
import java.time.Instant;
import java.util.UUID;

/**
 * Groups in which a person is asked to sign, as a promoter or as a CA member.
 *
 * @param messageId of the query
 * @param createdAt when the query was issued
 * @param domainClient issuing the query
 * @param personId of the signatory
 */
public record ListSignatoryGroups(
    UUID messageId, Instant createdAt, DomainClient domainClient, String personId)
    implements DomainQuery.Many<UUID, Instant> {
  @Serial private static final long serialVersionUID = 3342815090167423377L;

  public ListSignatoryGroups {
    if (messageId == null || createdAt == null || domainClient == null) {
      throw new IllegalArgumentException("Query is missing mandatory values");
    }

    if (personId == null || personId.isBlank()) {
      throw new IllegalArgumentException("Person ID cannot be blank");
    }
  }

  public static ListSignatoryGroups of(final DomainClient domainClient, final String personId) {
    return new ListSignatoryGroups(UUID.randomUUID(), Instant.now(), domainClient, personId);
  }
}
