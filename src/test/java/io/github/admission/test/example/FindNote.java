package io.github.admission.test.example;

import io.github.admission.ddd.authorization.AnonymousDomainClient;
import io.github.admission.ddd.authorization.DomainClient;
import io.github.admission.ddd.cqrs.DomainQuery;
import java.time.Instant;
import java.util.UUID;

public record FindNote(UUID messageId, Instant createdAt, DomainClient domainClient, UUID noteId)
    implements DomainQuery.One<UUID, Instant> {
  public static FindNote of(final DomainClient domainClient, final UUID noteId) {
    return new FindNote(UUID.randomUUID(), Instant.now(), domainClient, noteId);
  }

  public static FindNote of(final UUID noteId) {
    return of(AnonymousDomainClient.getInstance(), noteId);
  }
}
