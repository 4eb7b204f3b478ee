package io.github.admission.ddd.cqrs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import io.github.admission.ddd.authorization.DomainClient;
import io.github.admission.test.BackOfficeClient;
import io.github.admission.test.EmptyDomainMessage;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class DomainMessageTest {
  @Test
  void when_message_created_without_client_message_gets_anonymous_client() {
    final var message = EmptyDomainMessage.create();

    assertNotNull(message.domainClient());
    assertEquals("ANONYMOUS", message.domainClient().domainRole());
  }

  @Test
  void when_message_carries_a_client_that_client_is_used() {
    final var message =
        new ExplicitClientDomainMessage(
            UUID.randomUUID(), Instant.now(), BackOfficeClient.REGISTRAR);

    assertSame(BackOfficeClient.REGISTRAR, message.domainClient());
    assertEquals("REGISTRAR", message.domainClient().domainRole());
  }

  /**
   * @param messageId to fulfill {@link DomainMessage#messageId()} contract
   * @param createdAt to fulfill {@link DomainMessage#createdAt()} contract
   * @param domainClient to explicitly fulfill {@link DomainMessage#domainClient()} contract
   */
  record ExplicitClientDomainMessage(UUID messageId, Instant createdAt, DomainClient domainClient)
      implements DomainMessage<UUID, Instant> {}
}
