package io.github.admission.ddd.authorization;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import org.junit.jupiter.api.Test;

class UnauthorizedExceptionTest {
  @Test
  void must_have_forbidden_http_status_code() {
    assertEquals(403, new UnauthorizedException().getStatusCode());
  }

  @Test
  void message_and_cause_are_kept() {
    final var cause = new IllegalStateException("cause");
    final var exception = new UnauthorizedException("refused", cause);

    assertEquals("refused", exception.getMessage());
    assertSame(cause, exception.getCause());
  }
}
