package io.github.admission.ddd.validation;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.Serial;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ValidatorListTest {
  static final BusinessValidator<Integer> POSITIVE =
      BusinessValidator.of(value -> value > 0, () -> new TestException("POSITIVE"));
  static final BusinessValidator<Integer> EVEN =
      BusinessValidator.of(value -> value % 2 == 0, () -> new TestException("EVEN"));
  static final BusinessValidator<Integer> SMALL =
      BusinessValidator.of(value -> Math.abs(value) < 10, () -> new TestException("SMALL"));

  static final ValidatorList<Integer> VALIDATORS = ValidatorList.of(POSITIVE, EVEN, SMALL);

  @Test
  void violations_are_listed_in_declaration_order() {
    assertTrue(VALIDATORS.violations(4).isEmpty());
    assertEquals(
        List.of("POSITIVE", "SMALL"),
        VALIDATORS.violations(-12).stream().map(BusinessException::getCode).toList());
  }

  @Test
  void validators_appended_with_and_then_run_after_the_existing_ones() {
    final var combined = ValidatorList.of(SMALL).andThen(ValidatorList.of(POSITIVE, EVEN));

    assertEquals(
        List.of("SMALL", "POSITIVE", "EVEN"),
        combined.violations(-11).stream().map(BusinessException::getCode).toList());
  }

  @Nested
  class FailFast {
    @Test
    void when_every_validator_passes_nothing_is_thrown() {
      assertDoesNotThrow(() -> VALIDATORS.failFast(2));
    }

    @Test
    void first_violation_is_thrown_as_is() {
      final var exception = assertThrows(TestException.class, () -> VALIDATORS.failFast(-12));
      assertEquals("POSITIVE", exception.getCode());
    }
  }

  @Nested
  class Accumulate {
    @Test
    void when_every_validator_passes_nothing_is_thrown() {
      assertDoesNotThrow(() -> VALIDATORS.accumulate(8));
    }

    @Test
    void every_violation_is_reported_at_once() {
      final var exception =
          assertThrows(MultipleBusinessExceptions.class, () -> VALIDATORS.accumulate(-13));

      assertEquals(3, exception.getExceptions().size());
      exception.getExceptions().forEach(e -> assertInstanceOf(TestException.class, e));
      assertEquals("POSITIVE: broken; EVEN: broken; SMALL: broken", exception.getMessage());
    }
  }

  static final class TestException extends BusinessException {
    @Serial private static final long serialVersionUID = 1L;

    TestException(final String code) {
      super(code, "broken");
    }
  }
}
