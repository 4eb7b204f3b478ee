package io.github.admission.supervision;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class SupervisionClientTest {
  @Test
  void when_person_or_role_is_missing_illegal_argument_exception_is_thrown() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new SupervisionClient(null, SupervisionClient.Role.CANDIDATE));
    assertThrows(
        IllegalArgumentException.class,
        () -> new SupervisionClient(" ", SupervisionClient.Role.CANDIDATE));
    assertThrows(IllegalArgumentException.class, () -> new SupervisionClient("p1", null));
  }

  @Test
  void domain_role_is_the_role_name() {
    assertEquals("CANDIDATE", SupervisionClient.candidate("c1").domainRole());
    assertEquals("SIGNATORY", SupervisionClient.signatory("p1").domainRole());
    assertEquals("MANAGER", SupervisionClient.manager("m1").domainRole());
  }

  @Test
  void candidates_and_managers_act_for_the_candidate() {
    assertTrue(SupervisionClient.candidate("c1").actsForCandidate());
    assertTrue(SupervisionClient.manager("m1").actsForCandidate());
    assertFalse(SupervisionClient.signatory("p1").actsForCandidate());
  }

  @Test
  void only_a_signatory_with_the_same_person_id_is_that_signatory() {
    assertTrue(SupervisionClient.signatory("p1").isSignatory("p1"));
    assertFalse(SupervisionClient.signatory("p1").isSignatory("p2"));
    assertFalse(SupervisionClient.candidate("p1").isSignatory("p1"));
    assertFalse(SupervisionClient.manager("p1").isSignatory("p1"));
  }
}
