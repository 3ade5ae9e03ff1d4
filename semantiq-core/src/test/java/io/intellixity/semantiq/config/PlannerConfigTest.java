package io.intellixity.semantiq.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class PlannerConfigTest {
  @Test
  void clampsLimit() {
    PlannerConfig c = PlannerConfig.defaults();
    assertEquals(1000, c.effectiveLimit(null));
    assertEquals(1, c.effectiveLimit(0));
    assertEquals(1, c.effectiveLimit(-20));
    assertEquals(5000, c.effectiveLimit(999_999));
    assertEquals(42, c.effectiveLimit(42));
  }

  @Test
  void rejectsInconsistentBounds() {
    assertThrows(IllegalArgumentException.class, () -> new PlannerConfig(10, 5, 60, false));
    assertThrows(IllegalArgumentException.class, () -> new PlannerConfig(1, 5, 0, false));
  }
}
