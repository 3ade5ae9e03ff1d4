package io.intellixity.semantiq.server.config;

import io.intellixity.semantiq.config.PlannerConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class SemantiqPropertiesTest {

  @Test
  void plannerDefaultsMatchPlannerConfigDefaults() {
    assertEquals(PlannerConfig.defaults(), new SemantiqProperties().getPlanner().toConfig());
  }

  @Test
  void plannerOverridesFlowIntoConfig() {
    SemantiqProperties props = new SemantiqProperties();
    props.getPlanner().setDefaultLimit(50);
    props.getPlanner().setMaxLimit(200);
    props.getPlanner().setStrictRlsBinding(true);

    PlannerConfig cfg = props.getPlanner().toConfig();
    assertEquals(50, cfg.effectiveLimit(null));
    assertEquals(200, cfg.effectiveLimit(10_000));
    assertTrue(cfg.strictRlsBinding());
  }

  @Test
  void inconsistentLimitsAreRejected() {
    SemantiqProperties props = new SemantiqProperties();
    props.getPlanner().setDefaultLimit(9000);
    assertThrows(IllegalArgumentException.class, () -> props.getPlanner().toConfig());
  }

  @Test
  void executionTimeoutDefaultsToThirtySeconds() {
    assertEquals(30, new SemantiqProperties().getExecution().getQueryTimeoutSeconds());
    assertEquals(10, new SemantiqProperties().getDatasource().getMaximumPoolSize());
  }
}
