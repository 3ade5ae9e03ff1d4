package io.intellixity.semantiq.planner.catalog;

import io.intellixity.semantiq.error.ErrorCode;
import io.intellixity.semantiq.error.SemanticQueryException;
import io.intellixity.semantiq.model.Cardinality;
import io.intellixity.semantiq.model.ModelTable;
import io.intellixity.semantiq.model.RuntimeEngine;
import io.intellixity.semantiq.model.ValidationStatus;
import io.intellixity.semantiq.planner.Fixtures;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class RelationshipValidatorTest {
  private final RelationshipValidator validator = new RelationshipValidator();

  private static ModelTable table(String name, RuntimeEngine engine, String ref, String... cols) {
    return new ModelTable(name, "dm", name, name, "s", "c", engine.id(), engine, ref, true, null, Fixtures.cols(cols));
  }

  private final ModelTable orders = table("orders", RuntimeEngine.POSTGRES, "\"s\".\"orders\"", "customer_id", "int", "note", "text");
  private final ModelTable customers = table("customers", RuntimeEngine.POSTGRES, "\"s\".\"customers\"", "id", "bigint");

  @Test
  void validWhenTypesShareFamily() {
    RelationshipValidator.Result r = validator.validate(orders, "CUSTOMER_ID", customers, "id", Cardinality.MANY_TO_ONE);
    assertEquals(ValidationStatus.VALID, r.status());
    assertNull(r.reason());
  }

  @Test
  void missingColumnIsRequestError() {
    SemanticQueryException e = assertThrows(SemanticQueryException.class,
        () -> validator.validate(orders, "nope", customers, "id", Cardinality.ONE_TO_MANY));
    assertEquals(ErrorCode.INVALID_RELATIONSHIP, e.code());
  }

  @Test
  void manyToManyIsStoredInvalid() {
    RelationshipValidator.Result r = validator.validate(orders, "customer_id", customers, "id", Cardinality.MANY_TO_MANY);
    assertEquals(ValidationStatus.INVALID, r.status());
    assertEquals(RelationshipValidator.REASON_MANY_TO_MANY, r.reason());
  }

  @Test
  void crossEngineIsInvalid() {
    ModelTable events = table("events", RuntimeEngine.BIGQUERY, "`p.d.events`", "customer_id", "INT64");
    assertEquals(RelationshipValidator.REASON_CROSS_SOURCE,
        validator.validate(events, "customer_id", customers, "id", Cardinality.MANY_TO_ONE).reason());
  }

  @Test
  void missingRuntimeRefIsInvalid() {
    ModelTable pending = table("pending", RuntimeEngine.POSTGRES, null, "id", "int");
    assertEquals(RelationshipValidator.REASON_NO_RUNTIME_REF,
        validator.validate(orders, "customer_id", pending, "id", Cardinality.MANY_TO_ONE).reason());
  }

  @Test
  void typeFamilyMismatchIsInvalid() {
    assertEquals(RelationshipValidator.REASON_TYPE_MISMATCH,
        validator.validate(orders, "note", customers, "id", Cardinality.MANY_TO_ONE).reason());
  }
}
