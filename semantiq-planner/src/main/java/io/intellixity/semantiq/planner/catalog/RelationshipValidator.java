package io.intellixity.semantiq.planner.catalog;

import io.intellixity.semantiq.error.ErrorCode;
import io.intellixity.semantiq.error.SemanticQueryException;
import io.intellixity.semantiq.model.Cardinality;
import io.intellixity.semantiq.model.ColumnDef;
import io.intellixity.semantiq.model.ModelTable;
import io.intellixity.semantiq.model.ValidationStatus;

/**
 * Decides whether a relationship can be traversed by the planner.
 * <p>
 * Columns that do not exist are a request error; every other problem yields an {@code invalid}
 * relationship that is stored but never joined on.
 */
public final class RelationshipValidator {
  public static final String REASON_MANY_TO_MANY = "n-n relationship is not executable by semantic planner";
  public static final String REASON_CROSS_SOURCE = "Cross-source relationship cannot be executed at runtime";
  public static final String REASON_NO_RUNTIME_REF = "One or more tables do not have runtime references";
  public static final String REASON_TYPE_MISMATCH = "Column datatype mismatch";

  public record Result(ValidationStatus status, String reason) {
    static Result valid() { return new Result(ValidationStatus.VALID, null); }
    static Result invalid(String reason) { return new Result(ValidationStatus.INVALID, reason); }
  }

  public Result validate(ModelTable from, String fromColumn, ModelTable to, String toColumn, Cardinality cardinality) {
    ColumnDef fc = from.findColumnIgnoreCase(fromColumn);
    ColumnDef tc = to.findColumnIgnoreCase(toColumn);
    if (fc == null || tc == null) {
      throw new SemanticQueryException(ErrorCode.INVALID_RELATIONSHIP, "Column does not exist in selected table schema");
    }

    if (cardinality == Cardinality.MANY_TO_MANY) return Result.invalid(REASON_MANY_TO_MANY);
    if (from.runtimeEngine() != to.runtimeEngine()) return Result.invalid(REASON_CROSS_SOURCE);
    if (blank(from.runtimeRef()) || blank(to.runtimeRef())) return Result.invalid(REASON_NO_RUNTIME_REF);
    if (!fc.typeFamily().equals(tc.typeFamily())) return Result.invalid(REASON_TYPE_MISMATCH);
    return Result.valid();
  }

  private static boolean blank(String s) {
    return s == null || s.isBlank();
  }
}
