package io.intellixity.semantiq.server.web;

import io.intellixity.semantiq.governance.GovernedQueryService;
import io.intellixity.semantiq.model.Relationship;
import io.intellixity.semantiq.planner.plan.RelationshipDraft;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/data-modeling/relationships")
public final class RelationshipController {
  private final GovernedQueryService queries;

  public RelationshipController(GovernedQueryService queries) {
    this.queries = queries;
  }

  /** {@code relationshipType} carries the cardinality code ({@code 1-n}, {@code n-1}, ...). */
  public record UpsertRelationshipRequest(String dataModelId,
                                          String fromTableId,
                                          String fromColumn,
                                          String toTableId,
                                          String toColumn,
                                          String relationshipType,
                                          String crossFilterDirection) {
    RelationshipDraft toDraft() {
      return new RelationshipDraft(dataModelId, fromTableId, fromColumn, toTableId, toColumn,
          relationshipType, crossFilterDirection);
    }
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  public ApiResponse<Relationship> upsert(@RequestBody UpsertRelationshipRequest request) {
    return ApiResponse.ok(queries.upsertRelationship(request.toDraft()));
  }
}
