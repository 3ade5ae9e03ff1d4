package io.intellixity.semantiq.server.web;

import io.intellixity.semantiq.governance.GovernedQueryService;
import io.intellixity.semantiq.plan.ExecutionResult;
import io.intellixity.semantiq.plan.QueryPlan;
import io.intellixity.semantiq.query.QueryRequest;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/data-modeling/query")
public final class QueryController {
  private final GovernedQueryService queries;

  public QueryController(GovernedQueryService queries) {
    this.queries = queries;
  }

  @PostMapping("/plan")
  public ApiResponse<QueryPlan> plan(@RequestBody QueryRequest request) {
    return ApiResponse.ok(queries.plan(request));
  }

  /** Runs the planned statement, or the request's {@code rawSql} when present. */
  @PostMapping("/execute")
  public ApiResponse<ExecutionResult> execute(@RequestBody QueryRequest request) {
    return ApiResponse.ok(queries.execute(request));
  }
}
