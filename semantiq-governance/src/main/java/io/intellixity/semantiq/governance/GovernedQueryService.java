package io.intellixity.semantiq.governance;

import io.intellixity.semantiq.model.Relationship;
import io.intellixity.semantiq.plan.ExecutionResult;
import io.intellixity.semantiq.plan.QueryPlan;
import io.intellixity.semantiq.planner.plan.RelationshipDraft;
import io.intellixity.semantiq.planner.plan.SemanticQueryService;
import io.intellixity.semantiq.query.QueryRequest;

import java.util.Objects;

/**
 * Governance wrapper over {@link SemanticQueryService}.
 *
 * Tenant and requester come from the bound {@link GovernanceContext}, never from the request body.
 */
public final class GovernedQueryService {
  private final SemanticQueryService delegate;

  public GovernedQueryService(SemanticQueryService delegate) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
  }

  public QueryPlan plan(QueryRequest request) {
    GovernanceContext ctx = Governance.currentOrThrow();
    return delegate.plan(ctx.tenantId(), ctx.requester(), request);
  }

  public ExecutionResult execute(QueryRequest request) {
    GovernanceContext ctx = Governance.currentOrThrow();
    return delegate.execute(ctx.tenantId(), ctx.requester(), request);
  }

  public Relationship upsertRelationship(RelationshipDraft draft) {
    GovernanceContext ctx = Governance.currentOrThrow();
    return delegate.upsertRelationship(ctx.tenantId(), draft);
  }
}
