package io.intellixity.semantiq.planner.plan;

/**
 * Caller input for creating or updating a relationship. Table refs accept model-table or physical-table ids;
 * cardinality and direction are codes ({@code 1-n}, {@code both}, ...), defaulted when unknown.
 */
public record RelationshipDraft(String dataModelId,
                                String fromTableId,
                                String fromColumn,
                                String toTableId,
                                String toColumn,
                                String cardinality,
                                String crossFilterDirection) {}
