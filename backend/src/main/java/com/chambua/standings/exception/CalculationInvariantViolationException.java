package com.chambua.standings.exception;

import java.util.List;

/**
 * A computed table broke one of the standings invariants. The table is never published.
 */
public class CalculationInvariantViolationException extends StandingsException {

    private final List<String> violations;

    public CalculationInvariantViolationException(List<String> violations) {
        super("Table failed invariant checks: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() { return violations; }

    @Override
    public ErrorCategory getCategory() { return ErrorCategory.CONTACT_OPERATOR; }

    @Override
    public String getCode() { return "INVARIANT_VIOLATION"; }
}
