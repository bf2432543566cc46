package org.carball.queryopt.model.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

public enum OpportunityType {
    CACHING("CACHING"),
    INDEXING("INDEXING"),
    N_PLUS_ONE_QUERIES("N+1_QUERIES"),
    MISSING_INDEXES("MISSING_INDEXES"),
    SLOW_QUERIES("SLOW_QUERIES"),
    INEFFICIENT_PATTERNS("INEFFICIENT_PATTERNS");

    private final String label;

    OpportunityType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
