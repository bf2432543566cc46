package org.carball.queryopt.model.analysis;

import java.util.List;

/**
 * A recommended improvement together with the statements it applies to.
 * Candidates are query identities, SQL shapes or index statements depending on the type.
 */
public record OptimizationOpportunity(
        OpportunityType type,
        Severity severity,
        String description,
        List<String> candidates
) {

    public OptimizationOpportunity {
        candidates = List.copyOf(candidates);
    }
}
