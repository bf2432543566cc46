package org.carball.queryopt.model.analysis;

import java.time.Instant;
import java.util.List;

/**
 * Result of a deep analysis pass. Also the payload of deep-analysis events.
 */
public record DeepAnalysisResult(
        Instant timestamp,
        int totalUniqueQueries,
        List<OptimizationOpportunity> optimizationOpportunities,
        List<String> indexRecommendations
) {

    public DeepAnalysisResult {
        optimizationOpportunities = List.copyOf(optimizationOpportunities);
        indexRecommendations = List.copyOf(indexRecommendations);
    }
}
