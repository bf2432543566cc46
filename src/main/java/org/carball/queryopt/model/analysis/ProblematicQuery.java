package org.carball.queryopt.model.analysis;

import org.carball.queryopt.model.query.QueryCategory;

public record ProblematicQuery(
        String queryId,
        String sql,
        QueryCategory category,
        double avgTime,
        long totalExecutions
) {}
