package org.carball.queryopt.model.query;

import java.util.EnumSet;
import java.util.Set;

/**
 * Business category of a statement, used for per-category reporting and index suggestions.
 */
public enum QueryCategory {
    QR_VALIDATION,
    CHECK_IN,
    TICKET_VALIDATION,
    TICKET_LOOKUP,
    EVENT_STATISTICS,
    INVENTORY_CHECK,
    GENERAL;

    private static final Set<QueryCategory> INDEX_SENSITIVE =
            EnumSet.of(QR_VALIDATION, TICKET_LOOKUP, CHECK_IN, TICKET_VALIDATION);

    /**
     * Whether a slow execution in this category should produce an index suggestion.
     */
    public boolean isIndexSensitive() {
        return INDEX_SENSITIVE.contains(this);
    }
}
