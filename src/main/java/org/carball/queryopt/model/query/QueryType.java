package org.carball.queryopt.model.query;

public enum QueryType {
    SELECT,
    INSERT,
    UPDATE,
    DELETE,
    OTHER
}
