package org.carball.queryopt.model.analysis;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH
}
