package org.carball.queryopt.model.query;

public enum QueryComplexity {
    LOW(0, 1),
    MEDIUM(2, 4),
    HIGH(5, Integer.MAX_VALUE);

    private final int minScore;
    private final int maxScore;

    QueryComplexity(int minScore, int maxScore) {
        this.minScore = minScore;
        this.maxScore = maxScore;
    }

    public static QueryComplexity fromScore(int score) {
        if (score <= LOW.maxScore) {
            return LOW;
        } else if (score <= MEDIUM.maxScore) {
            return MEDIUM;
        } else {
            return HIGH;
        }
    }
}
