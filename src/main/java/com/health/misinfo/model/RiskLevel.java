package com.health.misinfo.model;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    /**
     * Tier for a 0-100 score. The two thresholds split the range into
     * [0, medium), [medium, high) and [high, 100].
     */
    public static RiskLevel fromScore(double score, double highThreshold, double mediumThreshold) {
        if (score >= highThreshold) return HIGH;
        if (score >= mediumThreshold) return MEDIUM;
        return LOW;
    }
}
