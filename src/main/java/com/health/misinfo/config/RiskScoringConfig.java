package com.health.misinfo.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "risk")
public class RiskScoringConfig {

    // Score at or above which a post is HIGH risk
    private double highThreshold = 70.0;

    // Score at or above which a post is MEDIUM risk (must stay below highThreshold)
    private double mediumThreshold = 40.0;

    // Points contributed by verification status severity (0-1) and by engagement (0-1).
    // Together they must not exceed 100.
    private double statusPoints = 50.0;
    private double engagementPoints = 50.0;

    // Posts above this score are counted as "high risk" in summary reports
    private double highRiskAlertScore = 85.0;

    // Default size of the archival recovery queue
    private int recoveryQueueSize = 5;

    // Per-metric weight (weights sum to 1) and the reference count at which the
    // metric's signal saturates at 1.0. Signals grow with log10(1 + count).
    private Engagement engagement = new Engagement();

    @Data
    public static class Engagement {
        private double sharesWeight = 0.5;
        private long sharesReference = 10_000;
        private double viewsWeight = 0.2;
        private long viewsReference = 100_000;
        private double commentsWeight = 0.2;
        private long commentsReference = 1_000;
        private double likesWeight = 0.1;
        private long likesReference = 10_000;
    }
}
