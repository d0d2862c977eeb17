package com.health.misinfo.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "graph")
public class GraphConfig {

    // How often the snapshot is rebuilt from the edge store (skipped when unchanged)
    private long refreshMs = 60_000;

    // Seed used when a caller does not pass one for a seeded layout
    private long defaultSeed = 42;

    // Max retained snapshot diffs in the update feed
    private int updateFeedCapacity = 100;

    // Include post authors as (possibly isolated) nodes of the graph
    private boolean includePostAuthors = true;

    private Ranking ranking = new Ranking();

    private Layout layout = new Layout();

    @Data
    public static class Ranking {
        private int defaultTopN = 10;
        // Cumulative population fractions: top 10% HIGH, next 20% MEDIUM
        private double highFraction = 0.10;
        private double mediumFraction = 0.30;
    }

    @Data
    public static class Layout {
        // Fruchterman-Reingold optimal distance and iteration count
        private double springK = 3.0;
        private int springIterations = 100;
        // Stress majorization stopping criteria
        private int stressMaxIterations = 300;
        private double stressTolerance = 1e-4;
        // Default minimum connections for the visualization network
        private int defaultMinConnections = 2;
    }
}
