package com.health.misinfo.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Visualization-ready view of the spread network: positioned nodes and weighted edges
 * with display sizing precomputed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NetworkGraph {

    private String algorithm;
    private int minConnections;
    private List<NetworkNode> nodes;
    private List<NetworkEdge> edges;
    private NetworkStatistics statistics;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class NetworkNode {
        private String id;
        private String label;   // "user_15" -> "U15"
        private double x;
        private double y;
        private int degree;
        private double centrality;
        private double size;
        private RiskLevel riskLevel;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class NetworkEdge {
        private String from;
        private String to;
        private double weight;
        private double width;
        private double opacity;
    }
}
