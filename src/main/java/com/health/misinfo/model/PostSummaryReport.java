package com.health.misinfo.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Aggregate view over the tracked posts matching a query")
public class PostSummaryReport {

    @Schema(description = "Generation time, epoch milliseconds")
    private long generatedAt;

    private int totalPosts;

    @Schema(description = "Posts per risk tier")
    private Map<RiskLevel, Integer> postsByRiskLevel;

    @Schema(description = "Posts scoring above the high-risk alert score")
    private int highRiskPosts;

    private int archivedPosts;

    @Schema(description = "Distinct authors among the matching posts")
    private int activeSpreaders;

    private Map<String, Integer> postsByPlatform;

    private Map<String, Integer> postsByCategory;

    private Map<String, Integer> postsByStatus;

    private List<NodeRankingEntry> topSpreaders;
}
