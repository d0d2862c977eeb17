package com.health.misinfo.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Centrality of one account in the interaction graph")
public class NodeRankingEntry {

    @Schema(description = "1-based position in the ranking", example = "1")
    private int rank;

    @Schema(description = "Account id", example = "user_1")
    private String nodeId;

    @Schema(description = "Number of distinct neighbors", example = "8")
    private int degree;

    @Schema(description = "Sum of incident edge weights", example = "21.0")
    private double weightedDegree;

    @Schema(description = "Normalized degree centrality, degree / (n - 1)", example = "0.421")
    private double centrality;

    @Schema(description = "Tier relative to the current node population", example = "HIGH")
    private RiskLevel riskLevel;
}
