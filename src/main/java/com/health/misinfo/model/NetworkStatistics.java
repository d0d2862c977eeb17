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
@Schema(description = "Aggregate statistics of a (filtered) interaction graph")
public class NetworkStatistics {

    @Schema(description = "Number of nodes", example = "12")
    private int nodeCount;

    @Schema(description = "Number of merged edges", example = "18")
    private int edgeCount;

    @Schema(description = "edgeCount / (n(n-1)/2), 0 when fewer than 2 nodes", example = "0.273")
    private double density;

    @Schema(description = "2 * edgeCount / nodeCount, 0 for an empty graph", example = "3.0")
    private double avgDegree;
}
