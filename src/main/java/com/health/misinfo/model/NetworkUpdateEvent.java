package com.health.misinfo.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Changes between two successive interaction graph snapshots")
public class NetworkUpdateEvent {

    @Schema(description = "Monotonically increasing event number", example = "4")
    private long sequence;

    @Schema(description = "When the new snapshot was published, epoch milliseconds", example = "1739886764000")
    private long occurredAt;

    private List<String> addedNodes;

    private List<String> removedNodes;

    private List<InteractionEdge> addedEdges;

    private List<InteractionEdge> removedEdges;

    @Schema(description = "Edges present in both snapshots whose merged weight changed; weight is the new value")
    private List<InteractionEdge> reweightedEdges;

    @Schema(description = "Node count of the new snapshot", example = "20")
    private int nodeCount;

    @Schema(description = "Edge count of the new snapshot", example = "31")
    private int edgeCount;

    @JsonIgnore
    public boolean isEmpty() {
        return addedNodes.isEmpty() && removedNodes.isEmpty()
                && addedEdges.isEmpty() && removedEdges.isEmpty() && reweightedEdges.isEmpty();
    }
}
