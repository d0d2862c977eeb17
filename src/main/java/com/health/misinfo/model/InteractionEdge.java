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
@Schema(description = "A weighted interaction between two accounts that shared related content")
public class InteractionEdge {

    @Schema(description = "Source account identifier", example = "user_1")
    private String sourceId;

    @Schema(description = "Target account identifier", example = "user_7")
    private String targetId;

    @Schema(description = "Shared-content weight, at least 1", example = "3")
    private double weight;

    public static InteractionEdge of(String sourceId, String targetId, double weight) {
        return new InteractionEdge(sourceId, targetId, weight);
    }
}
