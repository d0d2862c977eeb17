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
@Schema(description = "Misinformation risk score of a single post")
public class PostRiskScore {

    @Schema(description = "Scored post id", example = "POST_0001")
    private String postId;

    @Schema(description = "Misinformation score (0-100). LOW < 40, MEDIUM 40-70, HIGH >= 70", example = "75.0")
    private double misinformationScore;

    @Schema(description = "Risk tier derived from the score", example = "HIGH")
    private RiskLevel riskLevel;

    @Schema(description = "Normalized engagement signal (0-1)", example = "0.5")
    private double engagementScore;

    @Schema(description = "Severity of the verification status (0-1)", example = "1.0")
    private double statusSeverity;
}
