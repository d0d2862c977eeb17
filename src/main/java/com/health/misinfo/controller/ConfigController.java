package com.health.misinfo.controller;

import com.health.misinfo.config.GraphConfig;
import com.health.misinfo.config.RiskScoringConfig;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View and modify runtime configuration (scoring thresholds, ranking tiers, layout)")
public class ConfigController {

    private final RiskScoringConfig scoringConfig;
    private final GraphConfig graphConfig;

    public ConfigController(RiskScoringConfig scoringConfig, GraphConfig graphConfig) {
        this.scoringConfig = scoringConfig;
        this.graphConfig = graphConfig;
    }

    // ── Scoring ──

    @Operation(summary = "Get risk scoring configuration")
    @GetMapping("/scoring")
    public ResponseEntity<Map<String, Object>> getScoringConfig() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("highThreshold", scoringConfig.getHighThreshold());
        body.put("mediumThreshold", scoringConfig.getMediumThreshold());
        body.put("statusPoints", scoringConfig.getStatusPoints());
        body.put("engagementPoints", scoringConfig.getEngagementPoints());
        body.put("highRiskAlertScore", scoringConfig.getHighRiskAlertScore());
        body.put("recoveryQueueSize", scoringConfig.getRecoveryQueueSize());
        return ResponseEntity.ok(body);
    }

    @Operation(summary = "Update risk scoring configuration",
            description = "Changes apply immediately but reset on restart.")
    @PutMapping("/scoring")
    public ResponseEntity<?> updateScoringConfig(@RequestBody Map<String, Object> body) {
        double high = toDouble(body, "highThreshold", scoringConfig.getHighThreshold());
        double medium = toDouble(body, "mediumThreshold", scoringConfig.getMediumThreshold());
        double statusPts = toDouble(body, "statusPoints", scoringConfig.getStatusPoints());
        double engagementPts = toDouble(body, "engagementPoints", scoringConfig.getEngagementPoints());
        double alert = toDouble(body, "highRiskAlertScore", scoringConfig.getHighRiskAlertScore());
        int queueSize = toInt(body, "recoveryQueueSize", scoringConfig.getRecoveryQueueSize());

        if (!Double.isFinite(high)) return badRequest("highThreshold must be a finite number", "highThreshold");
        if (!Double.isFinite(medium)) return badRequest("mediumThreshold must be a finite number", "mediumThreshold");
        if (!Double.isFinite(statusPts)) return badRequest("statusPoints must be a finite number", "statusPoints");
        if (!Double.isFinite(engagementPts)) return badRequest("engagementPoints must be a finite number", "engagementPoints");
        if (!Double.isFinite(alert)) return badRequest("highRiskAlertScore must be a finite number", "highRiskAlertScore");
        if (medium < 0) return badRequest("mediumThreshold must be >= 0", "mediumThreshold");
        if (high > 100) return badRequest("highThreshold must be <= 100", "highThreshold");
        if (medium >= high) return badRequest("mediumThreshold must be less than highThreshold", "mediumThreshold");
        if (statusPts < 0) return badRequest("statusPoints must be >= 0", "statusPoints");
        if (engagementPts < 0) return badRequest("engagementPoints must be >= 0", "engagementPoints");
        if (statusPts + engagementPts > 100) return badRequest("statusPoints + engagementPoints must be <= 100", "engagementPoints");
        if (alert < 0 || alert > 100) return badRequest("highRiskAlertScore must be in [0, 100]", "highRiskAlertScore");
        if (queueSize < 0) return badRequest("recoveryQueueSize must be >= 0", "recoveryQueueSize");

        scoringConfig.setHighThreshold(high);
        scoringConfig.setMediumThreshold(medium);
        scoringConfig.setStatusPoints(statusPts);
        scoringConfig.setEngagementPoints(engagementPts);
        scoringConfig.setHighRiskAlertScore(alert);
        scoringConfig.setRecoveryQueueSize(queueSize);

        return getScoringConfig();
    }

    // ── Graph ──

    @Operation(summary = "Get graph ranking and layout configuration")
    @GetMapping("/graph")
    public ResponseEntity<Map<String, Object>> getGraphConfig() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("refreshMs", graphConfig.getRefreshMs());
        body.put("defaultSeed", graphConfig.getDefaultSeed());
        body.put("includePostAuthors", graphConfig.isIncludePostAuthors());
        body.put("defaultTopN", graphConfig.getRanking().getDefaultTopN());
        body.put("highFraction", graphConfig.getRanking().getHighFraction());
        body.put("mediumFraction", graphConfig.getRanking().getMediumFraction());
        body.put("springK", graphConfig.getLayout().getSpringK());
        body.put("springIterations", graphConfig.getLayout().getSpringIterations());
        body.put("defaultMinConnections", graphConfig.getLayout().getDefaultMinConnections());
        return ResponseEntity.ok(body);
    }

    @Operation(summary = "Update graph ranking and layout configuration",
            description = "Changes apply to the next request but reset on restart.")
    @PutMapping("/graph")
    public ResponseEntity<?> updateGraphConfig(@RequestBody Map<String, Object> body) {
        int topN = toInt(body, "defaultTopN", graphConfig.getRanking().getDefaultTopN());
        double highFraction = toDouble(body, "highFraction", graphConfig.getRanking().getHighFraction());
        double mediumFraction = toDouble(body, "mediumFraction", graphConfig.getRanking().getMediumFraction());
        double springK = toDouble(body, "springK", graphConfig.getLayout().getSpringK());
        int iterations = toInt(body, "springIterations", graphConfig.getLayout().getSpringIterations());
        int minConnections = toInt(body, "defaultMinConnections", graphConfig.getLayout().getDefaultMinConnections());

        if (!Double.isFinite(highFraction)) return badRequest("highFraction must be a finite number", "highFraction");
        if (!Double.isFinite(mediumFraction)) return badRequest("mediumFraction must be a finite number", "mediumFraction");
        if (!Double.isFinite(springK)) return badRequest("springK must be a finite number", "springK");
        if (topN < 1) return badRequest("defaultTopN must be >= 1", "defaultTopN");
        if (highFraction <= 0 || highFraction > 1) return badRequest("highFraction must be in (0, 1]", "highFraction");
        if (mediumFraction < highFraction || mediumFraction > 1)
            return badRequest("mediumFraction must be in [highFraction, 1]", "mediumFraction");
        if (springK <= 0) return badRequest("springK must be > 0", "springK");
        if (iterations < 1) return badRequest("springIterations must be >= 1", "springIterations");
        if (minConnections < 0) return badRequest("defaultMinConnections must be >= 0", "defaultMinConnections");

        graphConfig.getRanking().setDefaultTopN(topN);
        graphConfig.getRanking().setHighFraction(highFraction);
        graphConfig.getRanking().setMediumFraction(mediumFraction);
        graphConfig.getLayout().setSpringK(springK);
        graphConfig.getLayout().setSpringIterations(iterations);
        graphConfig.getLayout().setDefaultMinConnections(minConnections);

        return getGraphConfig();
    }

    // ── Helpers ──

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }

    private double toDouble(Map<String, Object> body, String key, double defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.doubleValue();
        try { return Double.parseDouble(v.toString()); } catch (NumberFormatException e) { return defaultVal; }
    }

    private int toInt(Map<String, Object> body, String key, int defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.intValue();
        try { return Integer.parseInt(v.toString()); } catch (NumberFormatException e) { return defaultVal; }
    }
}
