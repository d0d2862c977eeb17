package com.health.misinfo.controller;

import com.health.misinfo.config.GraphConfig;
import com.health.misinfo.model.LayoutAlgorithm;
import com.health.misinfo.model.NetworkGraph;
import com.health.misinfo.model.PostQuery;
import com.health.misinfo.model.PostSummaryReport;
import com.health.misinfo.model.ScoreBucket;
import com.health.misinfo.model.TimelinePoint;
import com.health.misinfo.model.TopicCount;
import com.health.misinfo.service.AnalyticsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/analytics")
@Tag(name = "Analytics", description = "Post summaries, timelines, score distribution and network visualization data")
public class AnalyticsController {

    private final AnalyticsService analyticsService;
    private final GraphConfig graphConfig;

    public AnalyticsController(AnalyticsService analyticsService, GraphConfig graphConfig) {
        this.analyticsService = analyticsService;
        this.graphConfig = graphConfig;
    }

    @GetMapping("/summary")
    @Operation(summary = "Get summary report",
               description = "Counts by risk tier, platform, category and status, archived posts, active spreaders and top spreaders")
    public ResponseEntity<PostSummaryReport> getSummary(
            @RequestParam(required = false) List<String> platform,
            @RequestParam(required = false) List<String> category,
            @RequestParam(defaultValue = "0") double minScore) {
        return ResponseEntity.ok(analyticsService.summary(query(platform, category, minScore)));
    }

    @GetMapping("/timeline")
    @Operation(summary = "Get posts per day")
    public ResponseEntity<List<TimelinePoint>> getTimeline(
            @RequestParam(required = false) List<String> platform,
            @RequestParam(required = false) List<String> category,
            @RequestParam(defaultValue = "0") double minScore) {
        return ResponseEntity.ok(analyticsService.timeline(query(platform, category, minScore)));
    }

    @GetMapping("/topics")
    @Operation(summary = "Get top misinformation topics", description = "Most repeated post contents, most frequent first")
    public ResponseEntity<List<TopicCount>> getTopTopics(
            @RequestParam(required = false) List<String> platform,
            @RequestParam(required = false) List<String> category,
            @RequestParam(defaultValue = "0") double minScore,
            @Parameter(description = "Number of topics", example = "7")
            @RequestParam(defaultValue = "7") int limit) {
        return ResponseEntity.ok(analyticsService.topTopics(query(platform, category, minScore), limit));
    }

    @GetMapping("/score-histogram")
    @Operation(summary = "Get score distribution", description = "Post counts per score bucket over [0, 100]")
    public ResponseEntity<List<ScoreBucket>> getScoreHistogram(
            @RequestParam(required = false) List<String> platform,
            @RequestParam(required = false) List<String> category,
            @RequestParam(defaultValue = "0") double minScore,
            @Parameter(description = "Bucket width", example = "10")
            @RequestParam(defaultValue = "10") double bucketWidth) {
        return ResponseEntity.ok(analyticsService.scoreHistogram(query(platform, category, minScore), bucketWidth));
    }

    @GetMapping("/network")
    @Operation(summary = "Get spread network for visualization",
               description = "Positioned, filtered nodes with sizes and risk tiers, and edges with display widths")
    public ResponseEntity<NetworkGraph> getNetwork(
            @Parameter(description = "Layout algorithm", example = "force-directed")
            @RequestParam(defaultValue = "force-directed") String algorithm,
            @RequestParam(required = false) Long seed,
            @Parameter(description = "Minimum connections to show", example = "2")
            @RequestParam(required = false) Integer minConnections) {
        int min = minConnections != null ? minConnections : graphConfig.getLayout().getDefaultMinConnections();
        return ResponseEntity.ok(analyticsService.getNetwork(LayoutAlgorithm.fromName(algorithm), seed, min));
    }

    private static PostQuery query(List<String> platform, List<String> category, double minScore) {
        return PostQuery.builder()
                .platforms(platform != null ? platform : List.of())
                .categories(category != null ? category : List.of())
                .minScore(minScore)
                .limit(Integer.MAX_VALUE)
                .build();
    }
}
