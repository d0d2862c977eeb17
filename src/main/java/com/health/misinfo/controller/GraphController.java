package com.health.misinfo.controller;

import com.health.misinfo.config.GraphConfig;
import com.health.misinfo.model.FilteredNetwork;
import com.health.misinfo.model.InteractionEdge;
import com.health.misinfo.model.InteractionGraph;
import com.health.misinfo.model.LayoutAlgorithm;
import com.health.misinfo.model.NetworkUpdateEvent;
import com.health.misinfo.model.NodePosition;
import com.health.misinfo.model.NodeRankingEntry;
import com.health.misinfo.service.ContextGraphService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/graph")
@Tag(name = "Context Graph", description = "Interaction graph ingestion, super-spreader ranking, filtering and layout")
public class GraphController {

    private final ContextGraphService graphService;
    private final GraphConfig graphConfig;

    public GraphController(ContextGraphService graphService, GraphConfig graphConfig) {
        this.graphService = graphService;
        this.graphConfig = graphConfig;
    }

    @PostMapping("/edges")
    @Operation(summary = "Ingest interaction records",
               description = "Stores a batch of {sourceId, targetId, weight} records and rebuilds the graph. " +
                       "The batch is rejected as a whole if any record is a self-loop or has a weight below 1.")
    public ResponseEntity<Map<String, Object>> ingestEdges(@RequestBody List<InteractionEdge> edges) {
        InteractionGraph graph = graphService.ingestEdges(edges);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("accepted", edges.size());
        response.put("nodeCount", graph.nodeCount());
        response.put("edgeCount", graph.edgeCount());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/status")
    @Operation(summary = "Get graph status",
               description = "Returns snapshot metadata: node and edge counts, stored records, last refresh time")
    public ResponseEntity<Map<String, Object>> getGraphStatus() {
        return ResponseEntity.ok(graphService.status());
    }

    @GetMapping("/spreaders")
    @Operation(summary = "Get top super-spreaders",
               description = "Accounts ranked by weighted degree, then degree, then id, with a population-relative risk tier")
    public ResponseEntity<List<NodeRankingEntry>> getTopSpreaders(
            @Parameter(description = "Number of accounts to return (>= 1)", example = "10")
            @RequestParam(required = false) Integer topN) {
        int n = topN != null ? topN : graphConfig.getRanking().getDefaultTopN();
        return ResponseEntity.ok(graphService.rank(n));
    }

    @GetMapping("/filter")
    @Operation(summary = "Filter by minimum connections",
               description = "Keeps accounts with at least minConnections neighbors and the edges between them; " +
                       "returns the kept graph and its statistics")
    public ResponseEntity<Map<String, Object>> filter(
            @Parameter(description = "Minimum degree to keep a node (>= 0)", example = "2")
            @RequestParam(required = false) Integer minConnections) {
        int min = minConnections != null ? minConnections : graphConfig.getLayout().getDefaultMinConnections();
        FilteredNetwork filtered = graphService.filter(min);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("minConnections", filtered.minConnections());
        response.put("statistics", filtered.statistics());
        response.put("nodes", filtered.graph().getNodes());
        response.put("edges", filtered.graph().getEdges());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/layout")
    @Operation(summary = "Compute node positions",
               description = "Algorithms: force-directed (spring), circular, random, stress-majorization (kamada-kawai). " +
                       "Seeded algorithms use the configured default seed when none is given.")
    public ResponseEntity<Map<String, NodePosition>> layout(
            @Parameter(description = "Layout algorithm", example = "force-directed")
            @RequestParam(defaultValue = "force-directed") String algorithm,
            @Parameter(description = "Random seed for seeded algorithms", example = "42")
            @RequestParam(required = false) Long seed) {
        return ResponseEntity.ok(graphService.layout(LayoutAlgorithm.fromName(algorithm), seed));
    }

    @GetMapping("/updates")
    @Operation(summary = "Poll snapshot diffs",
               description = "Returns graph changes published after the given sequence number, oldest first")
    public ResponseEntity<List<NetworkUpdateEvent>> getUpdates(
            @Parameter(description = "Last sequence number already seen", example = "0")
            @RequestParam(defaultValue = "0") long after) {
        return ResponseEntity.ok(graphService.updatesAfter(after));
    }
}
