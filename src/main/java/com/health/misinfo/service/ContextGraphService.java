package com.health.misinfo.service;

import com.health.misinfo.config.GraphConfig;
import com.health.misinfo.config.MetricsConfig;
import com.health.misinfo.engine.filter.NetworkFilter;
import com.health.misinfo.engine.graph.GraphBuilder;
import com.health.misinfo.engine.graph.SnapshotDiffer;
import com.health.misinfo.engine.layout.LayoutEngine;
import com.health.misinfo.engine.ranking.CentralityRanker;
import com.health.misinfo.exception.InvalidEdgeException;
import com.health.misinfo.model.FilteredNetwork;
import com.health.misinfo.model.InteractionEdge;
import com.health.misinfo.model.InteractionGraph;
import com.health.misinfo.model.LayoutAlgorithm;
import com.health.misinfo.model.NetworkUpdateEvent;
import com.health.misinfo.model.NodePosition;
import com.health.misinfo.model.NodeRankingEntry;
import com.health.misinfo.repository.EdgeRepository;
import com.health.misinfo.repository.PostRepository;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Owns the current interaction graph snapshot and answers ranking, filtering and layout
 * requests against it.
 *
 * The snapshot is rebuilt from the edge store (plus post authors as isolated nodes) on
 * ingestion and on a schedule, then swapped in atomically. Every rebuild that changes the
 * graph publishes its diff to the {@link NetworkUpdateFeed}. The engines themselves hold
 * no state; each request works on whichever snapshot is current when it starts.
 */
@Service
public class ContextGraphService {

    private static final Logger log = LoggerFactory.getLogger(ContextGraphService.class);

    private final EdgeRepository edgeRepository;
    private final PostRepository postRepository;
    private final GraphBuilder graphBuilder;
    private final CentralityRanker ranker;
    private final NetworkFilter networkFilter;
    private final LayoutEngine layoutEngine;
    private final SnapshotDiffer snapshotDiffer;
    private final NetworkUpdateFeed updateFeed;
    private final GraphConfig graphConfig;
    private final MetricsConfig metricsConfig;

    private volatile InteractionGraph snapshot = InteractionGraph.empty();

    // Store versions the current snapshot was built from; -1 forces the first build
    private volatile long builtEdgeVersion = -1;
    private volatile long builtPostVersion = -1;

    private volatile Instant lastRefreshTime = Instant.EPOCH;

    public ContextGraphService(EdgeRepository edgeRepository,
                               PostRepository postRepository,
                               GraphBuilder graphBuilder,
                               CentralityRanker ranker,
                               NetworkFilter networkFilter,
                               LayoutEngine layoutEngine,
                               SnapshotDiffer snapshotDiffer,
                               NetworkUpdateFeed updateFeed,
                               GraphConfig graphConfig,
                               MetricsConfig metricsConfig) {
        this.edgeRepository = edgeRepository;
        this.postRepository = postRepository;
        this.graphBuilder = graphBuilder;
        this.ranker = ranker;
        this.networkFilter = networkFilter;
        this.layoutEngine = layoutEngine;
        this.snapshotDiffer = snapshotDiffer;
        this.updateFeed = updateFeed;
        this.graphConfig = graphConfig;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        refreshGraph();
    }

    /**
     * Validate and store a batch of interaction records, then rebuild the snapshot.
     * The batch is all-or-nothing: one invalid record rejects the whole batch and leaves
     * both the store and the current snapshot untouched.
     *
     * @return the new snapshot
     * @throws InvalidEdgeException naming the first invalid record
     */
    public InteractionGraph ingestEdges(List<InteractionEdge> edges) {
        try {
            for (InteractionEdge edge : edges) {
                graphBuilder.validate(edge);
            }
        } catch (InvalidEdgeException e) {
            metricsConfig.recordEdgesRejected(edges.size());
            log.warn("Rejected batch of {} interaction records: {}", edges.size(), e.getMessage());
            throw e;
        }

        edgeRepository.saveAll(edges);
        log.info("Ingested {} interaction records", edges.size());
        refreshGraph();
        return snapshot;
    }

    @Scheduled(fixedDelayString = "${graph.refresh-ms:60000}", initialDelayString = "${graph.refresh-ms:60000}")
    public void scheduledRefresh() {
        try {
            refreshGraph();
        } catch (RuntimeException e) {
            log.error("Scheduled graph refresh failed; keeping previous snapshot", e);
        }
    }

    /**
     * Rebuild the snapshot if the edge or post store changed since the last build.
     */
    @Observed(name = "graph.rebuild", contextualName = "rebuild-context-graph")
    public synchronized void refreshGraph() {
        long edgeVersion = edgeRepository.getVersion();
        long postVersion = postRepository.getVersion();
        if (edgeVersion == builtEdgeVersion && postVersion == builtPostVersion) {
            log.debug("Edge and post stores unchanged, skipping graph rebuild");
            return;
        }

        log.info("Refreshing context graph...");
        Instant start = Instant.now();

        List<InteractionEdge> edges = edgeRepository.findAll();
        List<String> authors = graphConfig.isIncludePostAuthors()
                ? postRepository.findAllAuthorIds()
                : Collections.emptyList();
        InteractionGraph rebuilt = graphBuilder.build(edges, authors);

        InteractionGraph previous = this.snapshot;
        this.snapshot = rebuilt;
        this.builtEdgeVersion = edgeVersion;
        this.builtPostVersion = postVersion;
        this.lastRefreshTime = Instant.now();

        NetworkUpdateEvent diff = snapshotDiffer.diff(previous, rebuilt);
        if (!diff.isEmpty()) {
            NetworkUpdateEvent event = updateFeed.publish(diff, lastRefreshTime.toEpochMilli());
            log.info("Published network update #{}: +{} nodes, -{} nodes, +{} edges, -{} edges, {} reweighted",
                    event.getSequence(), diff.getAddedNodes().size(), diff.getRemovedNodes().size(),
                    diff.getAddedEdges().size(), diff.getRemovedEdges().size(), diff.getReweightedEdges().size());
        }

        Duration took = Duration.between(start, lastRefreshTime);
        metricsConfig.recordGraphRebuild(rebuilt.nodeCount(), rebuilt.edgeCount(), took);
        log.info("Context graph refreshed: {} records, {} nodes, {} edges, took {}ms",
                edges.size(), rebuilt.nodeCount(), rebuilt.edgeCount(), took.toMillis());
    }

    public InteractionGraph getSnapshot() {
        return snapshot;
    }

    public List<NodeRankingEntry> rank(int topN) {
        return ranker.rank(snapshot, topN);
    }

    public List<NodeRankingEntry> rankAll() {
        return ranker.rankAll(snapshot);
    }

    public FilteredNetwork filter(int minConnections) {
        return networkFilter.filter(snapshot, minConnections);
    }

    /**
     * Layout of the current snapshot. A missing seed falls back to the configured default.
     */
    public Map<String, NodePosition> layout(LayoutAlgorithm algorithm, Long seed) {
        return layoutEngine.layout(snapshot, algorithm, seed != null ? seed : graphConfig.getDefaultSeed());
    }

    public List<NetworkUpdateEvent> updatesAfter(long sequence) {
        return updateFeed.eventsAfter(sequence);
    }

    /** Whether the graph has been built at least once. */
    public boolean isGraphReady() {
        return !lastRefreshTime.equals(Instant.EPOCH);
    }

    public Map<String, Object> status() {
        InteractionGraph current = snapshot;
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("isReady", isGraphReady());
        status.put("nodeCount", current.nodeCount());
        status.put("edgeCount", current.edgeCount());
        status.put("storedRecords", edgeRepository.count());
        status.put("lastUpdateSequence", updateFeed.getLastSequence());
        status.put("lastRefreshTime", lastRefreshTime.toString());
        return status;
    }
}
