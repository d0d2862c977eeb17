package com.health.misinfo.service;

import com.health.misinfo.config.RiskScoringConfig;
import com.health.misinfo.exception.InvalidParameterException;
import com.health.misinfo.model.FilteredNetwork;
import com.health.misinfo.model.InteractionGraph;
import com.health.misinfo.model.LayoutAlgorithm;
import com.health.misinfo.model.NetworkGraph;
import com.health.misinfo.model.NodePair;
import com.health.misinfo.model.NodePosition;
import com.health.misinfo.model.NodeRankingEntry;
import com.health.misinfo.model.PostQuery;
import com.health.misinfo.model.PostRecord;
import com.health.misinfo.model.PostSummaryReport;
import com.health.misinfo.model.RiskLevel;
import com.health.misinfo.model.ScoreBucket;
import com.health.misinfo.model.ScoredPost;
import com.health.misinfo.model.TimelinePoint;
import com.health.misinfo.model.TopicCount;
import io.micrometer.observation.annotation.Observed;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

@Service
public class AnalyticsService {

    private static final int TOP_SPREADERS_IN_SUMMARY = 5;

    private final PostService postService;
    private final ContextGraphService graphService;
    private final RiskScoringConfig scoringConfig;

    public AnalyticsService(PostService postService,
                            ContextGraphService graphService,
                            RiskScoringConfig scoringConfig) {
        this.postService = postService;
        this.graphService = graphService;
        this.scoringConfig = scoringConfig;
    }

    /**
     * Aggregate counts over the posts matching {@code query}, plus the current top spreaders.
     */
    public PostSummaryReport summary(PostQuery query) {
        List<ScoredPost> posts = postService.matching(query);

        Map<RiskLevel, Integer> byLevel = new EnumMap<>(RiskLevel.class);
        for (RiskLevel level : RiskLevel.values()) {
            byLevel.put(level, 0);
        }
        Map<String, Integer> byPlatform = new TreeMap<>();
        Map<String, Integer> byCategory = new TreeMap<>();
        Map<String, Integer> byStatus = new TreeMap<>();
        int highRisk = 0;
        int archived = 0;
        Set<String> authors = new HashSet<>();

        for (ScoredPost scored : posts) {
            PostRecord post = scored.getPost();
            byLevel.merge(scored.getScore().getRiskLevel(), 1, Integer::sum);
            byPlatform.merge(nullToUnknown(post.getPlatform()), 1, Integer::sum);
            byCategory.merge(nullToUnknown(post.getCategory()), 1, Integer::sum);
            byStatus.merge(post.getVerificationStatus().getLabel(), 1, Integer::sum);
            if (scored.getScore().getMisinformationScore() > scoringConfig.getHighRiskAlertScore()) highRisk++;
            if (post.isArchived()) archived++;
            if (post.getUserId() != null && !post.getUserId().isBlank()) authors.add(post.getUserId());
        }

        return PostSummaryReport.builder()
                .generatedAt(System.currentTimeMillis())
                .totalPosts(posts.size())
                .postsByRiskLevel(byLevel)
                .highRiskPosts(highRisk)
                .archivedPosts(archived)
                .activeSpreaders(authors.size())
                .postsByPlatform(byPlatform)
                .postsByCategory(byCategory)
                .postsByStatus(byStatus)
                .topSpreaders(graphService.rankAll().stream().limit(TOP_SPREADERS_IN_SUMMARY).toList())
                .build();
    }

    /** Matching posts per UTC calendar day, oldest day first. */
    public List<TimelinePoint> timeline(PostQuery query) {
        Map<LocalDate, Integer> perDay = new TreeMap<>();
        for (ScoredPost scored : postService.matching(query)) {
            LocalDate day = Instant.ofEpochMilli(scored.getPost().getTimestamp()).atZone(ZoneOffset.UTC).toLocalDate();
            perDay.merge(day, 1, Integer::sum);
        }
        List<TimelinePoint> points = new ArrayList<>(perDay.size());
        perDay.forEach((day, count) -> points.add(new TimelinePoint(day, count)));
        return points;
    }

    /**
     * Most repeated post contents among the matching posts, most frequent first, then by
     * content. Posts without content are not counted.
     *
     * @throws InvalidParameterException if limit < 1
     */
    public List<TopicCount> topTopics(PostQuery query, int limit) {
        if (limit < 1) {
            throw new InvalidParameterException("limit must be >= 1, got " + limit);
        }
        Map<String, Integer> perContent = new HashMap<>();
        for (ScoredPost scored : postService.matching(query)) {
            String content = scored.getPost().getContent();
            if (content != null && !content.isBlank()) {
                perContent.merge(content, 1, Integer::sum);
            }
        }
        return perContent.entrySet().stream()
                .map(e -> new TopicCount(e.getKey(), e.getValue()))
                .sorted(Comparator.comparingInt(TopicCount::posts).reversed()
                        .thenComparing(TopicCount::content))
                .limit(limit)
                .toList();
    }

    /**
     * Distribution of scores over [0, 100] in buckets of {@code bucketWidth}. The last
     * bucket is closed so that a score of exactly 100 is counted.
     */
    public List<ScoreBucket> scoreHistogram(PostQuery query, double bucketWidth) {
        if (!(bucketWidth > 0) || bucketWidth > 100) {
            throw new InvalidParameterException("bucketWidth must be in (0, 100], got " + bucketWidth);
        }
        int bucketCount = (int) Math.ceil(100.0 / bucketWidth);
        int[] counts = new int[bucketCount];
        for (ScoredPost scored : postService.matching(query)) {
            int idx = (int) Math.floor(scored.getScore().getMisinformationScore() / bucketWidth);
            counts[Math.min(bucketCount - 1, Math.max(0, idx))]++;
        }

        List<ScoreBucket> buckets = new ArrayList<>(bucketCount);
        for (int i = 0; i < bucketCount; i++) {
            double lower = i * bucketWidth;
            double upper = Math.min(100.0, (i + 1) * bucketWidth);
            buckets.add(new ScoreBucket(lower, upper, counts[i]));
        }
        return buckets;
    }

    /**
     * Build the spread network for visualization. Positions are computed on the full graph
     * so they stay put while the connection filter changes; only the filtered nodes and
     * edges are returned.
     */
    @Observed(name = "analytics.network", contextualName = "build-network-view")
    public NetworkGraph getNetwork(LayoutAlgorithm algorithm, Long seed, int minConnections) {
        Map<String, NodePosition> positions = graphService.layout(algorithm, seed);
        FilteredNetwork filtered = graphService.filter(minConnections);
        InteractionGraph subgraph = filtered.graph();

        Map<String, NodeRankingEntry> ranking = new HashMap<>();
        for (NodeRankingEntry entry : graphService.rankAll()) {
            ranking.put(entry.getNodeId(), entry);
        }

        List<NetworkGraph.NetworkNode> nodes = new ArrayList<>();
        for (String node : subgraph.getNodes()) {
            NodePosition pos = positions.getOrDefault(node, NodePosition.ORIGIN);
            NodeRankingEntry entry = ranking.get(node);
            int degree = subgraph.degree(node);
            nodes.add(NetworkGraph.NetworkNode.builder()
                    .id(node)
                    .label(node.replace("user_", "U"))
                    .x(pos.x())
                    .y(pos.y())
                    .degree(degree)
                    .centrality(entry != null ? Math.round(entry.getCentrality() * 1000.0) / 1000.0 : 0.0)
                    .size(clamp(degree * 3 + 20, 15, 50))
                    .riskLevel(entry != null ? entry.getRiskLevel() : RiskLevel.LOW)
                    .build());
        }

        double maxWeight = 0.0;
        for (double w : subgraph.getWeights().values()) {
            maxWeight = Math.max(maxWeight, w);
        }
        List<NetworkGraph.NetworkEdge> edges = new ArrayList<>();
        for (Map.Entry<NodePair, Double> e : subgraph.getWeights().entrySet()) {
            double ratio = maxWeight > 0 ? e.getValue() / maxWeight : 0.0;
            edges.add(NetworkGraph.NetworkEdge.builder()
                    .from(e.getKey().a())
                    .to(e.getKey().b())
                    .weight(e.getValue())
                    .width(clamp(ratio * 6, 0.5, 6))
                    .opacity(clamp(ratio, 0.3, 0.8))
                    .build());
        }

        return NetworkGraph.builder()
                .algorithm(algorithm.name())
                .minConnections(minConnections)
                .nodes(nodes)
                .edges(edges)
                .statistics(filtered.statistics())
                .build();
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static String nullToUnknown(String value) {
        return value == null || value.isBlank() ? "Unknown" : value;
    }
}
