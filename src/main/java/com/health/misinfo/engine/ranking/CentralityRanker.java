package com.health.misinfo.engine.ranking;

import com.health.misinfo.config.GraphConfig;
import com.health.misinfo.exception.InvalidParameterException;
import com.health.misinfo.model.InteractionGraph;
import com.health.misinfo.model.NodeRankingEntry;
import com.health.misinfo.model.RiskLevel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ranks accounts by centrality to identify super-spreaders.
 *
 * Order: weighted degree descending, then degree descending, then node id ascending.
 * The last key is unique per node, so the order is total and identical input always
 * yields identical output.
 *
 * Risk tiers are relative to the current node population: a group of nodes with equal
 * weighted degree is HIGH only if the whole group fits inside the top {@code ceil(n * highFraction)}
 * positions, MEDIUM only if it fits inside the top {@code ceil(n * mediumFraction)}, LOW
 * otherwise. Nodes with equal weighted degree always share a tier, and nodes without
 * edges are always LOW.
 */
@Component
public class CentralityRanker {

    static final Comparator<NodeRankingEntry> RANKING_ORDER = Comparator
            .comparingDouble(NodeRankingEntry::getWeightedDegree).reversed()
            .thenComparing(Comparator.comparingInt(NodeRankingEntry::getDegree).reversed())
            .thenComparing(NodeRankingEntry::getNodeId);

    private final GraphConfig graphConfig;

    public CentralityRanker(GraphConfig graphConfig) {
        this.graphConfig = graphConfig;
    }

    /**
     * Top {@code topN} spreaders. Returns every node when the graph has fewer than topN.
     *
     * @throws InvalidParameterException if topN < 1
     */
    public List<NodeRankingEntry> rank(InteractionGraph graph, int topN) {
        if (topN < 1) {
            throw new InvalidParameterException("topN must be >= 1, got " + topN);
        }
        List<NodeRankingEntry> all = rankAll(graph);
        return all.size() <= topN ? all : List.copyOf(all.subList(0, topN));
    }

    /** Every node of the graph in ranking order. */
    public List<NodeRankingEntry> rankAll(InteractionGraph graph) {
        int n = graph.nodeCount();
        List<NodeRankingEntry> entries = new ArrayList<>(n);
        for (String node : graph.getNodes()) {
            int degree = graph.degree(node);
            entries.add(NodeRankingEntry.builder()
                    .nodeId(node)
                    .degree(degree)
                    .weightedDegree(graph.weightedDegree(node))
                    .centrality(n > 1 ? (double) degree / (n - 1) : 0.0)
                    .build());
        }
        entries.sort(RANKING_ORDER);

        int highSlots = tierSlots(n, graphConfig.getRanking().getHighFraction());
        int mediumSlots = tierSlots(n, graphConfig.getRanking().getMediumFraction());

        // tie groups are contiguous because weighted degree is the primary sort key
        int groupStart = 0;
        while (groupStart < n) {
            double weight = entries.get(groupStart).getWeightedDegree();
            int groupEnd = groupStart + 1;
            while (groupEnd < n && entries.get(groupEnd).getWeightedDegree() == weight) {
                groupEnd++;
            }
            RiskLevel tier = classify(weight, groupEnd, highSlots, mediumSlots);
            for (int i = groupStart; i < groupEnd; i++) {
                NodeRankingEntry entry = entries.get(i);
                entry.setRank(i + 1);
                entry.setRiskLevel(tier);
            }
            groupStart = groupEnd;
        }
        return List.copyOf(entries);
    }

    /**
     * @param groupEnd number of nodes ranked at or above the tie group, the group included
     */
    private static RiskLevel classify(double weightedDegree, int groupEnd, int highSlots, int mediumSlots) {
        if (weightedDegree <= 0.0) return RiskLevel.LOW;
        if (groupEnd <= highSlots) return RiskLevel.HIGH;
        if (groupEnd <= mediumSlots) return RiskLevel.MEDIUM;
        return RiskLevel.LOW;
    }

    /** Number of leading positions covered by the top {@code fraction} of the population. */
    private static int tierSlots(int n, double fraction) {
        if (!(fraction > 0.0)) return 0;
        return (int) Math.min(n, Math.ceil(n * fraction));
    }
}
