package com.health.misinfo.engine.filter;

import com.health.misinfo.exception.InvalidParameterException;
import com.health.misinfo.model.FilteredNetwork;
import com.health.misinfo.model.InteractionGraph;
import com.health.misinfo.model.NetworkStatistics;
import com.health.misinfo.model.NodePair;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Minimum-connections filter and aggregate network statistics.
 */
@Component
public class NetworkFilter {

    /**
     * Keep nodes whose degree in {@code graph} is at least {@code minConnections}, then keep
     * exactly the edges whose two endpoints were kept.
     *
     * @throws InvalidParameterException if minConnections < 0
     */
    public FilteredNetwork filter(InteractionGraph graph, int minConnections) {
        if (minConnections < 0) {
            throw new InvalidParameterException("minConnections must be >= 0, got " + minConnections);
        }

        SortedSet<String> kept = new TreeSet<>();
        for (String node : graph.getNodes()) {
            if (graph.degree(node) >= minConnections) {
                kept.add(node);
            }
        }

        SortedMap<NodePair, Double> keptWeights = new TreeMap<>();
        for (Map.Entry<NodePair, Double> entry : graph.getWeights().entrySet()) {
            NodePair pair = entry.getKey();
            if (kept.contains(pair.a()) && kept.contains(pair.b())) {
                keptWeights.put(pair, entry.getValue());
            }
        }

        InteractionGraph subgraph = InteractionGraph.of(kept, keptWeights);
        return new FilteredNetwork(minConnections, subgraph, statistics(subgraph));
    }

    public NetworkStatistics statistics(InteractionGraph graph) {
        int n = graph.nodeCount();
        int e = graph.edgeCount();

        double density = 0.0;
        if (n >= 2) {
            double maxEdges = (double) n * (n - 1) / 2.0;
            density = e / maxEdges;
        }
        double avgDegree = n > 0 ? (2.0 * e) / n : 0.0;

        return NetworkStatistics.builder()
                .nodeCount(n)
                .edgeCount(e)
                .density(density)
                .avgDegree(avgDegree)
                .build();
    }
}
